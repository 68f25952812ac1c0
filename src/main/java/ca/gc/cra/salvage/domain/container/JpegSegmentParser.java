package ca.gc.cra.salvage.domain.container;

import static ca.gc.cra.salvage.domain.util.Bytes.u16be;
import static ca.gc.cra.salvage.domain.util.Bytes.u8;

import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import ca.gc.cra.salvage.domain.util.Bytes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Marker walker for JPEG streams.
 * <p><strong>Role:</strong> Domain parser backing the structural check, the classifier and the repair techniques.</p>
 * <p>The walk starts at the first SOI anywhere in the stream, follows length-prefixed segments, skips
 * entropy-coded scan data (honouring {@code FF00} stuffing and restart markers) and stops at EOI or the end of the
 * stream. A declared length that does not land on a marker is reported as an inconsistent segment and the walker
 * resynchronises on the next marker.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class JpegSegmentParser implements ContainerParser {

  @Override
  public ImageFormat format() {
    return ImageFormat.JPEG;
  }

  @Override
  public ContainerStructure parse(byte[] data) throws MalformedContainerException {
    Objects.requireNonNull(data, "data");
    int start = Bytes.indexOf(data, JpegMarkers.SOI_BYTES, 0);
    if (start < 0) {
      throw new MalformedContainerException(ImageFormat.JPEG, data.length, "no start-of-image marker");
    }
    return new Walk(data, start).run();
  }

  private static final class Walk {
    private final byte[] data;
    private final int n;
    private final int start;
    private final List<Segment> segments = new ArrayList<>();
    private int boundary;
    private boolean hasEnd;
    private boolean imageContent;
    private boolean scanData;
    private boolean trailingPartialMarker;
    private int foreignStart = -1;
    private int shortfall;
    private int stoppedAt;
    private EndState endState;

    private Walk(byte[] data, int start) {
      this.data = data;
      this.n = data.length;
      this.start = start;
    }

    private ContainerStructure run() {
      segments.add(Segment.consistent("SOI", start, 2));
      int pos = start + 2;
      boundary = pos;
      while (endState == null) {
        pos = step(pos);
      }
      return new ContainerStructure(
          ImageFormat.JPEG,
          start,
          hasEnd,
          segments,
          stoppedAt,
          endState,
          shortfall,
          trailingPartialMarker,
          foreignStart,
          boundary,
          imageContent,
          scanData);
    }

    /** Consumes one unit starting at {@code pos} and returns the next position. */
    private int step(int pos) {
      if (pos >= n) {
        return stop(EndState.AT_SEGMENT_BOUNDARY, n);
      }
      if (u8(data, pos) != 0xFF) {
        return skipUnparsed(pos, pos, "expected marker, found 0x" + String.format("%02X", u8(data, pos)));
      }
      int m = pos + 1;
      while (m < n && u8(data, m) == 0xFF) {
        m++;
      }
      if (m >= n) {
        trailingPartialMarker = true;
        return stop(EndState.AT_SEGMENT_BOUNDARY, pos);
      }
      int markerOffset = m - 1;
      int marker = u8(data, m);
      if (marker == JpegMarkers.EOI) {
        segments.add(Segment.consistent("EOI", markerOffset, 2));
        hasEnd = true;
        boundary = m + 1;
        return stop(EndState.COMPLETE, m + 1);
      }
      if (marker == JpegMarkers.SOI) {
        foreignStart = markerOffset;
        return stop(EndState.AT_SEGMENT_BOUNDARY, markerOffset);
      }
      if (JpegMarkers.isStandalone(marker)) {
        segments.add(Segment.consistent(JpegMarkers.name(marker), markerOffset, 2));
        boundary = m + 1;
        return m + 1;
      }
      if (!JpegMarkers.isKnownMarker(marker)) {
        return skipUnparsed(markerOffset, m + 1, "invalid marker code 0x" + String.format("%02X", marker));
      }
      if (m + 2 >= n) {
        shortfall = m + 3 - n;
        return stop(EndState.IN_SEGMENT, markerOffset);
      }
      int length = u16be(data, m + 1);
      String kind = JpegMarkers.name(marker);
      if (length < 2) {
        segments.add(Segment.inconsistent(kind, markerOffset, 4, "declared length " + length + " below minimum"));
        return resync(m + 3);
      }
      int segmentEnd = m + 1 + length;
      if (segmentEnd > n) {
        shortfall = segmentEnd - n;
        return stop(EndState.IN_SEGMENT, markerOffset);
      }
      boolean landsOnMarker = segmentEnd == n || u8(data, segmentEnd) == 0xFF;
      if (marker != JpegMarkers.SOS && !landsOnMarker) {
        segments.add(Segment.inconsistent(kind, markerOffset, segmentEnd - markerOffset,
            "declared length " + length + " does not end on a marker"));
        return resync(m + 3);
      }
      segments.add(Segment.consistent(kind, markerOffset, segmentEnd - markerOffset));
      if (JpegMarkers.definesImage(kind)) {
        imageContent = true;
      }
      boundary = segmentEnd;
      if (marker != JpegMarkers.SOS) {
        return segmentEnd;
      }
      scanData = true;
      return walkEntropyData(segmentEnd);
    }

    private int walkEntropyData(int from) {
      int p = from;
      while (p < n) {
        if (u8(data, p) == 0xFF) {
          if (p + 1 >= n) {
            break;
          }
          int next = u8(data, p + 1);
          if (next == 0x00 || (next >= JpegMarkers.RST0 && next <= JpegMarkers.RST7)) {
            p += 2;
            continue;
          }
          if (next == 0xFF) {
            p++;
            continue;
          }
          break;
        }
        p++;
      }
      if (p > from) {
        segments.add(Segment.consistent(Segment.ENTROPY_DATA, from, p - from));
      }
      boundary = p;
      if (p >= n) {
        return stop(EndState.IN_SCAN_DATA, n);
      }
      if (p == n - 1) {
        trailingPartialMarker = true;
        return stop(EndState.IN_SCAN_DATA, p);
      }
      return p;
    }

    private int skipUnparsed(int from, int searchFrom, String diagnostic) {
      int next = nextMarker(searchFrom);
      int stop = next < 0 ? n : next;
      segments.add(Segment.inconsistent(Segment.UNPARSED, from, stop - from, diagnostic));
      if (next < 0) {
        return stop(EndState.AT_SEGMENT_BOUNDARY, n);
      }
      return next;
    }

    private int resync(int searchFrom) {
      int next = nextMarker(searchFrom);
      if (next < 0) {
        return stop(EndState.AT_SEGMENT_BOUNDARY, n);
      }
      return next;
    }

    private int nextMarker(int from) {
      for (int i = Math.max(from, start + 2); i + 1 < n; i++) {
        if (u8(data, i) == 0xFF && u8(data, i + 1) != 0xFF && JpegMarkers.isKnownMarker(u8(data, i + 1))) {
          return i;
        }
      }
      return -1;
    }

    private int stop(EndState state, int offset) {
      endState = state;
      stoppedAt = offset;
      return offset;
    }
  }
}
