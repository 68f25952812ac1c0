package ca.gc.cra.salvage.domain.container;

import static ca.gc.cra.salvage.domain.util.Bytes.u32be;

import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import ca.gc.cra.salvage.domain.util.Bytes;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.zip.CRC32;

/**
 * <strong>What:</strong> Chunk walker for PNG streams.
 * <p>Walks the eight-byte signature followed by {@code length | type | data | crc} chunks. Each CRC is recomputed
 * over type and data; mismatches are reported as inconsistent segments, never repaired. A chunk type that is not
 * four ASCII letters marks a bad declared length upstream; the walker then resynchronises on the next known chunk
 * type.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class PngChunkParser implements ContainerParser {
  /** Complete IEND chunk (zero length, type, CRC). */
  public static final byte[] IEND_CHUNK =
      Bytes.of(0x00, 0x00, 0x00, 0x00, 'I', 'E', 'N', 'D', 0xAE, 0x42, 0x60, 0x82);

  private static final int CHUNK_OVERHEAD = 12;
  private static final List<byte[]> RESYNC_TYPES = List.of(
      "IHDR".getBytes(StandardCharsets.US_ASCII),
      "PLTE".getBytes(StandardCharsets.US_ASCII),
      "IDAT".getBytes(StandardCharsets.US_ASCII),
      "IEND".getBytes(StandardCharsets.US_ASCII));

  @Override
  public ImageFormat format() {
    return ImageFormat.PNG;
  }

  @Override
  public ContainerStructure parse(byte[] data) throws MalformedContainerException {
    Objects.requireNonNull(data, "data");
    byte[] signature = ImageFormat.PNG.signature();
    int start = Bytes.indexOf(data, signature, 0);
    if (start < 0) {
      throw new MalformedContainerException(ImageFormat.PNG, data.length, "no PNG signature");
    }
    int n = data.length;
    List<Segment> segments = new ArrayList<>();
    segments.add(Segment.consistent(Segment.SIGNATURE, start, signature.length));
    int pos = start + signature.length;
    int boundary = pos;
    boolean hasEnd = false;
    boolean imageContent = false;
    boolean scanData = false;
    int foreignStart = -1;
    int shortfall = 0;
    EndState endState;
    int stoppedAt;

    while (true) {
      if (pos >= n) {
        endState = EndState.AT_SEGMENT_BOUNDARY;
        stoppedAt = n;
        break;
      }
      if (Bytes.startsWith(data, signature, pos)) {
        foreignStart = pos;
        endState = EndState.AT_SEGMENT_BOUNDARY;
        stoppedAt = pos;
        break;
      }
      if (pos + 8 > n) {
        shortfall = pos + CHUNK_OVERHEAD - n;
        endState = EndState.IN_SEGMENT;
        stoppedAt = pos;
        break;
      }
      String type = new String(data, pos + 4, 4, StandardCharsets.ISO_8859_1);
      if (!isChunkType(type)) {
        int next = nextKnownChunk(data, pos + 1);
        int stop = next < 0 ? n : next;
        segments.add(Segment.inconsistent(Segment.UNPARSED, pos, stop - pos, "invalid chunk type at offset " + pos));
        if (next < 0) {
          endState = EndState.AT_SEGMENT_BOUNDARY;
          stoppedAt = n;
          break;
        }
        pos = next;
        continue;
      }
      long declared = u32be(data, pos);
      long chunkEnd = pos + CHUNK_OVERHEAD + declared;
      if (declared > Integer.MAX_VALUE || chunkEnd > n) {
        shortfall = (int) Math.min(Integer.MAX_VALUE, chunkEnd - n);
        endState = EndState.IN_SEGMENT;
        stoppedAt = pos;
        break;
      }
      int length = (int) declared;
      long expectedCrc = u32be(data, pos + 8 + length);
      CRC32 crc = new CRC32();
      crc.update(data, pos + 4, 4 + length);
      int total = CHUNK_OVERHEAD + length;
      if (crc.getValue() == expectedCrc) {
        segments.add(Segment.consistent(type, pos, total));
        boundary = pos + total;
      } else {
        segments.add(Segment.inconsistent(type, pos, total, String.format(
            "CRC mismatch: stored %08X, computed %08X", expectedCrc, crc.getValue())));
      }
      if (type.equals("IHDR") || type.equals("IDAT")) {
        imageContent = true;
      }
      if (type.equals("IDAT")) {
        scanData = true;
      }
      pos += total;
      if (type.equals("IEND")) {
        hasEnd = true;
        endState = EndState.COMPLETE;
        stoppedAt = pos;
        break;
      }
    }

    return new ContainerStructure(
        ImageFormat.PNG,
        start,
        hasEnd,
        segments,
        stoppedAt,
        endState,
        shortfall,
        false,
        foreignStart,
        boundary,
        imageContent,
        scanData);
  }

  /**
   * Whether a chunk kind must survive segment stripping.
   *
   * @param kind chunk type or pseudo kind
   * @return {@code true} for IHDR, PLTE, IDAT, IEND and the signature
   */
  public static boolean isCritical(String kind) {
    return switch (kind) {
      case "IHDR", "PLTE", "IDAT", "IEND", Segment.SIGNATURE -> true;
      default -> false;
    };
  }

  private static boolean isChunkType(String type) {
    for (int i = 0; i < type.length(); i++) {
      char c = type.charAt(i);
      if (!((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z'))) {
        return false;
      }
    }
    return true;
  }

  private static int nextKnownChunk(byte[] data, int from) {
    int best = -1;
    for (byte[] type : RESYNC_TYPES) {
      int idx = Bytes.indexOf(data, type, from + 4);
      if (idx >= 4 && (best < 0 || idx - 4 < best)) {
        best = idx - 4;
      }
    }
    return best;
  }
}
