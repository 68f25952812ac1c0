package ca.gc.cra.salvage.domain.container;

import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Structural facts reported by a {@link ContainerParser}.
 * <p><strong>Why:</strong> Truncation, misplaced start markers and bad checksums are expected in recovered evidence,
 * so they are described here rather than thrown.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param format container format the walk followed
 * @param startOffset offset of the start marker or signature; non-zero means leading garbage
 * @param hasEndMarker whether the end marker was reached
 * @param segments ordered units found by the walk
 * @param stoppedAtOffset offset at which the walk stopped
 * @param endState where the walk stopped
 * @param shortfall bytes missing from a unit cut off by the end of the stream ({@link EndState#IN_SEGMENT} only)
 * @param trailingPartialMarker whether the stream ends with the first byte of a marker
 * @param foreignStartOffset offset of a second start marker found inside this container, or {@code -1}
 * @param lastMarkerBoundary exclusive end of the last complete, consistent unit
 * @param hasImageContent whether any image-defining unit (frame, tables, scan, IHDR, IDAT) was found
 * @param hasScanData whether compressed image data (JPEG scan, PNG IDAT) was reached
 * @since 0.1.0
 */
public record ContainerStructure(
    ImageFormat format,
    int startOffset,
    boolean hasEndMarker,
    List<Segment> segments,
    int stoppedAtOffset,
    EndState endState,
    int shortfall,
    boolean trailingPartialMarker,
    int foreignStartOffset,
    int lastMarkerBoundary,
    boolean hasImageContent,
    boolean hasScanData) {

  public ContainerStructure {
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(endState, "endState");
    segments = List.copyOf(Objects.requireNonNull(segments, "segments"));
    if (startOffset < 0) {
      throw new IllegalArgumentException("startOffset must be non-negative");
    }
  }

  /**
   * Whether the start marker sits at offset zero, where readers expect it.
   *
   * @return {@code true} when no garbage precedes the container
   */
  public boolean hasStartMarker() {
    return startOffset == 0;
  }

  /**
   * Units whose declared length or checksum disagreed with the bytes.
   *
   * @return inconsistent segments in stream order
   */
  public List<Segment> inconsistentSegments() {
    return segments.stream().filter(segment -> !segment.consistent()).toList();
  }

  /**
   * Whether every unit parsed was consistent.
   *
   * @return {@code true} when no inconsistencies were found
   */
  public boolean isConsistent() {
    return segments.stream().allMatch(Segment::consistent);
  }

  /**
   * Offset of a foreign start marker, if one was found.
   *
   * @return foreign start offset
   */
  public OptionalInt foreignStart() {
    return foreignStartOffset < 0 ? OptionalInt.empty() : OptionalInt.of(foreignStartOffset);
  }

  /**
   * First unit with the given kind.
   *
   * @param kind marker or chunk tag
   * @return matching segment
   */
  public Optional<Segment> first(String kind) {
    return segments.stream().filter(segment -> segment.kind().equals(kind)).findFirst();
  }

  /**
   * Whether the walk found a complete, consistent container from start to end marker.
   *
   * @return {@code true} for a structurally sound container
   */
  public boolean isStructurallySound() {
    return hasEndMarker && hasImageContent && isConsistent() && foreignStartOffset < 0;
  }
}
