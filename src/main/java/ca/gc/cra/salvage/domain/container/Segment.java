package ca.gc.cra.salvage.domain.container;

import java.util.Objects;
import java.util.Optional;

/**
 * Typed span within an artifact produced by a {@link ContainerParser}.
 *
 * <p>{@code kind} is the JPEG marker name ({@code SOI}, {@code DQT}, {@code SOF0}, {@code SOS}, ...), the PNG
 * chunk type ({@code IHDR}, {@code IDAT}, ...), {@link #ENTROPY_DATA} for JPEG scan data, {@link #SIGNATURE} for the
 * PNG signature, or {@link #UNPARSED} for bytes the walker had to skip while resynchronising.</p>
 *
 * @param kind marker or chunk tag
 * @param offset offset of the first byte of the unit (marker prefix or chunk length field)
 * @param length total byte length of the unit
 * @param consistent {@code false} when the declared length or checksum disagrees with the bytes
 * @param diagnostic explanation for an inconsistent or partial unit
 * @since 0.1.0
 */
public record Segment(String kind, int offset, int length, boolean consistent, Optional<String> diagnostic) {
  /** Kind used for JPEG entropy-coded scan data following an SOS header. */
  public static final String ENTROPY_DATA = "ECS";
  /** Kind used for the PNG file signature. */
  public static final String SIGNATURE = "SIGNATURE";
  /** Kind used for bytes skipped while searching for the next marker or chunk. */
  public static final String UNPARSED = "UNPARSED";

  public Segment {
    Objects.requireNonNull(kind, "kind");
    if (offset < 0 || length < 0) {
      throw new IllegalArgumentException("offset and length must be non-negative");
    }
    diagnostic = Objects.requireNonNullElse(diagnostic, Optional.empty());
  }

  static Segment consistent(String kind, int offset, int length) {
    return new Segment(kind, offset, length, true, Optional.empty());
  }

  static Segment inconsistent(String kind, int offset, int length, String diagnostic) {
    return new Segment(kind, offset, length, false, Optional.of(diagnostic));
  }

  /**
   * Offset one past the last byte of this unit.
   *
   * @return exclusive end offset
   */
  public int end() {
    return offset + length;
  }
}
