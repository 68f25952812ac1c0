package ca.gc.cra.salvage.domain.classify;

import java.util.Locale;

/**
 * Byte-level reconstruction techniques available to the repair engine.
 *
 * @since 0.1.0
 */
public enum RepairTechnique {
  /** Append the end marker, falling back to truncation at the last marker boundary. */
  FOOTER_APPEND,
  /** Discard leading garbage or synthesize a minimal header in front of the recovered tables and scan data. */
  HEADER_RECONSTRUCTION,
  /** Drop inconsistent non-critical segments and re-emit the rest in order. */
  SEGMENT_STRIPPING,
  /** Decode leniently and re-encode only the rows that decoded. */
  PARTIAL_DECODE_REENCODE;

  public String reportName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static RepairTechnique fromReportName(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("technique must not be blank");
    }
    return valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}
