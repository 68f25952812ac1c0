package ca.gc.cra.salvage.domain.classify;

import java.util.Locale;

/**
 * Tri-state validity classification of an artifact.
 *
 * @since 0.1.0
 */
public enum Classification {
  /** Every check passed. */
  VALID,
  /** Some checks passed and some failed. */
  CORRUPTED,
  /** No check passed, no container was found, or the artifact is a false positive. */
  UNRECOVERABLE;

  public String reportName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Classification fromReportName(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("classification must not be blank");
    }
    return valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}
