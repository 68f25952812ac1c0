package ca.gc.cra.salvage.domain.classify;

import java.util.Locale;

/**
 * Confidence attached to classifications and batch decisions.
 *
 * @since 0.1.0
 */
public enum Confidence {
  HIGH,
  MEDIUM,
  LOW;

  /**
   * Confidence after {@code steps} downgrades, floored at {@link #LOW}.
   *
   * @param steps number of downgrades
   * @return lowered confidence
   */
  public Confidence lowered(int steps) {
    int index = Math.min(values().length - 1, ordinal() + Math.max(0, steps));
    return values()[index];
  }

  public String reportName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Confidence fromReportName(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("confidence must not be blank");
    }
    return valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}
