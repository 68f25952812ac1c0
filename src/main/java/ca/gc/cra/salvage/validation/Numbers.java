package ca.gc.cra.salvage.validation;

/**
 * Numeric validation helpers used by CLI and configuration parsing.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates a percentage.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate percentage
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is NaN or outside {@code [0, 100]}
   */
  public static double requirePercent(String name, double value) {
    if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
      throw new IllegalArgumentException(label(name) + " must be between 0 and 100 (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
