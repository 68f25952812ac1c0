package ca.gc.cra.salvage.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings read from the CLI, configuration files and catalogs.
 * <p><strong>Why:</strong> Artifact identifiers, check names and operator identities end up in evidence reports,
 * so blank or control-character values are rejected before any stage runs.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Restrict tool and check names to a safe identifier character set.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a short identifier such as an external check name.
   *
   * @param name logical parameter name included in exception messages
   * @param value candidate identifier
   * @return trimmed identifier matching {@code [A-Za-z0-9._-]+}
   * @throws IllegalArgumentException if the identifier contains unsupported characters
   */
  public static String requireIdentifier(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!IDENTIFIER_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Validates a bounded printable-ASCII value such as an OpenTelemetry resource attribute list.
   *
   * @param name logical parameter name included in exception messages
   * @param value candidate text
   * @param maxLength maximum permitted length after trimming
   * @return trimmed value
   * @throws IllegalArgumentException if the value is too long or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
