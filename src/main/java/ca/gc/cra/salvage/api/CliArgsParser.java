package ca.gc.cra.salvage.api;

import ca.gc.cra.salvage.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} arguments into a lookup map. Dotted keys such as {@code override.strategy} are allowed.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Splits each argument on its first {@code '='}. A repeated key keeps the last value.
   *
   * @param args arguments left after flag extraction; {@code null} yields an empty map
   * @return mutable, insertion-ordered map
   * @throws IllegalArgumentException if an argument is not {@code key=value} or contains control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      String value = arg.substring(idx + 1).trim();
      if (value.indexOf('\0') >= 0) {
        throw new IllegalArgumentException("argument " + key + " must not contain null bytes");
      }
      map.put(key, Strings.requireNonBlank(key, value));
    }
    return map;
  }
}
