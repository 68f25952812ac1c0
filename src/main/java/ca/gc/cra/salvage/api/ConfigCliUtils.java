package ca.gc.cra.salvage.api;

import java.util.Map;

/**
 * Pulls the {@code config=} argument out before the remaining pairs are merged.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /** Removes and returns the {@code config=} path so it never reaches config parsing. */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String found = null;
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (found == null && value != null && !value.isBlank()) {
        found = value.trim();
      }
    }
    return found;
  }
}
