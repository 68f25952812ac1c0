package ca.gc.cra.salvage.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and the inputs each command
 * needs.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    // Choosing a catalog on the command line replaces an evidence directory configured in YAML, and vice versa.
    if (cliCopy.containsKey("catalog") && !cliCopy.containsKey("in")) {
      merged.remove("in");
    }
    if (cliCopy.containsKey("in") && !cliCopy.containsKey("catalog")) {
      merged.remove("catalog");
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    boolean hasIn = !trim(effective.get("in")).isEmpty();
    boolean hasCatalog = !trim(effective.get("catalog")).isEmpty();
    switch (normalized) {
      case "validate", "run" -> {
        if (hasIn == hasCatalog) {
          throw new IllegalArgumentException(mode + " requires exactly one of in=DIR or catalog=FILE");
        }
      }
      case "decide" -> requirePresent(effective, "report", mode);
      case "repair" -> {
        requirePresent(effective, "report", mode);
        requirePresent(effective, "decision", mode);
      }
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    if (!"decide".equals(normalized) && !"run".equals(normalized)
        && !trim(effective.get("override.strategy")).isEmpty()) {
      throw new IllegalArgumentException("override.* options only apply to decide and run");
    }
  }

  private static void requirePresent(Map<String, String> effective, String key, String mode) {
    if (trim(effective.get(key)).isEmpty()) {
      throw new IllegalArgumentException(mode + " requires " + key + "=FILE");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
