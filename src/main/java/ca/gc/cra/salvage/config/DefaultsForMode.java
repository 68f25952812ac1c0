package ca.gc.cra.salvage.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each salvage command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target command (validate, decide, repair, run)
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "validate" -> buildValidateDefaults();
      case "decide" -> EngineSettings.defaults().asFlatMap();
      case "repair" -> buildRepairDefaults();
      case "run" -> buildRunDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    SalvageConfig defaults = SalvageConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("out", defaults.outputDirectory().toString());
    map.put("workers", Integer.toString(defaults.workers()));
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildValidateDefaults() {
    SalvageConfig defaults = SalvageConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("decodeCheck", Boolean.toString(defaults.decodeCheck()));
    map.put("externalChecks", "");
    map.put("checkTimeoutMillis", Long.toString(defaults.checkTimeoutMillis()));
    map.put("footerToleranceBytes", EngineSettings.defaults().asFlatMap().get("footerToleranceBytes"));
    return map;
  }

  private static Map<String, String> buildRepairDefaults() {
    Map<String, String> map = buildValidateDefaults();
    map.putAll(EngineSettings.defaults().asFlatMap());
    return map;
  }

  private static Map<String, String> buildRunDefaults() {
    return buildRepairDefaults();
  }
}
