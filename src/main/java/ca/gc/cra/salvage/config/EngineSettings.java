package ca.gc.cra.salvage.config;

import ca.gc.cra.salvage.domain.classify.ClassifierSettings;
import ca.gc.cra.salvage.domain.classify.CorruptionType;
import ca.gc.cra.salvage.domain.decision.DecisionThresholds;
import ca.gc.cra.salvage.domain.decision.SuccessRateTable;
import ca.gc.cra.salvage.domain.repair.RepairSettings;
import ca.gc.cra.salvage.validation.Numbers;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Tunables for the classifier, repair engine and decision engine.
 *
 * <p>Keys: {@code footerToleranceBytes}, {@code headerSearchWindow}, {@code decision.lowYieldThreshold},
 * {@code decision.repairThreshold}, {@code decision.highConfidenceMargin} and {@code successRate.<corruption type>}.
 *
 * @since 0.1.0
 */
public record EngineSettings(
    ClassifierSettings classifier,
    RepairSettings repair,
    DecisionThresholds thresholds,
    SuccessRateTable successRates) {

  static final String SUCCESS_RATE_PREFIX = "successRate.";

  public EngineSettings {
    Objects.requireNonNull(classifier, "classifier");
    Objects.requireNonNull(repair, "repair");
    Objects.requireNonNull(thresholds, "thresholds");
    Objects.requireNonNull(successRates, "successRates");
  }

  public static EngineSettings defaults() {
    return new EngineSettings(
        ClassifierSettings.defaults(),
        RepairSettings.defaults(),
        DecisionThresholds.defaults(),
        SuccessRateTable.defaults());
  }

  /**
   * Builds settings from a flattened key/value map; absent keys keep their defaults.
   *
   * @param options merged options
   * @return validated settings
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static EngineSettings fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    EngineSettings defaults = defaults();

    int tolerance = (int) Numbers.requireRange("footerToleranceBytes",
        parseLong("footerToleranceBytes", options.get("footerToleranceBytes"),
            defaults.classifier().footerToleranceBytes()), 0, 1024);
    int window = (int) Numbers.requireRange("headerSearchWindow",
        parseLong("headerSearchWindow", options.get("headerSearchWindow"),
            defaults.repair().headerSearchWindow()), 0, 16L * 1024 * 1024);

    DecisionThresholds base = defaults.thresholds();
    DecisionThresholds thresholds = new DecisionThresholds(
        (int) Numbers.requireRange("decision.lowYieldThreshold",
            parseLong("decision.lowYieldThreshold", options.get("decision.lowYieldThreshold"),
                base.lowYieldThreshold()), 0, Integer.MAX_VALUE),
        Numbers.requirePercent("decision.repairThreshold",
            parseDouble("decision.repairThreshold", options.get("decision.repairThreshold"),
                base.repairThreshold())),
        Numbers.requirePercent("decision.highConfidenceMargin",
            parseDouble("decision.highConfidenceMargin", options.get("decision.highConfidenceMargin"),
                base.highConfidenceMargin())));

    SuccessRateTable rates = defaults.successRates();
    for (Map.Entry<String, String> entry : options.entrySet()) {
      if (!entry.getKey().startsWith(SUCCESS_RATE_PREFIX)) {
        continue;
      }
      String typeName = entry.getKey().substring(SUCCESS_RATE_PREFIX.length());
      CorruptionType type;
      try {
        type = CorruptionType.fromReportName(typeName);
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("unknown corruption type in " + entry.getKey(), ex);
      }
      rates = rates.with(type, Numbers.requirePercent(entry.getKey(),
          parseDouble(entry.getKey(), entry.getValue(), rates.rateFor(type))));
    }

    return new EngineSettings(
        new ClassifierSettings(tolerance), new RepairSettings(window), thresholds, rates);
  }

  /** Flattened form used by {@link DefaultsForMode}. */
  Map<String, String> asFlatMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("footerToleranceBytes", Integer.toString(classifier.footerToleranceBytes()));
    map.put("headerSearchWindow", Integer.toString(repair.headerSearchWindow()));
    map.put("decision.lowYieldThreshold", Integer.toString(thresholds.lowYieldThreshold()));
    map.put("decision.repairThreshold", Double.toString(thresholds.repairThreshold()));
    map.put("decision.highConfidenceMargin", Double.toString(thresholds.highConfidenceMargin()));
    successRates.asMap().forEach((type, rate) ->
        map.put(SUCCESS_RATE_PREFIX + type.name().toLowerCase(Locale.ROOT), Double.toString(rate)));
    return map;
  }

  private static long parseLong(String name, String value, long defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer: " + value, ex);
    }
  }

  private static double parseDouble(String name, String value, double defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be a number: " + value, ex);
    }
  }
}
