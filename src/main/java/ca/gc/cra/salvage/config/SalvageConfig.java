package ca.gc.cra.salvage.config;

import ca.gc.cra.salvage.application.pipeline.DecideUseCase.OverrideRequest;
import ca.gc.cra.salvage.domain.decision.Strategy;
import ca.gc.cra.salvage.validation.Numbers;
import ca.gc.cra.salvage.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Run settings shared by the {@code validate}, {@code decide}, {@code repair} and {@code run} commands.
 *
 * @param inputDirectory evidence directory, walked recursively
 * @param catalogFile consolidation catalog listing evidence files; exclusive with {@code inputDirectory}
 * @param validationReport validation report read by {@code decide} and {@code repair}
 * @param decisionReport decision report read by {@code repair}
 * @param outputDirectory directory receiving reports and {@code repaired/}
 * @param workers per-artifact worker threads
 * @param decodeCheck whether the strict ImageIO decode check is registered
 * @param externalChecks external auditors to register, in order
 * @param checkTimeoutMillis per-invocation bound for external auditors
 * @param allowOverwrite whether existing reports and repaired files may be replaced
 * @param dryRun print the plan without touching the filesystem
 * @param override manual strategy override for the decision stage
 * @since 0.1.0
 */
public record SalvageConfig(
    Optional<Path> inputDirectory,
    Optional<Path> catalogFile,
    Optional<Path> validationReport,
    Optional<Path> decisionReport,
    Path outputDirectory,
    int workers,
    boolean decodeCheck,
    List<String> externalChecks,
    long checkTimeoutMillis,
    boolean allowOverwrite,
    boolean dryRun,
    Optional<OverrideRequest> override) {

  public static final long DEFAULT_CHECK_TIMEOUT_MILLIS = 30_000L;
  public static final int MAX_WORKERS = 64;
  static final Set<String> KNOWN_EXTERNAL_CHECKS = Set.of("jpeginfo", "pngcheck", "identify");

  public SalvageConfig {
    inputDirectory = Objects.requireNonNullElse(inputDirectory, Optional.empty());
    catalogFile = Objects.requireNonNullElse(catalogFile, Optional.empty());
    validationReport = Objects.requireNonNullElse(validationReport, Optional.empty());
    decisionReport = Objects.requireNonNullElse(decisionReport, Optional.empty());
    outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory").toAbsolutePath().normalize();
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    Numbers.requireRange("checkTimeoutMillis", checkTimeoutMillis, 100, 600_000);
    externalChecks = List.copyOf(Objects.requireNonNull(externalChecks, "externalChecks"));
    for (String check : externalChecks) {
      if (!KNOWN_EXTERNAL_CHECKS.contains(check)) {
        throw new IllegalArgumentException("unknown external check: " + check);
      }
    }
    override = Objects.requireNonNullElse(override, Optional.empty());
    if (inputDirectory.isPresent() && catalogFile.isPresent()) {
      throw new IllegalArgumentException("in and catalog are mutually exclusive");
    }
  }

  public static SalvageConfig defaults() {
    return new SalvageConfig(
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        defaultOutputDirectory(),
        defaultWorkers(),
        true,
        List.of(),
        DEFAULT_CHECK_TIMEOUT_MILLIS,
        false,
        false,
        Optional.empty());
  }

  /**
   * Builds settings from a flattened key/value map.
   *
   * @param options merged CLI/YAML/default options
   * @return validated settings
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static SalvageConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    SalvageConfig defaults = defaults();

    String outRaw = firstNonBlank(options, "out", "--out");
    Path output = outRaw == null ? defaults.outputDirectory() : parsePath("out", outRaw);

    return new SalvageConfig(
        optionalPath("in", firstNonBlank(options, "in", "--in")),
        optionalPath("catalog", firstNonBlank(options, "catalog", "--catalog")),
        optionalPath("report", firstNonBlank(options, "report", "--report")),
        optionalPath("decision", firstNonBlank(options, "decision", "--decision")),
        output,
        parseInt("workers", options.get("workers"), defaults.workers()),
        parseBoolean(options.get("decodeCheck"), defaults.decodeCheck()),
        parseChecks(options.get("externalChecks")),
        parseLong("checkTimeoutMillis", options.get("checkTimeoutMillis"), defaults.checkTimeoutMillis()),
        parseBoolean(options.get("allowOverwrite"), false),
        parseBoolean(options.get("dryRun"), false),
        parseOverride(options));
  }

  /** The evidence location, as a display string for plans and logs. */
  public String evidenceDescription() {
    return inputDirectory.map(path -> "directory " + path)
        .or(() -> catalogFile.map(path -> "catalog " + path))
        .orElse("(none)");
  }

  private static Optional<OverrideRequest> parseOverride(Map<String, String> options) {
    String strategy = trimToNull(options.get("override.strategy"));
    String justification = trimToNull(options.get("override.justification"));
    String approver = trimToNull(options.get("override.approver"));
    if (strategy == null && justification == null && approver == null) {
      return Optional.empty();
    }
    if (strategy == null) {
      throw new IllegalArgumentException("override.strategy is required when overriding the decision");
    }
    return Optional.of(new OverrideRequest(
        Strategy.fromReportName(strategy),
        Strings.requireNonBlank("override.justification", justification),
        Strings.requireNonBlank("override.approver", approver)));
  }

  private static List<String> parseChecks(String raw) {
    if (raw == null || raw.isBlank() || raw.trim().equalsIgnoreCase("none")) {
      return List.of();
    }
    Set<String> checks = new LinkedHashSet<>();
    for (String token : raw.split(",")) {
      String name = token.trim().toLowerCase(Locale.ROOT);
      if (!name.isEmpty()) {
        checks.add(name);
      }
    }
    return new ArrayList<>(checks);
  }

  private static int parseInt(String name, String value, int defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer: " + value, ex);
    }
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

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static Optional<Path> optionalPath(String name, String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(parsePath(name, value));
  }

  private static Path parsePath(String name, String value) {
    String raw = Strings.requireNonBlank(name, value);
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    try {
      return Path.of(raw).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static String firstNonBlank(Map<String, String> map, String... keys) {
    for (String key : keys) {
      String val = map.get(key);
      if (val != null && !val.isBlank()) {
        return val;
      }
    }
    return null;
  }

  private static String trimToNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }

  static int defaultWorkers() {
    return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), 8));
  }

  static Path defaultOutputDirectory() {
    String home = System.getProperty("user.home", ".");
    return Path.of(home, ".salvage", "out");
  }
}
