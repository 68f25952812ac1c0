package ca.gc.cra.salvage.api;

import ca.gc.cra.salvage.application.pipeline.PipelineException;
import ca.gc.cra.salvage.application.report.ClassificationReport;
import ca.gc.cra.salvage.application.report.RepairReport;
import ca.gc.cra.salvage.config.CompositionRoot;
import ca.gc.cra.salvage.config.ConfigMerger;
import ca.gc.cra.salvage.config.DefaultsForMode;
import ca.gc.cra.salvage.config.EngineSettings;
import ca.gc.cra.salvage.config.SalvageConfig;
import ca.gc.cra.salvage.config.YamlConfigLoader;
import ca.gc.cra.salvage.domain.decision.BatchDecision;
import ca.gc.cra.salvage.domain.decision.BatchStatistics;
import ca.gc.cra.salvage.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Argument handling shared by every salvage subcommand.
 *
 * <p>Order of work: help, verbosity, {@code key=value} parsing, YAML loading, merge with defaults, telemetry
 * properties, settings parsing, path validation, then either the dry-run plan or the command itself. Each failure
 * maps to one {@link ExitCode}.</p>
 */
final class SalvageCliSupport {
  private static final Logger log = LoggerFactory.getLogger(SalvageCliSupport.class);

  private SalvageCliSupport() {
    // Utility class
  }

  static ExitCode run(SalvageCommand command, String[] args) {
    return run(command, args, (config, engine) -> new CompositionRoot(config, engine));
  }

  /**
   * Runs {@code command} with a caller-supplied composition root factory.
   *
   * @param command subcommand
   * @param args raw arguments following the subcommand name
   * @param rootFactory builds the wiring once settings are valid
   * @return exit code for the process
   */
  static ExitCode run(
      SalvageCommand command,
      String[] args,
      BiFunction<SalvageConfig, EngineSettings, CompositionRoot> rootFactory) {
    String mode = command.mode();
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(command.helpText().stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", mode);
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      return invalid(command, "Invalid argument: {}", ex);
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(command.summaryUsage());
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        return invalid(command, "Invalid YAML configuration: {}", ex);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          mode, yamlConfig, kv, DefaultsForMode.asFlatMap(mode), log::warn);
    } catch (IllegalArgumentException ex) {
      return invalid(command, "Invalid " + mode + " arguments: {}", ex);
    }

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    if (input.hasFlag("--dry-run")) {
      configInputs.put("dryRun", "true");
    }
    if (input.hasFlag("--allow-overwrite")) {
      configInputs.put("allowOverwrite", "true");
    }

    SalvageConfig config;
    EngineSettings engine;
    String metricsExporter;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(configInputs);
      config = SalvageConfig.fromMap(configInputs);
      engine = EngineSettings.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      return invalid(command, "Invalid " + mode + " arguments: {}", ex);
    }

    try {
      command.validatePaths(config, !config.dryRun());
    } catch (IllegalArgumentException ex) {
      return invalid(command, "Invalid " + mode + " path configuration: {}", ex);
    }

    if (config.dryRun()) {
      CliPrinter.printLines(command.dryRunPlan(config, engine).toArray(String[]::new));
      return ExitCode.SUCCESS;
    }

    log.info("Configured {}: evidence={}, output={}, workers={}, metricsExporter={}",
        mode, config.evidenceDescription(), config.outputDirectory(), config.workers(), metricsExporter);
    try (CompositionRoot root = rootFactory.apply(config, engine)) {
      command.execute(root, config);
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("{} configuration error: {}", mode, ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (PipelineException | IOException ex) {
      log.error("{} failed: {}", mode, ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("{} interrupted; shutting down", mode, ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {}", mode, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode invalid(SalvageCommand command, String message, IllegalArgumentException ex) {
    log.error(message, ex.getMessage());
    CliPrinter.println(command.summaryUsage());
    return ExitCode.INVALID_ARGS;
  }

  /** Common head of every dry-run plan. */
  static List<String> planHeader(String title, SalvageConfig config) {
    List<String> lines = new ArrayList<>();
    lines.add(title);
    lines.add(" Output directory : " + config.outputDirectory());
    lines.add(" Workers          : " + config.workers());
    lines.add(" Allow overwrite  : " + config.allowOverwrite());
    return lines;
  }

  static String describe(Optional<Path> path) {
    return path.map(Path::toString).orElse("<none>");
  }

  static void printValidationSummary(ClassificationReport report) {
    BatchStatistics stats = report.statistics();
    CliPrinter.printLines(
        "Validation complete.",
        " Artifacts        : " + stats.total() + " (" + report.skipped().size() + " skipped)",
        " Valid            : " + stats.valid(),
        " Corrupted        : " + stats.corrupted(),
        " Unrecoverable    : " + stats.unrecoverable(),
        " Integrity score  : " + stats.integrityScore() + "%");
  }

  static void printDecisionSummary(BatchDecision decision) {
    List<String> lines = new ArrayList<>();
    lines.add("Decision: " + decision.strategy().reportName()
        + " (" + decision.confidence().reportName() + " confidence, rule " + decision.rule().number() + ")");
    lines.add(" Estimate         : " + decision.estimate() + "% over " + decision.repairableCount() + " repairable");
    lines.add(" Expected final   : " + decision.expectedOutcome().finalExpectedCount()
        + " valid (" + decision.expectedOutcome().finalExpectedPercent() + "%)");
    decision.manualOverride().ifPresent(override -> lines.add(
        " Override         : " + override.strategy().reportName() + " approved by " + override.approver()));
    lines.add(" Reasoning        : " + decision.reasoning());
    CliPrinter.printLines(lines.toArray(String[]::new));
  }

  static void printRepairSummary(RepairReport report) {
    BatchStatistics after = report.finalStatistics();
    CliPrinter.printLines(
        "Repair complete (" + report.effectiveStrategy().reportName() + ").",
        " Attempted        : " + report.attempted(),
        " Successful       : " + report.successful(),
        " Failed           : " + report.failed(),
        " Valid after      : " + after.valid() + " of " + after.total() + " (" + after.integrityScore() + "%)");
  }
}
