package ca.gc.cra.salvage.api;

import ca.gc.cra.salvage.application.pipeline.PipelineException;
import ca.gc.cra.salvage.application.report.ClassificationReport;
import ca.gc.cra.salvage.config.CompositionRoot;
import ca.gc.cra.salvage.config.EngineSettings;
import ca.gc.cra.salvage.config.SalvageConfig;
import ca.gc.cra.salvage.validation.Paths;
import java.util.List;

/**
 * Validates and classifies every artifact in an evidence directory or catalog and writes
 * {@code validation_report.json}.
 *
 * @since 0.1.0
 */
public final class ValidateCli {
  private static final String SUMMARY_USAGE =
      "usage: validate in=DIR|catalog=FILE out=DIR [workers=N] [decodeCheck=true|false] "
          + "[externalChecks=jpeginfo,pngcheck,identify] [checkTimeoutMillis=MS] [footerToleranceBytes=N] "
          + "[config=FILE] [--dry-run] [--allow-overwrite] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      salvage validate

      Usage:
        validate in=./recovered out=./case-42 [options]

      Required (one of):
        in=DIR                     Evidence directory, walked recursively; top-level folder names the recovery method
        catalog=FILE               Consolidation catalog ({"files":[{"path":...}]})

      Optional:
        out=DIR                    Report directory (default ~/.salvage/out); must be empty unless --allow-overwrite
        workers=N                  Parallel artifact workers, 1..64
        decodeCheck=true|false     Strict ImageIO decode check (default true)
        externalChecks=LIST        Comma list of jpeginfo, pngcheck, identify, or none
        checkTimeoutMillis=MS      Bound on each external check (default 30000)
        footerToleranceBytes=N     Trailing bytes tolerated before JPEG EOI counts as truncation (default 4)
        config=FILE                YAML configuration; CLI values win over YAML
        --dry-run                  Validate arguments and print the plan only
        --allow-overwrite          Reuse a non-empty output directory and replace reports
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Notes:
        Evidence files are only read. The output directory must not sit inside the evidence directory.
      """;

  static final SalvageCommand COMMAND = new Command();

  private ValidateCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return SalvageCliSupport.run(COMMAND, args);
  }

  /** Validation of evidence inputs shared with {@code run}. */
  static void validateEvidence(SalvageConfig config, boolean createIfMissing) {
    config.inputDirectory().ifPresent(dir -> {
      Paths.requireReadableDir("in", dir);
      Paths.requireOutside(config.outputDirectory(), dir);
    });
    config.catalogFile().ifPresent(file -> Paths.requireReadableFile("catalog", file));
    Paths.validateWritableDir(config.outputDirectory(), createIfMissing, config.allowOverwrite());
  }

  static List<String> checksPlan(SalvageConfig config, EngineSettings engine) {
    return List.of(
        " Evidence         : " + config.evidenceDescription(),
        " Decode check     : " + config.decodeCheck(),
        " External checks  : " + (config.externalChecks().isEmpty()
            ? "<none>" : String.join(",", config.externalChecks())),
        " Check timeout ms : " + config.checkTimeoutMillis(),
        " Footer tolerance : " + engine.classifier().footerToleranceBytes() + " bytes");
  }

  private static final class Command implements SalvageCommand {
    @Override
    public String mode() {
      return "validate";
    }

    @Override
    public String summaryUsage() {
      return SUMMARY_USAGE;
    }

    @Override
    public String helpText() {
      return HELP_TEXT;
    }

    @Override
    public void validatePaths(SalvageConfig config, boolean createIfMissing) {
      validateEvidence(config, createIfMissing);
    }

    @Override
    public List<String> dryRunPlan(SalvageConfig config, EngineSettings engine) {
      List<String> lines = SalvageCliSupport.planHeader("Validate dry-run: no reports will be written.", config);
      lines.addAll(checksPlan(config, engine));
      lines.add(" Re-run without --dry-run to classify the evidence.");
      return lines;
    }

    @Override
    public void execute(CompositionRoot root, SalvageConfig config)
        throws PipelineException, InterruptedException {
      ClassificationReport report = root.validateUseCase().run();
      SalvageCliSupport.printValidationSummary(report);
    }
  }
}
