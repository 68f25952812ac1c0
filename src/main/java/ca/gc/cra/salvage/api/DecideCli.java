package ca.gc.cra.salvage.api;

import ca.gc.cra.salvage.application.pipeline.PipelineException;
import ca.gc.cra.salvage.application.report.ClassificationReport;
import ca.gc.cra.salvage.config.CompositionRoot;
import ca.gc.cra.salvage.config.EngineSettings;
import ca.gc.cra.salvage.config.SalvageConfig;
import ca.gc.cra.salvage.domain.decision.BatchDecision;
import ca.gc.cra.salvage.validation.Paths;
import java.io.IOException;
import java.util.List;

/**
 * Reads a validation report, recommends a batch strategy and writes {@code decision_report.json}.
 *
 * @since 0.1.0
 */
public final class DecideCli {
  private static final String SUMMARY_USAGE =
      "usage: decide report=FILE out=DIR [decision.repairThreshold=PCT] [decision.lowYieldThreshold=N] "
          + "[successRate.TYPE=PCT] [override.strategy=S override.justification=TEXT override.approver=NAME] "
          + "[config=FILE] [--dry-run] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      salvage decide

      Usage:
        decide report=./case-42/validation_report.json out=./case-42 [options]

      Required:
        report=FILE                     Validation report written by validate

      Optional:
        out=DIR                         Directory receiving decision_report.json
        decision.lowYieldThreshold=N    Repair regardless of estimate below this many valid artifacts (default 50)
        decision.repairThreshold=PCT    Minimum weighted estimate to recommend repair (default 50)
        decision.highConfidenceMargin=PCT Margin above the threshold for high confidence (default 20)
        successRate.TYPE=PCT            Historical success rate for a corruption type, e.g. successRate.missing_footer=95
        override.strategy=S             perform_repair or skip_repair
        override.justification=TEXT     Required with override.strategy
        override.approver=NAME          Required with override.strategy
        config=FILE                     YAML configuration; CLI values win over YAML
        --dry-run                       Print the plan only
        --allow-overwrite               Replace an existing decision report
        --verbose                       Enable DEBUG logging
        --help                          Show this message
      """;

  static final SalvageCommand COMMAND = new Command();

  private DecideCli() {}

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

  static List<String> decisionPlan(SalvageConfig config, EngineSettings engine) {
    return List.of(
        " Low-yield below  : " + engine.thresholds().lowYieldThreshold() + " valid",
        " Repair threshold : " + engine.thresholds().repairThreshold() + "%",
        " High confidence  : +" + engine.thresholds().highConfidenceMargin() + "%",
        " Override         : " + config.override()
            .map(request -> request.strategy().reportName() + " approved by " + request.approver())
            .orElse("<none>"));
  }

  private static final class Command implements SalvageCommand {
    @Override
    public String mode() {
      return "decide";
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
      config.validationReport().ifPresent(file -> Paths.requireReadableFile("report", file));
      // The validation report usually lives in the output directory already.
      Paths.validateWritableDir(config.outputDirectory(), createIfMissing, true);
    }

    @Override
    public List<String> dryRunPlan(SalvageConfig config, EngineSettings engine) {
      List<String> lines = SalvageCliSupport.planHeader("Decide dry-run: no report will be written.", config);
      lines.add(" Validation report: " + SalvageCliSupport.describe(config.validationReport()));
      lines.addAll(decisionPlan(config, engine));
      lines.add(" Re-run without --dry-run to record the decision.");
      return lines;
    }

    @Override
    public void execute(CompositionRoot root, SalvageConfig config) throws PipelineException, IOException {
      ClassificationReport report = root.reportReader().readValidation(config.validationReport().orElseThrow());
      BatchDecision decision = root.decideUseCase().run(report, config.override());
      SalvageCliSupport.printDecisionSummary(decision);
    }
  }
}
