package ca.gc.cra.salvage.api;

import ca.gc.cra.salvage.application.pipeline.PipelineException;
import ca.gc.cra.salvage.application.pipeline.PipelineResult;
import ca.gc.cra.salvage.config.CompositionRoot;
import ca.gc.cra.salvage.config.EngineSettings;
import ca.gc.cra.salvage.config.SalvageConfig;
import java.util.List;

/**
 * Runs validate, decide and repair back to back and writes all three reports.
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final String SUMMARY_USAGE =
      "usage: run in=DIR|catalog=FILE out=DIR [validate, decide and repair options] "
          + "[config=FILE] [--dry-run] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      salvage run

      Usage:
        run in=./recovered out=./case-42 [options]

      Runs the full workflow over one evidence set. Accepts every option of validate, decide and repair
      except report= and decision=, which are produced along the way.

      Required (one of):
        in=DIR                     Evidence directory
        catalog=FILE               Consolidation catalog

      Common options:
        out=DIR                    Output directory; must be empty unless --allow-overwrite
        workers=N                  Parallel artifact workers, 1..64
        override.strategy=S        Manual strategy override (needs override.justification and override.approver)
        config=FILE                YAML configuration; CLI values win over YAML
        --dry-run                  Print the plan only
        --allow-overwrite          Reuse a non-empty output directory
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  static final SalvageCommand COMMAND = new Command();

  private RunCli() {}

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

  private static final class Command implements SalvageCommand {
    @Override
    public String mode() {
      return "run";
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
      ValidateCli.validateEvidence(config, createIfMissing);
    }

    @Override
    public List<String> dryRunPlan(SalvageConfig config, EngineSettings engine) {
      List<String> lines = SalvageCliSupport.planHeader("Run dry-run: nothing will be classified or repaired.", config);
      lines.addAll(ValidateCli.checksPlan(config, engine));
      lines.addAll(DecideCli.decisionPlan(config, engine));
      lines.add(" Header window    : " + engine.repair().headerSearchWindow() + " bytes");
      lines.add(" Re-run without --dry-run to start the workflow.");
      return lines;
    }

    @Override
    public void execute(CompositionRoot root, SalvageConfig config)
        throws PipelineException, InterruptedException {
      PipelineResult result = root.pipeline().run(config.override());
      SalvageCliSupport.printValidationSummary(result.classification());
      SalvageCliSupport.printDecisionSummary(result.decision());
      SalvageCliSupport.printRepairSummary(result.repair());
    }
  }
}
