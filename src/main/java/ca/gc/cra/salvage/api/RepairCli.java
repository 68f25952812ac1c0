package ca.gc.cra.salvage.api;

import ca.gc.cra.salvage.application.pipeline.PipelineException;
import ca.gc.cra.salvage.application.report.ClassificationReport;
import ca.gc.cra.salvage.application.report.RepairReport;
import ca.gc.cra.salvage.config.CompositionRoot;
import ca.gc.cra.salvage.config.EngineSettings;
import ca.gc.cra.salvage.config.SalvageConfig;
import ca.gc.cra.salvage.domain.decision.BatchDecision;
import ca.gc.cra.salvage.validation.Paths;
import java.io.IOException;
import java.util.List;

/**
 * Applies the recorded decision: repairs eligible artifacts into {@code repaired/} and writes
 * {@code repair_report.json}.
 *
 * @since 0.1.0
 */
public final class RepairCli {
  private static final String SUMMARY_USAGE =
      "usage: repair report=FILE decision=FILE out=DIR [workers=N] [headerSearchWindow=BYTES] "
          + "[decodeCheck=true|false] [externalChecks=LIST] [config=FILE] [--dry-run] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      salvage repair

      Usage:
        repair report=./case-42/validation_report.json decision=./case-42/decision_report.json out=./case-42

      Required:
        report=FILE                Validation report written by validate
        decision=FILE              Decision report written by decide

      Optional:
        out=DIR                    Directory receiving repaired/ and repair_report.json
        in=DIR|catalog=FILE        Re-read evidence from here instead of the paths recorded in the report
        workers=N                  Parallel artifact workers, 1..64
        headerSearchWindow=BYTES   How far a displaced start marker may sit (default 65536)
        decodeCheck=true|false     Strict ImageIO decode check used to verify output (default true)
        externalChecks=LIST        External auditors used to verify output
        config=FILE                YAML configuration; CLI values win over YAML
        --dry-run                  Print the plan only
        --allow-overwrite          Replace existing repaired files and the repair report
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Notes:
        Originals are never modified. Repair runs only when the effective strategy is perform_repair.
      """;

  static final SalvageCommand COMMAND = new Command();

  private RepairCli() {}

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
      return "repair";
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
      config.decisionReport().ifPresent(file -> Paths.requireReadableFile("decision", file));
      config.inputDirectory().ifPresent(dir -> {
        Paths.requireReadableDir("in", dir);
        Paths.requireOutside(config.outputDirectory(), dir);
      });
      config.catalogFile().ifPresent(file -> Paths.requireReadableFile("catalog", file));
      Paths.validateWritableDir(config.outputDirectory(), createIfMissing, true);
    }

    @Override
    public List<String> dryRunPlan(SalvageConfig config, EngineSettings engine) {
      List<String> lines = SalvageCliSupport.planHeader("Repair dry-run: no files will be written.", config);
      lines.add(" Validation report: " + SalvageCliSupport.describe(config.validationReport()));
      lines.add(" Decision report  : " + SalvageCliSupport.describe(config.decisionReport()));
      lines.add(" Evidence         : " + (config.inputDirectory().isPresent() || config.catalogFile().isPresent()
          ? config.evidenceDescription() : "paths recorded in the validation report"));
      lines.add(" Header window    : " + engine.repair().headerSearchWindow() + " bytes");
      lines.add(" Repaired dir     : " + config.outputDirectory().resolve("repaired"));
      lines.add(" Re-run without --dry-run to repair.");
      return lines;
    }

    @Override
    public void execute(CompositionRoot root, SalvageConfig config)
        throws PipelineException, IOException, InterruptedException {
      ClassificationReport classification =
          root.reportReader().readValidation(config.validationReport().orElseThrow());
      BatchDecision decision = root.reportReader().readDecision(config.decisionReport().orElseThrow());
      RepairReport report = root.repairUseCase().run(classification, decision);
      SalvageCliSupport.printRepairSummary(report);
    }
  }
}
