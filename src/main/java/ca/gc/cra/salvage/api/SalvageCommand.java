package ca.gc.cra.salvage.api;

import ca.gc.cra.salvage.application.pipeline.PipelineException;
import ca.gc.cra.salvage.config.CompositionRoot;
import ca.gc.cra.salvage.config.EngineSettings;
import ca.gc.cra.salvage.config.SalvageConfig;
import java.io.IOException;
import java.util.List;

/**
 * One salvage subcommand as seen by {@link SalvageCliSupport}: its usage text, the paths it needs, its dry-run plan
 * and the stage work itself.
 */
interface SalvageCommand {
  /** Mode name used for defaults, YAML sections and validation. */
  String mode();

  String summaryUsage();

  String helpText();

  /**
   * Checks inputs and the output directory before anything runs.
   *
   * @param config parsed settings
   * @param createIfMissing whether the output directory may be created
   * @throws IllegalArgumentException if a path is unusable
   */
  void validatePaths(SalvageConfig config, boolean createIfMissing);

  /** Lines printed by {@code --dry-run}. */
  List<String> dryRunPlan(SalvageConfig config, EngineSettings engine);

  /**
   * Runs the command.
   *
   * @param root wiring for this run
   * @param config parsed settings
   * @throws PipelineException if a stage hit a fatal environment failure
   * @throws IOException if an input report cannot be read
   * @throws InterruptedException if the run is cancelled
   */
  void execute(CompositionRoot root, SalvageConfig config)
      throws PipelineException, IOException, InterruptedException;
}
