package ca.gc.cra.salvage.application.pipeline;

import ca.gc.cra.salvage.application.report.ClassificationReport;
import ca.gc.cra.salvage.application.report.RepairReport;
import ca.gc.cra.salvage.domain.decision.BatchDecision;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs classify, decide and repair in order over one evidence set.
 *
 * @since 0.1.0
 */
public final class SalvagePipeline {
  private static final Logger log = LoggerFactory.getLogger(SalvagePipeline.class);

  private final ValidateUseCase validate;
  private final DecideUseCase decide;
  private final RepairUseCase repair;

  public SalvagePipeline(ValidateUseCase validate, DecideUseCase decide, RepairUseCase repair) {
    this.validate = Objects.requireNonNull(validate, "validate");
    this.decide = Objects.requireNonNull(decide, "decide");
    this.repair = Objects.requireNonNull(repair, "repair");
  }

  /**
   * Runs all three stages.
   *
   * @param override operator override for the decision stage, if any
   * @return stage results
   * @throws PipelineException on a fatal environment failure
   * @throws InterruptedException if the run is cancelled
   */
  public PipelineResult run(Optional<DecideUseCase.OverrideRequest> override)
      throws PipelineException, InterruptedException {
    MDC.put("stage", "classify");
    try {
      ClassificationReport classification = validate.run();
      MDC.put("stage", "decide");
      BatchDecision decision = decide.run(classification, override);
      MDC.put("stage", "repair");
      RepairReport repaired = repair.run(classification, decision);
      log.info("Pipeline complete: {} of {} artifacts valid after repair",
          repaired.finalStatistics().valid(), repaired.finalStatistics().total());
      return new PipelineResult(classification, decision, repaired);
    } finally {
      MDC.remove("stage");
    }
  }
}
