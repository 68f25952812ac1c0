package ca.gc.cra.salvage.application.pipeline;

import ca.gc.cra.salvage.application.port.ClockPort;
import ca.gc.cra.salvage.application.port.ReportWriterPort;
import ca.gc.cra.salvage.application.report.ClassificationReport;
import ca.gc.cra.salvage.domain.decision.BatchDecision;
import ca.gc.cra.salvage.domain.decision.DecisionEngine;
import ca.gc.cra.salvage.domain.decision.ManualOverride;
import ca.gc.cra.salvage.domain.decision.Strategy;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the batch decision from a validation report, records an optional operator override and writes the
 * decision report.
 *
 * @since 0.1.0
 */
public final class DecideUseCase {
  private static final Logger log = LoggerFactory.getLogger(DecideUseCase.class);

  private final DecisionEngine engine;
  private final ReportWriterPort reports;
  private final ClockPort clock;

  public DecideUseCase(DecisionEngine engine, ReportWriterPort reports, ClockPort clock) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.reports = Objects.requireNonNull(reports, "reports");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Decides and writes the decision report.
   *
   * @param report classification report for the batch
   * @param override operator override request, if any
   * @return decision, carrying the override when one was requested
   * @throws PipelineException if the report cannot be written
   * @throws IllegalArgumentException if the override lacks a justification or approver
   */
  public BatchDecision run(ClassificationReport report, Optional<OverrideRequest> override) throws PipelineException {
    Objects.requireNonNull(report, "report");
    Objects.requireNonNull(override, "override");
    long now = clock.nowMillis();
    BatchDecision decision = engine.decide(report.statistics());
    log.info("Decision: {} ({} confidence). {}", decision.strategy().reportName(),
        decision.confidence().reportName(), decision.reasoning());
    if (override.isPresent()) {
      OverrideRequest request = override.get();
      ManualOverride manual = new ManualOverride(
          request.strategy(), request.justification(), request.approver(), Instant.ofEpochMilli(now));
      decision = decision.withOverride(manual);
      log.warn("Manual override approved by {}: {} replaces {} ({})", manual.approver(),
          manual.strategy().reportName(), decision.strategy().reportName(), manual.justification());
    }
    try {
      Path written = reports.writeDecision(decision, now);
      log.info("Decision report written to {}", written);
    } catch (IOException ex) {
      throw new PipelineException("Unable to write decision report: " + ex.getMessage(), ex);
    }
    return decision;
  }

  /**
   * Operator request to replace the automatic strategy.
   *
   * @param strategy requested strategy
   * @param justification why the recommendation is overridden
   * @param approver approving operator
   */
  public record OverrideRequest(Strategy strategy, String justification, String approver) {
    public OverrideRequest {
      Objects.requireNonNull(strategy, "strategy");
    }
  }
}
