package ca.gc.cra.salvage.application.pipeline;

import ca.gc.cra.salvage.application.report.ClassificationReport;
import ca.gc.cra.salvage.application.report.RepairReport;
import ca.gc.cra.salvage.domain.decision.BatchDecision;

/**
 * Results of the three stages of one pipeline run.
 *
 * @param classification validation report
 * @param decision batch decision
 * @param repair repair report
 * @since 0.1.0
 */
public record PipelineResult(ClassificationReport classification, BatchDecision decision, RepairReport repair) {}
