package ca.gc.cra.salvage.domain.decision;

import ca.gc.cra.salvage.domain.classify.Confidence;
import java.util.Objects;
import java.util.Optional;

/**
 * Batch-level repair recommendation.
 *
 * <p>A manual override is recorded next to the automatic recommendation; {@link #strategy()} always reports what
 * the rules chose and {@link #effectiveStrategy()} what will actually run.</p>
 *
 * @param strategy automatic recommendation
 * @param confidence confidence of the automatic recommendation
 * @param rule rule that fired
 * @param estimate weighted repair success estimate, percent
 * @param repairableCount corrupted artifacts in the repair pool
 * @param statistics batch statistics the decision was computed from
 * @param expectedOutcome projection for the automatic recommendation
 * @param reasoning audit text naming the rule and its inputs
 * @param manualOverride operator override, if any
 * @since 0.1.0
 */
public record BatchDecision(
    Strategy strategy,
    Confidence confidence,
    DecisionRule rule,
    double estimate,
    int repairableCount,
    BatchStatistics statistics,
    ExpectedOutcome expectedOutcome,
    String reasoning,
    Optional<ManualOverride> manualOverride) {

  public BatchDecision {
    Objects.requireNonNull(strategy, "strategy");
    Objects.requireNonNull(confidence, "confidence");
    Objects.requireNonNull(rule, "rule");
    Objects.requireNonNull(statistics, "statistics");
    Objects.requireNonNull(expectedOutcome, "expectedOutcome");
    Objects.requireNonNull(reasoning, "reasoning");
    manualOverride = Objects.requireNonNullElse(manualOverride, Optional.empty());
  }

  /**
   * Records an operator override alongside this recommendation.
   *
   * @param override approved override
   * @return new decision carrying the override
   */
  public BatchDecision withOverride(ManualOverride override) {
    Objects.requireNonNull(override, "override");
    return new BatchDecision(strategy, confidence, rule, estimate, repairableCount, statistics, expectedOutcome,
        reasoning, Optional.of(override));
  }

  /**
   * Strategy that will run: the override when present, otherwise the automatic recommendation.
   *
   * @return effective strategy
   */
  public Strategy effectiveStrategy() {
    return manualOverride.map(ManualOverride::strategy).orElse(strategy);
  }

  public int expectedAdditional() {
    return expectedOutcome.expectedAdditional();
  }

  public boolean overridden() {
    return manualOverride.isPresent();
  }
}
