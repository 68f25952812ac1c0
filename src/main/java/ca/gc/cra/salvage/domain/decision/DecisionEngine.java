package ca.gc.cra.salvage.domain.decision;

import ca.gc.cra.salvage.domain.classify.Confidence;
import ca.gc.cra.salvage.domain.classify.CorruptionType;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Decides once per batch whether repair effort is justified.
 * <p><strong>Rules</strong> (first match wins):
 * <ol>
 *   <li>No corrupted artifacts: skip, high confidence.</li>
 *   <li>No corrupted artifact in tiers 1 to 3: skip, high confidence.</li>
 *   <li>Valid count below the low-yield threshold: perform, high confidence, whatever the estimate.</li>
 *   <li>Estimate at or above the repair threshold: perform; high confidence once the estimate clears the threshold
 *       by the configured margin, medium otherwise.</li>
 *   <li>Otherwise: skip, medium confidence.</li>
 * </ol>
 * <p>The estimate is the success rate averaged over all corrupted artifacts, weighted by count per type, rounded
 * to one decimal.</p>
 * <p><strong>Thread-safety:</strong> Immutable; a pure function of its inputs.</p>
 *
 * @since 0.1.0
 */
public final class DecisionEngine {
  private final SuccessRateTable rates;
  private final DecisionThresholds thresholds;

  public DecisionEngine(SuccessRateTable rates, DecisionThresholds thresholds) {
    this.rates = Objects.requireNonNull(rates, "rates");
    this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
  }

  /**
   * Computes the batch decision.
   *
   * @param stats classification counts for the batch
   * @return decision with reasoning and projected outcome
   */
  public BatchDecision decide(BatchStatistics stats) {
    Objects.requireNonNull(stats, "stats");
    double estimate = estimate(stats);
    int repairable = stats.repairableCount();

    Strategy strategy;
    Confidence confidence;
    DecisionRule rule;
    String reasoning;
    if (stats.corrupted() == 0) {
      strategy = Strategy.SKIP_REPAIR;
      confidence = Confidence.HIGH;
      rule = DecisionRule.NO_CORRUPTION;
      reasoning = format("Rule 1: no corrupted artifacts among %d; repair is unnecessary", stats.total());
    } else if (repairable == 0) {
      strategy = Strategy.SKIP_REPAIR;
      confidence = Confidence.HIGH;
      rule = DecisionRule.NO_REPAIRABLE;
      reasoning = format("Rule 2: none of the %d corrupted artifacts has a repairable tier (1-%d)",
          stats.corrupted(), CorruptionType.MAX_REPAIRABLE_TIER);
    } else if (stats.valid() < thresholds.lowYieldThreshold()) {
      strategy = Strategy.PERFORM_REPAIR;
      confidence = Confidence.HIGH;
      rule = DecisionRule.LOW_YIELD;
      reasoning = format("Rule 3: only %d valid artifacts, below low-yield threshold %d; repairing %d "
          + "repairable artifacts regardless of estimated %.1f%% success",
          stats.valid(), thresholds.lowYieldThreshold(), repairable, estimate);
    } else if (estimate >= thresholds.repairThreshold()) {
      strategy = Strategy.PERFORM_REPAIR;
      double highBar = thresholds.repairThreshold() + thresholds.highConfidenceMargin();
      confidence = estimate >= highBar ? Confidence.HIGH : Confidence.MEDIUM;
      rule = DecisionRule.HIGH_ESTIMATE;
      reasoning = format("Rule 4: estimated %.1f%% success for %d repairable artifacts is at or above threshold "
          + "%.1f%% (high confidence from %.1f%%)", estimate, repairable, thresholds.repairThreshold(), highBar);
    } else {
      strategy = Strategy.SKIP_REPAIR;
      confidence = Confidence.MEDIUM;
      rule = DecisionRule.LOW_ESTIMATE;
      reasoning = format("Rule 5: estimated %.1f%% success for %d repairable artifacts is below threshold %.1f%% "
          + "with %d valid artifacts (integrity %.2f%%)", estimate, repairable, thresholds.repairThreshold(),
          stats.valid(), stats.integrityScore());
    }

    ExpectedOutcome outcome = expectedOutcome(stats, strategy, repairable, estimate);
    return new BatchDecision(strategy, confidence, rule, estimate, repairable, stats, outcome, reasoning,
        Optional.empty());
  }

  /**
   * Weighted success estimate over the corrupted artifacts.
   *
   * @param stats batch statistics
   * @return estimate in percent, rounded to one decimal; {@code 0.0} without corrupted artifacts
   */
  public double estimate(BatchStatistics stats) {
    if (stats.corrupted() == 0) {
      return 0.0;
    }
    double weighted = 0.0;
    for (Map.Entry<CorruptionType, Integer> entry : stats.corruptedByType().entrySet()) {
      weighted += rates.rateFor(entry.getKey()) * entry.getValue();
    }
    return Percentages.round1(weighted / stats.corrupted());
  }

  private static ExpectedOutcome expectedOutcome(
      BatchStatistics stats, Strategy strategy, int repairable, double estimate) {
    double integrity = stats.integrityScore();
    if (strategy == Strategy.SKIP_REPAIR) {
      return new ExpectedOutcome(stats.valid(), 0, stats.valid(), integrity, 0.0);
    }
    int additional = (int) Math.floor(repairable * estimate / 100.0);
    int finalCount = stats.valid() + additional;
    double finalPercent = Percentages.round2(finalCount * 100.0 / Math.max(stats.total(), 1));
    return new ExpectedOutcome(stats.valid(), additional, finalCount, finalPercent,
        Percentages.round2(finalPercent - integrity));
  }

  private static String format(String template, Object... args) {
    return String.format(Locale.ROOT, template, args);
  }
}
