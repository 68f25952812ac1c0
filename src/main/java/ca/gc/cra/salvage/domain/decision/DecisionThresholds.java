package ca.gc.cra.salvage.domain.decision;

/**
 * Thresholds used by the {@link DecisionEngine}.
 *
 * @param lowYieldThreshold valid counts below this always perform repair
 * @param repairThreshold minimum estimate (percent) for repair to be worth it
 * @param highConfidenceMargin how far above {@code repairThreshold} the estimate must be for high confidence
 * @since 0.1.0
 */
public record DecisionThresholds(int lowYieldThreshold, double repairThreshold, double highConfidenceMargin) {
  public static final int DEFAULT_LOW_YIELD_THRESHOLD = 50;
  public static final double DEFAULT_REPAIR_THRESHOLD = 50.0;
  public static final double DEFAULT_HIGH_CONFIDENCE_MARGIN = 20.0;

  public DecisionThresholds {
    if (lowYieldThreshold < 0) {
      throw new IllegalArgumentException("lowYieldThreshold must be non-negative");
    }
    if (repairThreshold < 0.0 || repairThreshold > 100.0 || Double.isNaN(repairThreshold)) {
      throw new IllegalArgumentException("repairThreshold must be within [0, 100]");
    }
    if (highConfidenceMargin < 0.0 || Double.isNaN(highConfidenceMargin)) {
      throw new IllegalArgumentException("highConfidenceMargin must be non-negative");
    }
  }

  public static DecisionThresholds defaults() {
    return new DecisionThresholds(
        DEFAULT_LOW_YIELD_THRESHOLD, DEFAULT_REPAIR_THRESHOLD, DEFAULT_HIGH_CONFIDENCE_MARGIN);
  }
}
