package ca.gc.cra.salvage.domain.decision;

/**
 * Projected batch result of the chosen strategy.
 *
 * @param currentValid valid artifacts before repair
 * @param expectedAdditional artifacts expected to become valid; zero when repair is skipped
 * @param finalExpectedCount {@code currentValid + expectedAdditional}
 * @param finalExpectedPercent projected integrity score
 * @param improvementPercentagePoints projected gain over the current integrity score
 * @since 0.1.0
 */
public record ExpectedOutcome(
    int currentValid,
    int expectedAdditional,
    int finalExpectedCount,
    double finalExpectedPercent,
    double improvementPercentagePoints) {

  public ExpectedOutcome {
    if (currentValid < 0 || expectedAdditional < 0) {
      throw new IllegalArgumentException("counts must be non-negative");
    }
    if (finalExpectedCount != currentValid + expectedAdditional) {
      throw new IllegalArgumentException("finalExpectedCount must equal currentValid + expectedAdditional");
    }
  }
}
