package ca.gc.cra.salvage.application.report;

import ca.gc.cra.salvage.domain.decision.Percentages;

/**
 * Classification counts for one format or recovery method.
 *
 * @param total artifacts in the group
 * @param valid valid artifacts
 * @param corrupted corrupted artifacts
 * @param unrecoverable unrecoverable artifacts
 * @since 0.1.0
 */
public record Breakdown(int total, int valid, int corrupted, int unrecoverable) {
  public double integrityScore() {
    return Percentages.round2(valid * 100.0 / Math.max(total, 1));
  }

  Breakdown plus(Breakdown other) {
    return new Breakdown(total + other.total, valid + other.valid, corrupted + other.corrupted,
        unrecoverable + other.unrecoverable);
  }
}
