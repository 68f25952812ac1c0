package ca.gc.cra.salvage.domain.validation;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.artifact.ImageFormat;

/**
 * <strong>What:</strong> Capability producing a pass/fail verdict for an artifact.
 * <p><strong>Why:</strong> Callers depend only on the verdict shape, not on which checker (byte inspection,
 * decode library, external auditor) is installed.</p>
 * <p><strong>Role:</strong> Port implemented by the built-in byte checks in this package and by infrastructure
 * adapters; the set is fixed when the {@link ValidationOracle} is built.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use across artifacts.</p>
 *
 * @since 0.1.0
 */
public interface ArtifactCheck {
  /**
   * Stable check name used in verdicts and reports.
   *
   * @return check name
   */
  String name();

  /**
   * Whether repair success depends on this check passing.
   *
   * @return {@code true} for the always-available built-in checks
   */
  boolean required();

  /**
   * Relative cost, used to run cheap checks first.
   *
   * @return cost class
   */
  CheckCost cost();

  /**
   * Whether the check has an opinion on artifacts of {@code format}. Checks that do not apply are skipped
   * silently rather than reported unavailable.
   *
   * @param format artifact format
   * @return {@code true} when the check should run
   */
  default boolean appliesTo(ImageFormat format) {
    return true;
  }

  /**
   * Whether a failure of this check makes every later check pointless (e.g. a zero-byte file).
   *
   * @return {@code true} to stop the oracle after a failed verdict
   */
  default boolean terminalOnFailure() {
    return false;
  }

  /**
   * Runs the check.
   *
   * @param artifact artifact to inspect; never modified
   * @return verdict
   * @throws CheckUnavailableException when the check could not produce a verdict
   */
  ValidationVerdict check(ImageArtifact artifact) throws CheckUnavailableException;
}
