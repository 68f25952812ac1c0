package ca.gc.cra.salvage.domain.decision;

import ca.gc.cra.salvage.validation.Strings;
import java.time.Instant;
import java.util.Objects;

/**
 * Operator-approved replacement for the automatic strategy.
 *
 * @param strategy strategy chosen by the operator
 * @param justification why the automatic recommendation was overridden
 * @param approver identity of the approving operator
 * @param recordedAt when the override was recorded
 * @since 0.1.0
 */
public record ManualOverride(Strategy strategy, String justification, String approver, Instant recordedAt) {
  public ManualOverride {
    Objects.requireNonNull(strategy, "strategy");
    justification = Strings.requireNonBlank("justification", justification);
    approver = Strings.requireNonBlank("approver", approver);
    Objects.requireNonNull(recordedAt, "recordedAt");
  }
}
