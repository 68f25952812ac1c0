package ca.gc.cra.salvage.domain.validation;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one independent validity check on an artifact.
 *
 * @param checkName name of the check that produced the verdict
 * @param passed whether the artifact passed
 * @param diagnostic optional explanation, typically present on failure
 * @since 0.1.0
 */
public record ValidationVerdict(String checkName, boolean passed, Optional<String> diagnostic) {

  public ValidationVerdict {
    Objects.requireNonNull(checkName, "checkName");
    diagnostic = Objects.requireNonNullElse(diagnostic, Optional.empty());
  }

  public static ValidationVerdict pass(String checkName) {
    return new ValidationVerdict(checkName, true, Optional.empty());
  }

  public static ValidationVerdict fail(String checkName, String diagnostic) {
    return new ValidationVerdict(checkName, false, Optional.ofNullable(diagnostic));
  }
}
