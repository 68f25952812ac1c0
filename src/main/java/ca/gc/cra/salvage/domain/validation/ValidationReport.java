package ca.gc.cra.salvage.domain.validation;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Verdicts collected by the {@link ValidationOracle} for one artifact.
 *
 * @param artifactId artifact the verdicts describe
 * @param verdicts verdicts in execution order
 * @param unavailableChecks checks that were registered and applicable but could not run
 * @param requiredChecks names of the checks that define repair success
 * @since 0.1.0
 */
public record ValidationReport(
    String artifactId,
    List<ValidationVerdict> verdicts,
    List<String> unavailableChecks,
    Set<String> requiredChecks) {

  public ValidationReport {
    Objects.requireNonNull(artifactId, "artifactId");
    verdicts = List.copyOf(Objects.requireNonNull(verdicts, "verdicts"));
    unavailableChecks = List.copyOf(Objects.requireNonNull(unavailableChecks, "unavailableChecks"));
    requiredChecks = Set.copyOf(Objects.requireNonNull(requiredChecks, "requiredChecks"));
  }

  public boolean allPassed() {
    return !verdicts.isEmpty() && verdicts.stream().allMatch(ValidationVerdict::passed);
  }

  public boolean anyPassed() {
    return verdicts.stream().anyMatch(ValidationVerdict::passed);
  }

  public List<String> checksRun() {
    return verdicts.stream().map(ValidationVerdict::checkName).toList();
  }

  public List<String> failedChecks() {
    return verdicts.stream().filter(v -> !v.passed()).map(ValidationVerdict::checkName).toList();
  }

  /**
   * Whether every required check produced a passing verdict. A required check missing from the verdict list
   * (because an earlier check short-circuited) counts as not passed.
   *
   * @return {@code true} when the artifact satisfies the required checks
   */
  public boolean requiredPassed() {
    for (String required : requiredChecks) {
      boolean passed = verdicts.stream().anyMatch(v -> v.checkName().equals(required) && v.passed());
      if (!passed) {
        return false;
      }
    }
    return true;
  }
}
