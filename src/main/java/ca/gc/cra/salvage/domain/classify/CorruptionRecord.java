package ca.gc.cra.salvage.domain.classify;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Classification outcome for one artifact. Never mutated; re-classification produces a new record.
 *
 * @param artifactId artifact the record describes
 * @param classification tri-state classification
 * @param corruptionType derived corruption type ({@link CorruptionType#NONE} when valid)
 * @param repairabilityTier tier looked up from {@code corruptionType}
 * @param recommendedTechnique technique for corrupted artifacts with a mapped technique
 * @param confidence confidence, lowered for each unavailable check
 * @param checksRun checks that produced a verdict
 * @param failedChecks checks that failed
 * @param unavailableChecks checks that could not run
 * @since 0.1.0
 */
public record CorruptionRecord(
    String artifactId,
    Classification classification,
    CorruptionType corruptionType,
    int repairabilityTier,
    Optional<RepairTechnique> recommendedTechnique,
    Confidence confidence,
    List<String> checksRun,
    List<String> failedChecks,
    List<String> unavailableChecks) {

  public CorruptionRecord {
    Objects.requireNonNull(artifactId, "artifactId");
    Objects.requireNonNull(classification, "classification");
    Objects.requireNonNull(corruptionType, "corruptionType");
    Objects.requireNonNull(confidence, "confidence");
    recommendedTechnique = Objects.requireNonNullElse(recommendedTechnique, Optional.empty());
    checksRun = List.copyOf(Objects.requireNonNull(checksRun, "checksRun"));
    failedChecks = List.copyOf(Objects.requireNonNull(failedChecks, "failedChecks"));
    unavailableChecks = List.copyOf(Objects.requireNonNull(unavailableChecks, "unavailableChecks"));
    if (repairabilityTier != corruptionType.tier()) {
      throw new IllegalArgumentException("repairabilityTier " + repairabilityTier
          + " does not match " + corruptionType.reportName() + " tier " + corruptionType.tier());
    }
    if (classification == Classification.VALID && corruptionType != CorruptionType.NONE) {
      throw new IllegalArgumentException("valid artifacts carry no corruption type");
    }
  }

  public boolean isValid() {
    return classification == Classification.VALID;
  }

  public boolean isCorrupted() {
    return classification == Classification.CORRUPTED;
  }

  public boolean isUnrecoverable() {
    return classification == Classification.UNRECOVERABLE;
  }
}
