package ca.gc.cra.salvage.domain.repair;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.classify.CorruptionRecord;
import ca.gc.cra.salvage.domain.classify.RepairTechnique;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything the repair engine did for one artifact.
 *
 * @param artifactId original artifact
 * @param originalRecord classification that selected the technique
 * @param status overall result
 * @param technique technique dispatched, if any
 * @param attempts steps in the order they were tried
 * @param artifact repaired artifact for {@link RepairStatus#REPAIRED}, the original for {@link RepairStatus#UNCHANGED}
 * @param finalRecord re-classification of {@code artifact}, or the original record for unchanged artifacts
 * @param note summary for reports
 * @since 0.1.0
 */
public record RepairOutcome(
    String artifactId,
    CorruptionRecord originalRecord,
    RepairStatus status,
    Optional<RepairTechnique> technique,
    List<RepairAttempt> attempts,
    Optional<ImageArtifact> artifact,
    Optional<CorruptionRecord> finalRecord,
    String note) {

  public RepairOutcome {
    Objects.requireNonNull(artifactId, "artifactId");
    Objects.requireNonNull(originalRecord, "originalRecord");
    Objects.requireNonNull(status, "status");
    technique = Objects.requireNonNullElse(technique, Optional.empty());
    attempts = List.copyOf(Objects.requireNonNull(attempts, "attempts"));
    artifact = Objects.requireNonNullElse(artifact, Optional.empty());
    finalRecord = Objects.requireNonNullElse(finalRecord, Optional.empty());
    note = Objects.requireNonNullElse(note, "");
  }

  static RepairOutcome unchanged(ImageArtifact original, CorruptionRecord record) {
    return new RepairOutcome(original.id(), record, RepairStatus.UNCHANGED, Optional.empty(), List.of(),
        Optional.of(original), Optional.of(record), "already valid");
  }

  static RepairOutcome notAttempted(CorruptionRecord record, String note) {
    return new RepairOutcome(record.artifactId(), record, RepairStatus.NOT_ATTEMPTED, Optional.empty(), List.of(),
        Optional.empty(), Optional.empty(), note);
  }

  /**
   * The same outcome turned into a failure, for a repair that verified but could not be kept.
   *
   * @param reason why the repaired artifact was dropped
   * @return failed outcome with the attempts preserved
   */
  public RepairOutcome discarded(String reason) {
    return new RepairOutcome(artifactId, originalRecord, RepairStatus.FAILED, technique, attempts,
        Optional.empty(), Optional.empty(), reason);
  }

  public boolean repaired() {
    return status == RepairStatus.REPAIRED;
  }
}
