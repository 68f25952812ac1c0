package ca.gc.cra.salvage.domain.repair;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.classify.RepairTechnique;
import ca.gc.cra.salvage.domain.validation.ValidationVerdict;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One technique step applied to one artifact.
 *
 * @param technique technique applied
 * @param inputArtifactId artifact the step read from
 * @param outputArtifact derived artifact, when the step produced bytes
 * @param success whether the output passed every required check
 * @param verdictsAfter oracle verdicts for the output; empty when no output was produced
 * @param note what the step did or why it failed
 * @since 0.1.0
 */
public record RepairAttempt(
    RepairTechnique technique,
    String inputArtifactId,
    Optional<ImageArtifact> outputArtifact,
    boolean success,
    List<ValidationVerdict> verdictsAfter,
    String note) {

  public RepairAttempt {
    Objects.requireNonNull(technique, "technique");
    Objects.requireNonNull(inputArtifactId, "inputArtifactId");
    outputArtifact = Objects.requireNonNullElse(outputArtifact, Optional.empty());
    verdictsAfter = List.copyOf(Objects.requireNonNull(verdictsAfter, "verdictsAfter"));
    note = Objects.requireNonNullElse(note, "");
    if (success && outputArtifact.isEmpty()) {
      throw new IllegalArgumentException("a successful attempt must carry an output artifact");
    }
  }

  static RepairAttempt withoutOutput(RepairTechnique technique, String inputArtifactId, String note) {
    return new RepairAttempt(technique, inputArtifactId, Optional.empty(), false, List.of(), note);
  }
}
