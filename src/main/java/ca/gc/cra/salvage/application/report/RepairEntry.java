package ca.gc.cra.salvage.application.report;

import ca.gc.cra.salvage.domain.repair.RepairOutcome;
import java.util.Objects;
import java.util.Optional;

/**
 * One attempted repair as listed in the repair report.
 *
 * @param outcome engine outcome
 * @param outputPath where the repaired artifact was stored, when repair succeeded
 * @since 0.1.0
 */
public record RepairEntry(RepairOutcome outcome, Optional<String> outputPath) {
  public RepairEntry {
    Objects.requireNonNull(outcome, "outcome");
    outputPath = Objects.requireNonNullElse(outputPath, Optional.empty());
  }

  public String id() {
    return outcome.artifactId();
  }
}
