package ca.gc.cra.salvage.application.report;

import java.util.Objects;

/**
 * An input that could not be classified, with the reason.
 *
 * @param id artifact identifier
 * @param sourcePath file location
 * @param reason why the artifact was skipped
 * @since 0.1.0
 */
public record SkippedEntry(String id, String sourcePath, String reason) {
  public SkippedEntry {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(sourcePath, "sourcePath");
    Objects.requireNonNull(reason, "reason");
  }
}
