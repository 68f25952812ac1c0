package ca.gc.cra.salvage.application.report;

import java.util.Objects;

/**
 * A non-valid artifact the repair stage did not attempt, with the reason.
 *
 * @param id artifact identifier
 * @param corruptionType report name of the artifact's corruption type
 * @param reason why no repair was attempted
 * @since 0.1.0
 */
public record NotAttemptedEntry(String id, String corruptionType, String reason) {
  public NotAttemptedEntry {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(corruptionType, "corruptionType");
    Objects.requireNonNull(reason, "reason");
  }
}
