package ca.gc.cra.salvage.application.report;

import ca.gc.cra.salvage.application.port.ArtifactRef;
import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import ca.gc.cra.salvage.domain.classify.CorruptionRecord;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * One classified artifact as listed in the validation report.
 *
 * @param id artifact identifier
 * @param sourcePath location the bytes were read from
 * @param recoveryMethod recovery method label
 * @param format detected container format
 * @param size size in bytes at classification time
 * @param sha256 content digest at classification time, or {@code ""} when the report predates digests
 * @param record classification result
 * @since 0.1.0
 */
public record ArtifactEntry(
    String id, String sourcePath, String recoveryMethod, ImageFormat format, long size, String sha256,
    CorruptionRecord record) {

  public ArtifactEntry {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(sourcePath, "sourcePath");
    Objects.requireNonNull(recoveryMethod, "recoveryMethod");
    Objects.requireNonNull(format, "format");
    sha256 = Objects.requireNonNullElse(sha256, "");
    Objects.requireNonNull(record, "record");
    if (!id.equals(record.artifactId())) {
      throw new IllegalArgumentException("record " + record.artifactId() + " does not describe " + id);
    }
  }

  /**
   * Reference for reading the artifact again.
   *
   * @return artifact reference
   */
  public ArtifactRef toRef() {
    return new ArtifactRef(id, Path.of(sourcePath), recoveryMethod, Optional.of(format));
  }
}
