package ca.gc.cra.salvage.application.port;

import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Location and provenance of one recovered file, before its bytes are read.
 *
 * @param id stable artifact identifier
 * @param path file location
 * @param recoveryMethod recovery method label ({@code fs_based}, {@code carved}, ...)
 * @param declaredFormat format declared by a catalog, if any
 * @since 0.1.0
 */
public record ArtifactRef(String id, Path path, String recoveryMethod, Optional<ImageFormat> declaredFormat) {
  public ArtifactRef {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(path, "path");
    recoveryMethod = recoveryMethod == null || recoveryMethod.isBlank() ? "unknown" : recoveryMethod.trim();
    declaredFormat = Objects.requireNonNullElse(declaredFormat, Optional.empty());
  }
}
