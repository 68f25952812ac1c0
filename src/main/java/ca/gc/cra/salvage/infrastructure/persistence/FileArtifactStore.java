package ca.gc.cra.salvage.infrastructure.persistence;

import ca.gc.cra.salvage.application.port.ArtifactStorePort;
import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes repaired artifacts under {@code <out>/repaired/} with {@link AtomicFiles}, so a cancelled run never leaves a
 * half-written image behind.
 *
 * @since 0.1.0
 */
public final class FileArtifactStore implements ArtifactStorePort {
  private static final Logger log = LoggerFactory.getLogger(FileArtifactStore.class);
  static final String REPAIRED_DIR = "repaired";

  private final Path directory;
  private final boolean allowOverwrite;

  /**
   * Creates a store rooted at {@code outputRoot}.
   *
   * @param outputRoot run output directory
   * @param allowOverwrite whether an existing file with the same name may be replaced
   */
  public FileArtifactStore(Path outputRoot, boolean allowOverwrite) {
    this.directory = Objects.requireNonNull(outputRoot, "outputRoot").resolve(REPAIRED_DIR);
    this.allowOverwrite = allowOverwrite;
  }

  @Override
  public Path store(ImageArtifact artifact, String fileName) throws IOException {
    Objects.requireNonNull(artifact, "artifact");
    if (fileName == null || fileName.isBlank() || fileName.contains("/") || fileName.contains("\\")) {
      throw new IllegalArgumentException("fileName must be a plain file name: " + fileName);
    }
    Path target = directory.resolve(fileName);
    AtomicFiles.write(target, artifact.content(), allowOverwrite);
    log.debug("Stored {} ({} bytes) at {}", artifact.id(), artifact.size(), target);
    return target;
  }
}
