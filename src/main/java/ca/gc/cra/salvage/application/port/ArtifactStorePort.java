package ca.gc.cra.salvage.application.port;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Destination for repaired artifacts.
 *
 * <p>Writes are all-or-nothing: a failed or interrupted write leaves no file at the target location.</p>
 *
 * @since 0.1.0
 */
public interface ArtifactStorePort {
  /**
   * Stores a repaired artifact.
   *
   * @param artifact artifact to write
   * @param fileName file name relative to the store root
   * @return location of the stored file
   * @throws IOException when the file cannot be written
   */
  Path store(ImageArtifact artifact, String fileName) throws IOException;
}
