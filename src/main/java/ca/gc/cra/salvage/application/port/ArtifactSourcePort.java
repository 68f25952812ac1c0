package ca.gc.cra.salvage.application.port;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import java.io.IOException;
import java.util.List;

/**
 * Read-only access to the evidence set.
 *
 * <p>Implementations never write to, rename or lock the files they expose.</p>
 *
 * @since 0.1.0
 */
public interface ArtifactSourcePort {
  /**
   * Lists the artifacts in the evidence set.
   *
   * @return references sorted by id
   * @throws IOException when the evidence set itself cannot be enumerated
   */
  List<ArtifactRef> list() throws IOException;

  /**
   * Reads one artifact into memory.
   *
   * @param ref reference returned by {@link #list()} or rebuilt from a report
   * @return immutable artifact
   * @throws IOException when the file cannot be read
   */
  ImageArtifact read(ArtifactRef ref) throws IOException;
}
