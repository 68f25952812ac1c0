package ca.gc.cra.salvage.domain.repair;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.classify.RepairTechnique;
import ca.gc.cra.salvage.domain.container.ContainerStructure;
import java.util.List;

/**
 * Implementation of one {@link RepairTechnique}.
 *
 * <p>Handlers read the original bytes and never modify them. Malformed input is an expected case: handlers report
 * it as a failed step and never throw for it. A handler with a fallback returns one result per step it tried,
 * stopping at the first locally valid candidate.</p>
 *
 * @since 0.1.0
 */
public interface TechniqueHandler {
  RepairTechnique technique();

  /**
   * Applies the technique.
   *
   * @param artifact artifact to reconstruct from
   * @param structure container facts for {@code artifact}
   * @return steps tried, in order; never empty
   */
  List<TechniqueResult> apply(ImageArtifact artifact, ContainerStructure structure);
}
