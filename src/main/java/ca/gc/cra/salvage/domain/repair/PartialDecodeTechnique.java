package ca.gc.cra.salvage.domain.repair;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.classify.RepairTechnique;
import ca.gc.cra.salvage.domain.container.ContainerStructure;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the rows that decode cleanly and re-encodes them as a new, smaller image.
 */
public final class PartialDecodeTechnique implements TechniqueHandler {
  private final PixelRecovery recovery;

  public PartialDecodeTechnique(PixelRecovery recovery) {
    this.recovery = Objects.requireNonNull(recovery, "recovery");
  }

  @Override
  public RepairTechnique technique() {
    return RepairTechnique.PARTIAL_DECODE_REENCODE;
  }

  @Override
  public List<TechniqueResult> apply(ImageArtifact artifact, ContainerStructure structure) {
    Optional<PixelRecovery.RecoveredImage> recovered = recovery.recover(artifact.content(), artifact.format());
    if (recovered.isEmpty()) {
      return List.of(TechniqueResult.failed("no complete pixel rows could be decoded"));
    }
    PixelRecovery.RecoveredImage image = recovered.get();
    byte[] encoded = image.encoded();
    if (!SelfCheck.isSound(artifact.format(), encoded)) {
      return List.of(TechniqueResult.failed("re-encoded image is not a sound container"));
    }
    return List.of(TechniqueResult.produced(encoded,
        "re-encoded " + image.rowsRecovered() + " of " + image.declaredHeight() + " rows"));
  }
}
