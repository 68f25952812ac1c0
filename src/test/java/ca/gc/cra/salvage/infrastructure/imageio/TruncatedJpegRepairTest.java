package ca.gc.cra.salvage.infrastructure.imageio;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.classify.Classification;
import ca.gc.cra.salvage.domain.classify.ClassifierSettings;
import ca.gc.cra.salvage.domain.classify.CorruptionClassifier;
import ca.gc.cra.salvage.domain.classify.CorruptionRecord;
import ca.gc.cra.salvage.domain.classify.CorruptionType;
import ca.gc.cra.salvage.domain.classify.RepairTechnique;
import ca.gc.cra.salvage.domain.repair.RepairEngine;
import ca.gc.cra.salvage.domain.repair.RepairOutcome;
import ca.gc.cra.salvage.domain.repair.RepairSettings;
import ca.gc.cra.salvage.domain.repair.RepairStatus;
import ca.gc.cra.salvage.domain.validation.ArtifactCheck;
import ca.gc.cra.salvage.domain.validation.ValidationOracle;
import ca.gc.cra.salvage.fixtures.ImageFixtures;
import ca.gc.cra.salvage.infrastructure.check.ImageIoDecodeCheck;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** A JPEG cut mid-scan, classified and repaired with the real decoder in the loop. */
class TruncatedJpegRepairTest {
  private final ValidationOracle oracle = withDecode();
  private final CorruptionClassifier classifier = new CorruptionClassifier(ClassifierSettings.defaults());
  private final RepairEngine engine =
      new RepairEngine(oracle, classifier, new ImageIoPixelRecovery(), RepairSettings.defaults());

  @Test
  void cutInsideScanIsTruncatedNotMissingFooter() {
    ImageArtifact artifact = ImageArtifact.of(
        "cut.jpg", ImageFixtures.jpegCutInScan(256, 256), "/evidence/cut.jpg", "carving");

    CorruptionRecord record = classifier.classify(artifact, oracle.validate(artifact));

    assertEquals(Classification.CORRUPTED, record.classification());
    assertEquals(CorruptionType.TRUNCATED, record.corruptionType());
    assertEquals(Optional.of(RepairTechnique.PARTIAL_DECODE_REENCODE), record.recommendedTechnique());
    assertTrue(record.failedChecks().contains("decode"), record.failedChecks().toString());
  }

  @Test
  void repairedOutputDecodesCleanly() {
    ImageArtifact artifact = ImageArtifact.of(
        "cut.jpg", ImageFixtures.jpegCutInScan(256, 256), "/evidence/cut.jpg", "carving");
    CorruptionRecord record = classifier.classify(artifact, oracle.validate(artifact));

    RepairOutcome outcome = engine.repair(artifact, record);

    assertEquals(RepairStatus.REPAIRED, outcome.status(), outcome.note());
    assertEquals(Optional.of(RepairTechnique.PARTIAL_DECODE_REENCODE), outcome.technique());
    CorruptionRecord after = outcome.finalRecord().orElseThrow();
    assertEquals(Classification.VALID, after.classification());
    assertEquals(List.of(), after.failedChecks());
  }

  private static ValidationOracle withDecode() {
    List<ArtifactCheck> checks = new ArrayList<>(ValidationOracle.builtInChecks());
    checks.add(new ImageIoDecodeCheck());
    return new ValidationOracle(checks);
  }
}
