package ca.gc.cra.salvage.domain.repair;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.classify.Classification;
import ca.gc.cra.salvage.domain.classify.ClassifierSettings;
import ca.gc.cra.salvage.domain.classify.CorruptionClassifier;
import ca.gc.cra.salvage.domain.classify.CorruptionRecord;
import ca.gc.cra.salvage.domain.classify.CorruptionType;
import ca.gc.cra.salvage.domain.classify.RepairTechnique;
import ca.gc.cra.salvage.domain.validation.ArtifactCheck;
import ca.gc.cra.salvage.domain.validation.CheckCost;
import ca.gc.cra.salvage.domain.validation.ValidationOracle;
import ca.gc.cra.salvage.domain.validation.ValidationVerdict;
import ca.gc.cra.salvage.fixtures.ImageFixtures;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RepairEngineTest {
  private static final PixelRecovery NOTHING_DECODES = (data, format) -> Optional.empty();

  private final ValidationOracle oracle = ValidationOracle.builtIn();
  private final CorruptionClassifier classifier = new CorruptionClassifier(ClassifierSettings.defaults());
  private final RepairEngine engine =
      new RepairEngine(oracle, classifier, NOTHING_DECODES, RepairSettings.defaults());

  @Test
  void appendsMissingJpegFooter() {
    byte[] original = ImageFixtures.jpeg();
    ImageArtifact artifact = artifact("a.jpg", Arrays.copyOf(original, original.length - 2));
    byte[] before = artifact.copyContent();

    RepairOutcome outcome = engine.repair(artifact, classify(artifact));

    assertEquals(RepairStatus.REPAIRED, outcome.status());
    ImageArtifact repaired = outcome.artifact().orElseThrow();
    assertEquals("a.jpg#footer_append", repaired.id());
    assertArrayEquals(original, repaired.content());
    assertTrue(ImageFixtures.endsWithJpegFooter(repaired.content()));
    assertEquals(Classification.VALID, outcome.finalRecord().orElseThrow().classification());
    assertArrayEquals(before, artifact.content());
  }

  @Test
  void appendsMissingPngIend() {
    ImageArtifact artifact = artifact("b.png", ImageFixtures.pngWithoutFooter());

    RepairOutcome outcome = engine.repair(artifact, classify(artifact));

    assertTrue(outcome.repaired());
    assertArrayEquals(ImageFixtures.png(), outcome.artifact().orElseThrow().content());
    assertEquals(1, outcome.attempts().size());
    assertTrue(outcome.attempts().get(0).success());
  }

  @Test
  void discardsLeadingGarbage() {
    byte[] original = ImageFixtures.jpeg();
    ImageArtifact artifact = artifact("g.jpg", ImageFixtures.withGarbagePrefix(original, 512));

    RepairOutcome outcome = engine.repair(artifact, classify(artifact));

    assertEquals(RepairStatus.REPAIRED, outcome.status());
    assertEquals(Optional.of(RepairTechnique.HEADER_RECONSTRUCTION), outcome.technique());
    assertArrayEquals(original, outcome.artifact().orElseThrow().content());
  }

  @Test
  void garbageBeyondSearchWindowFallsBackToSynthesizedHeader() {
    RepairEngine narrow = new RepairEngine(oracle, classifier, NOTHING_DECODES, new RepairSettings(16));
    ImageArtifact artifact = artifact("g.jpg", ImageFixtures.withGarbagePrefix(ImageFixtures.jpeg(), 64));

    RepairOutcome outcome = narrow.repair(artifact, classify(artifact));

    assertTrue(outcome.repaired());
    assertEquals(1, outcome.attempts().size());
    assertTrue(outcome.attempts().get(0).note().contains("synthesized header"));
    assertEquals(Classification.VALID, outcome.finalRecord().orElseThrow().classification());
  }

  @Test
  void stripsInconsistentSegment() {
    ImageArtifact artifact = artifact("s.jpg", ImageFixtures.jpegWithCorruptSegment());

    RepairOutcome outcome = engine.repair(artifact, classify(artifact));

    assertEquals(RepairStatus.REPAIRED, outcome.status());
    assertArrayEquals(ImageFixtures.jpeg(), outcome.artifact().orElseThrow().content());
  }

  @Test
  void partialDecodeFailsWhenNoRowsDecode() {
    ImageArtifact artifact = artifact("t.jpg", ImageFixtures.jpegTruncatedInHeader());
    CorruptionRecord record = classify(artifact);

    RepairOutcome outcome = engine.repair(artifact, record);

    assertEquals(CorruptionType.TRUNCATED, record.corruptionType());
    assertEquals(RepairStatus.FAILED, outcome.status());
    assertTrue(outcome.artifact().isEmpty());
    assertFalse(outcome.attempts().get(0).outputArtifact().isPresent());
  }

  @Test
  void partialDecodeAcceptsRecoveredRows() {
    byte[] smaller = ImageFixtures.jpeg(32, 8);
    PixelRecovery recovery = (data, format) -> Optional.of(new PixelRecovery.RecoveredImage(smaller, 8, 32));
    RepairEngine withRecovery = new RepairEngine(oracle, classifier, recovery, RepairSettings.defaults());
    ImageArtifact artifact = artifact("t.jpg", ImageFixtures.jpegTruncatedInHeader());

    RepairOutcome outcome = withRecovery.repair(artifact, classify(artifact));

    assertTrue(outcome.repaired());
    assertEquals("t.jpg#partial_decode_reencode", outcome.artifact().orElseThrow().id());
    assertEquals("re-encoded 8 of 32 rows", outcome.note());
  }

  @Test
  void validArtifactIsReturnedUnchanged() {
    ImageArtifact artifact = artifact("a.jpg", ImageFixtures.jpeg());

    RepairOutcome outcome = engine.repair(artifact, classify(artifact));

    assertEquals(RepairStatus.UNCHANGED, outcome.status());
    assertEquals(artifact, outcome.artifact().orElseThrow());
    assertTrue(outcome.attempts().isEmpty());
  }

  @Test
  void fragmentedArtifactIsNotAttempted() {
    ImageArtifact artifact = artifact("f.jpg", ImageFixtures.fragmentedJpeg());

    RepairOutcome outcome = engine.repair(artifact, classify(artifact));

    assertEquals(RepairStatus.NOT_ATTEMPTED, outcome.status());
    assertTrue(outcome.note().contains("fragmented"));
  }

  @Test
  void unrecoverableArtifactIsRejected() {
    ImageArtifact artifact = artifact("fp.jpg", ImageFixtures.jpegFalsePositive());
    CorruptionRecord record = classify(artifact);

    assertThrows(IllegalArgumentException.class, () -> engine.repair(artifact, record));
  }

  @Test
  void recordForAnotherArtifactIsRejected() {
    ImageArtifact artifact = artifact("a.jpg", ImageFixtures.jpegWithoutFooter());
    CorruptionRecord record = classify(artifact("other.jpg", ImageFixtures.jpegWithoutFooter()));

    assertThrows(IllegalArgumentException.class, () -> engine.repair(artifact, record));
  }

  @Test
  void techniqueMapping() throws Exception {
    assertEquals(RepairTechnique.FOOTER_APPEND, RepairEngine.techniqueFor(CorruptionType.MISSING_FOOTER));
    assertEquals(RepairTechnique.PARTIAL_DECODE_REENCODE, RepairEngine.techniqueFor(CorruptionType.CORRUPT_DATA));
    TechniqueNotApplicableException ex = assertThrows(TechniqueNotApplicableException.class,
        () -> RepairEngine.techniqueFor(CorruptionType.FALSE_POSITIVE));
    assertEquals(CorruptionType.FALSE_POSITIVE, ex.corruptionType());
  }

  @Test
  void candidateStillFailingAnOptionalCheckIsNotRepaired() {
    List<ArtifactCheck> checks = new ArrayList<>(ValidationOracle.builtInChecks());
    checks.add(new RejectingCheck());
    ValidationOracle strict = new ValidationOracle(checks);
    RepairEngine strictEngine = new RepairEngine(strict, classifier, NOTHING_DECODES, RepairSettings.defaults());
    ImageArtifact artifact = artifact("a.jpg", ImageFixtures.jpegWithoutFooter());
    CorruptionRecord record = classifier.classify(artifact, strict.validate(artifact));

    RepairOutcome outcome = strictEngine.repair(artifact, record);

    assertEquals(CorruptionType.MISSING_FOOTER, record.corruptionType());
    assertEquals(RepairStatus.FAILED, outcome.status());
    assertTrue(outcome.artifact().isEmpty());
    assertTrue(outcome.finalRecord().isEmpty());
    assertFalse(outcome.attempts().get(0).success());
    assertTrue(outcome.note().contains("re-classified"), outcome.note());
  }

  @Test
  void outputIdsCountLaterCandidates() {
    assertEquals("x#segment_stripping", RepairEngine.outputId("x", RepairTechnique.SEGMENT_STRIPPING, 1));
    assertEquals("x#footer_append-2", RepairEngine.outputId("x", RepairTechnique.FOOTER_APPEND, 2));
  }

  private CorruptionRecord classify(ImageArtifact artifact) {
    return classifier.classify(artifact, oracle.validate(artifact));
  }

  private static ImageArtifact artifact(String id, byte[] data) {
    return ImageArtifact.of(id, data, "/evidence/" + id, "carving");
  }

  /** Optional decode stand-in that rejects everything. */
  private static final class RejectingCheck implements ArtifactCheck {
    @Override
    public String name() {
      return "decode";
    }

    @Override
    public boolean required() {
      return false;
    }

    @Override
    public CheckCost cost() {
      return CheckCost.DECODE;
    }

    @Override
    public ValidationVerdict check(ImageArtifact artifact) {
      return ValidationVerdict.fail(name(), "decoder warning: Premature end of JPEG file");
    }
  }
}
