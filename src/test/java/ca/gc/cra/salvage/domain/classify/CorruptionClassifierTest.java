package ca.gc.cra.salvage.domain.classify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import ca.gc.cra.salvage.domain.container.ContainerStructure;
import ca.gc.cra.salvage.domain.container.EndState;
import ca.gc.cra.salvage.domain.container.Segment;
import ca.gc.cra.salvage.domain.validation.ArtifactCheck;
import ca.gc.cra.salvage.domain.validation.CheckCost;
import ca.gc.cra.salvage.domain.validation.CheckUnavailableException;
import ca.gc.cra.salvage.domain.validation.ValidationOracle;
import ca.gc.cra.salvage.domain.validation.ValidationVerdict;
import ca.gc.cra.salvage.fixtures.ImageFixtures;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CorruptionClassifierTest {
  private final ValidationOracle oracle = ValidationOracle.builtIn();
  private final CorruptionClassifier classifier = new CorruptionClassifier(ClassifierSettings.defaults());

  @Test
  void intactImagesAreValid() {
    CorruptionRecord jpeg = classify(oracle, "a.jpg", ImageFixtures.jpeg());
    CorruptionRecord png = classify(oracle, "b.png", ImageFixtures.png());

    for (CorruptionRecord record : List.of(jpeg, png)) {
      assertEquals(Classification.VALID, record.classification());
      assertEquals(CorruptionType.NONE, record.corruptionType());
      assertEquals(0, record.repairabilityTier());
      assertEquals(Optional.empty(), record.recommendedTechnique());
      assertEquals(Confidence.HIGH, record.confidence());
    }
  }

  @Test
  void missingFooterOnBothFormats() {
    CorruptionRecord jpeg = classify(oracle, "a.jpg", ImageFixtures.jpegWithoutFooter());
    CorruptionRecord png = classify(oracle, "b.png", ImageFixtures.pngWithoutFooter());

    for (CorruptionRecord record : List.of(jpeg, png)) {
      assertEquals(Classification.CORRUPTED, record.classification());
      assertEquals(CorruptionType.MISSING_FOOTER, record.corruptionType());
      assertEquals(1, record.repairabilityTier());
      assertEquals(Optional.of(RepairTechnique.FOOTER_APPEND), record.recommendedTechnique());
      assertEquals(List.of("structure"), record.failedChecks());
    }
  }

  @Test
  void leadingGarbageIsInvalidHeader() {
    CorruptionRecord record = classify(
        oracle, "g.jpg", ImageFixtures.withGarbagePrefix(ImageFixtures.jpeg(), 200));

    assertTrue(record.isCorrupted());
    assertEquals(CorruptionType.INVALID_HEADER, record.corruptionType());
    assertEquals(Optional.of(RepairTechnique.HEADER_RECONSTRUCTION), record.recommendedTechnique());
    assertEquals(2, record.repairabilityTier());
  }

  @Test
  void badSegmentLengthIsCorruptSegments() {
    CorruptionRecord record = classify(oracle, "s.jpg", ImageFixtures.jpegWithCorruptSegment());

    assertEquals(CorruptionType.CORRUPT_SEGMENTS, record.corruptionType());
    assertEquals(Optional.of(RepairTechnique.SEGMENT_STRIPPING), record.recommendedTechnique());
  }

  @Test
  void cutInsideHeaderIsTruncated() {
    CorruptionRecord record = classify(oracle, "t.jpg", ImageFixtures.jpegTruncatedInHeader());

    assertEquals(Classification.CORRUPTED, record.classification());
    assertEquals(CorruptionType.TRUNCATED, record.corruptionType());
    assertEquals(Optional.of(RepairTechnique.PARTIAL_DECODE_REENCODE), record.recommendedTechnique());
  }

  @Test
  void secondStartMarkerIsFragmentedWithoutTechnique() {
    CorruptionRecord record = classify(oracle, "f.jpg", ImageFixtures.fragmentedJpeg());

    assertEquals(Classification.CORRUPTED, record.classification());
    assertEquals(CorruptionType.FRAGMENTED, record.corruptionType());
    assertEquals(4, record.repairabilityTier());
    assertEquals(Optional.empty(), record.recommendedTechnique());
  }

  @Test
  void magicWithoutImageIsUnrecoverableFalsePositive() {
    CorruptionRecord record = classify(oracle, "fp.jpg", ImageFixtures.jpegFalsePositive());

    assertEquals(Classification.UNRECOVERABLE, record.classification());
    assertEquals(CorruptionType.FALSE_POSITIVE, record.corruptionType());
    assertEquals(5, record.repairabilityTier());
  }

  @Test
  void noContainerAtAllIsUnrecoverable() {
    CorruptionRecord record = classify(oracle, "noise.jpg", new byte[] {0x01, 0x02, 0x03, 0x04, 0x05});

    assertEquals(Classification.UNRECOVERABLE, record.classification());
    assertEquals(CorruptionType.FALSE_POSITIVE, record.corruptionType());
  }

  @Test
  void emptyArtifactIsUnrecoverable() {
    CorruptionRecord record = classify(oracle, "empty.jpg", new byte[0]);

    assertTrue(record.isUnrecoverable());
    assertEquals(List.of("size"), record.checksRun());
  }

  @Test
  void failingOptionalCheckOnSoundContainerIsCorruptData() {
    List<ArtifactCheck> checks = new ArrayList<>(ValidationOracle.builtInChecks());
    checks.add(new FixedCheck("decode", false));
    ValidationOracle withDecode = new ValidationOracle(checks);

    CorruptionRecord record = classify(withDecode, "d.jpg", ImageFixtures.jpeg());

    assertEquals(CorruptionType.CORRUPT_DATA, record.corruptionType());
    assertEquals(3, record.repairabilityTier());
    assertEquals(List.of("decode"), record.failedChecks());
  }

  @Test
  void missingFooterWithDataEndingEarlyIsTruncated() {
    List<ArtifactCheck> checks = new ArrayList<>(ValidationOracle.builtInChecks());
    checks.add(new FixedCheck("decode", false,
        "decoder warning: Corrupt JPEG data: premature end of data segment; Premature end of JPEG file"));
    ValidationOracle withDecode = new ValidationOracle(checks);

    CorruptionRecord record = classify(withDecode, "t.jpg", ImageFixtures.jpegWithoutFooter());

    assertEquals(CorruptionType.TRUNCATED, record.corruptionType());
    assertEquals(Optional.of(RepairTechnique.PARTIAL_DECODE_REENCODE), record.recommendedTechnique());
    assertEquals(List.of("structure", "decode"), record.failedChecks());
  }

  @Test
  void missingEndOfImageAloneStaysMissingFooter() {
    List<ArtifactCheck> checks = new ArrayList<>(ValidationOracle.builtInChecks());
    checks.add(new FixedCheck("decode", false, "decoder warning: Premature end of JPEG file"));
    ValidationOracle withDecode = new ValidationOracle(checks);

    CorruptionRecord record = classify(withDecode, "m.jpg", ImageFixtures.jpegWithoutFooter());

    assertEquals(CorruptionType.MISSING_FOOTER, record.corruptionType());
    assertEquals(Optional.of(RepairTechnique.FOOTER_APPEND), record.recommendedTechnique());
  }

  @Test
  void pngInflaterEndingEarlyIsTruncated() {
    List<ArtifactCheck> checks = new ArrayList<>(ValidationOracle.builtInChecks());
    checks.add(new FixedCheck("decode", false,
        "decode failed: Error reading PNG image data (java.io.EOFException: Unexpected end of ZLIB input stream)"));
    ValidationOracle withDecode = new ValidationOracle(checks);

    CorruptionRecord record = classify(withDecode, "p.png", ImageFixtures.pngWithoutFooter());

    assertEquals(CorruptionType.TRUNCATED, record.corruptionType());
  }

  @Test
  void confidenceDropsPerUnavailableCheck() {
    List<ArtifactCheck> checks = new ArrayList<>(ValidationOracle.builtInChecks());
    checks.add(new FixedCheck("first", null));
    ValidationOracle oneMissing = new ValidationOracle(checks);
    checks.add(new FixedCheck("second", null));
    checks.add(new FixedCheck("third", null));
    ValidationOracle threeMissing = new ValidationOracle(checks);

    assertEquals(Confidence.MEDIUM, classify(oneMissing, "a.jpg", ImageFixtures.jpeg()).confidence());
    CorruptionRecord floor = classify(threeMissing, "a.jpg", ImageFixtures.jpeg());
    assertEquals(Confidence.LOW, floor.confidence());
    assertEquals(List.of("first", "second", "third"), floor.unavailableChecks());
    assertEquals(Classification.VALID, floor.classification());
  }

  @Test
  void classificationIsDeterministic() {
    ImageArtifact artifact = ImageArtifact.of("a.jpg", ImageFixtures.jpegWithoutFooter(), "a.jpg", "carving");

    CorruptionRecord first = classifier.classify(artifact, oracle.validate(artifact));
    CorruptionRecord second = classifier.classify(artifact, oracle.validate(artifact));

    assertEquals(first, second);
  }

  @Test
  void shortfallWithinToleranceIsMissingFooter() {
    ContainerStructure shortByFour = cutInsideChunk(4);
    ContainerStructure shortBySix = cutInsideChunk(6);

    assertEquals(CorruptionType.MISSING_FOOTER, classifier.deriveType(shortByFour));
    assertEquals(CorruptionType.TRUNCATED, classifier.deriveType(shortBySix));
    assertEquals(CorruptionType.MISSING_FOOTER,
        new CorruptionClassifier(new ClassifierSettings(8)).deriveType(shortBySix));
  }

  private static ContainerStructure cutInsideChunk(int shortfall) {
    List<Segment> segments = List.of(
        new Segment(Segment.SIGNATURE, 0, 8, true, Optional.empty()),
        new Segment("IHDR", 8, 25, true, Optional.empty()),
        new Segment("IDAT", 33, 100, true, Optional.empty()));
    return new ContainerStructure(ImageFormat.PNG, 0, false, segments, 133, EndState.IN_SEGMENT, shortfall,
        false, -1, 133, true, true);
  }

  private CorruptionRecord classify(ValidationOracle using, String id, byte[] data) {
    ImageArtifact artifact = ImageArtifact.of(id, data, id, "carving");
    return classifier.classify(artifact, using.validate(artifact));
  }

  /** Optional check with a fixed verdict; {@code null} means unavailable. */
  private static final class FixedCheck implements ArtifactCheck {
    private final String name;
    private final Boolean passes;
    private final String diagnostic;

    FixedCheck(String name, Boolean passes) {
      this(name, passes, "rejected");
    }

    FixedCheck(String name, Boolean passes, String diagnostic) {
      this.name = name;
      this.passes = passes;
      this.diagnostic = diagnostic;
    }

    @Override
    public String name() {
      return name;
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
    public ValidationVerdict check(ImageArtifact artifact) throws CheckUnavailableException {
      if (passes == null) {
        throw new CheckUnavailableException(name, "not installed");
      }
      return passes ? ValidationVerdict.pass(name) : ValidationVerdict.fail(name, diagnostic);
    }
  }
}
