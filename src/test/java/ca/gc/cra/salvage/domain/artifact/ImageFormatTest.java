package ca.gc.cra.salvage.domain.artifact;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;

import ca.gc.cra.salvage.fixtures.ImageFixtures;
import org.junit.jupiter.api.Test;

class ImageFormatTest {

  @Test
  void signatureWinsOverExtension() {
    assertEquals(ImageFormat.JPEG, ImageFormat.detect(ImageFixtures.jpeg(), "misnamed.png"));
    assertEquals(ImageFormat.PNG, ImageFormat.detect(ImageFixtures.png(), "misnamed.jpg"));
  }

  @Test
  void extensionUsedWhenSignatureMissing() {
    byte[] garbage = ImageFixtures.withGarbagePrefix(ImageFixtures.png(), 10);
    assertEquals(ImageFormat.JPEG, ImageFormat.detect(garbage, "f0001.JPEG"));
  }

  @Test
  void embeddedSignatureUsedWithoutExtension() {
    byte[] garbage = ImageFixtures.withGarbagePrefix(ImageFixtures.png(), 10);
    assertEquals(ImageFormat.PNG, ImageFormat.detect(garbage, "f0001"));
  }

  @Test
  void unknownWithoutAnyEvidence() {
    assertEquals(ImageFormat.UNKNOWN, ImageFormat.detect(new byte[] {1, 2, 3}, null));
    assertEquals(ImageFormat.UNKNOWN, ImageFormat.fromReportName("  "));
    assertEquals(ImageFormat.JPEG, ImageFormat.fromReportName("jpg"));
  }

  @Test
  void artifactCopiesContentAndDerivesWithoutSourcePath() {
    byte[] bytes = ImageFixtures.jpeg();
    ImageArtifact artifact = ImageArtifact.of("a.jpg", bytes, "/evidence/a.jpg", " carving ");
    bytes[0] = 0;

    assertEquals((byte) 0xFF, artifact.content()[0]);
    assertEquals("carving", artifact.recoveryMethod());
    ImageArtifact derived = artifact.derive("a.jpg#footer_append", new byte[] {1});
    assertEquals("", derived.sourcePath());
    assertEquals(ImageFormat.JPEG, derived.format());
    assertArrayEquals(artifact.content(), artifact.copyContent());
    assertNotSame(artifact.content(), artifact.copyContent());
  }

  @Test
  void blankRecoveryMethodBecomesUnknown() {
    ImageArtifact artifact = ImageArtifact.of("a", new byte[0], null, "");
    assertEquals("unknown", artifact.recoveryMethod());
    assertEquals(0, artifact.size());
  }
}
