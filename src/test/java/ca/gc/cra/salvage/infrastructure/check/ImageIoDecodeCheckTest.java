package ca.gc.cra.salvage.infrastructure.check;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import ca.gc.cra.salvage.domain.validation.CheckCost;
import ca.gc.cra.salvage.domain.validation.CheckUnavailableException;
import ca.gc.cra.salvage.domain.validation.ValidationVerdict;
import ca.gc.cra.salvage.fixtures.ImageFixtures;
import java.io.EOFException;
import java.io.IOException;
import java.util.Arrays;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class ImageIoDecodeCheckTest {
  private final ImageIoDecodeCheck check = new ImageIoDecodeCheck();

  @Test
  void describesItselfAsOptionalDecodeCheck() {
    assertEquals("decode", check.name());
    assertFalse(check.required());
    assertEquals(CheckCost.DECODE, check.cost());
    assertTrue(check.appliesTo(ImageFormat.PNG));
    assertFalse(check.appliesTo(ImageFormat.UNKNOWN));
  }

  @Test
  void intactImagesDecode() throws CheckUnavailableException {
    assertTrue(check.check(ImageArtifact.of("a.jpg", ImageFixtures.jpeg(), "a.jpg", "m")).passed());
    assertTrue(check.check(ImageArtifact.of("b.png", ImageFixtures.png(), "b.png", "m")).passed());
  }

  @Test
  void pngCutMidStreamFails() throws CheckUnavailableException {
    byte[] png = ImageFixtures.png();
    byte[] cut = Arrays.copyOf(png, png.length / 2);

    ValidationVerdict verdict = check.check(ImageArtifact.of("b.png", cut, "b.png", "m"));

    assertFalse(verdict.passed());
    assertTrue(verdict.diagnostic().isPresent());
  }

  @Test
  void jpegCutInsideScanReportsDataEndingEarly() throws CheckUnavailableException {
    ValidationVerdict verdict = check.check(
        ImageArtifact.of("c.jpg", ImageFixtures.jpegCutInScan(256, 256), "c.jpg", "m"));

    assertFalse(verdict.passed());
    String diagnostic = verdict.diagnostic().orElse("").toLowerCase(Locale.ROOT);
    assertTrue(diagnostic.contains("premature end of data segment"), diagnostic);
  }

  @Test
  void wrappedFailureKeepsItsCause() {
    IOException wrapped = new IOException("Error reading PNG image data",
        new EOFException("Unexpected end of ZLIB input stream"));

    assertEquals("Error reading PNG image data (java.io.EOFException: Unexpected end of ZLIB input stream)",
        ImageIoDecodeCheck.withCause(wrapped));
    assertEquals("plain", ImageIoDecodeCheck.withCause(new IOException("plain")));
  }

  @Test
  void jpegWithoutScanFails() throws CheckUnavailableException {
    ValidationVerdict verdict = check.check(
        ImageArtifact.of("t.jpg", ImageFixtures.jpegTruncatedInHeader(), "t.jpg", "m"));

    assertFalse(verdict.passed());
  }
}
