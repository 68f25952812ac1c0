package ca.gc.cra.salvage.domain.validation;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import java.util.HexFormat;

/**
 * Checks that the format signature sits at offset zero.
 *
 * @since 0.1.0
 */
public final class MagicByteCheck implements ArtifactCheck {
  public static final String NAME = "magic";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean required() {
    return true;
  }

  @Override
  public CheckCost cost() {
    return CheckCost.TRIVIAL;
  }

  @Override
  public ValidationVerdict check(ImageArtifact artifact) {
    ImageFormat format = artifact.format();
    if (format == ImageFormat.UNKNOWN) {
      return ValidationVerdict.fail(NAME, "no supported format signature");
    }
    if (format.matchesSignature(artifact.content())) {
      return ValidationVerdict.pass(NAME);
    }
    byte[] content = artifact.content();
    int shown = Math.min(content.length, format.signature().length);
    return ValidationVerdict.fail(NAME, "expected " + HexFormat.of().formatHex(format.signature())
        + " at offset 0, found " + HexFormat.of().formatHex(content, 0, shown));
  }
}
