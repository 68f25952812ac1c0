package ca.gc.cra.salvage.domain.validation;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;

/**
 * Fails empty artifacts. Terminal on failure: a zero-byte file is unrecoverable without further checks.
 *
 * @since 0.1.0
 */
public final class SizeCheck implements ArtifactCheck {
  public static final String NAME = "size";

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
  public boolean terminalOnFailure() {
    return true;
  }

  @Override
  public ValidationVerdict check(ImageArtifact artifact) {
    if (artifact.size() == 0) {
      return ValidationVerdict.fail(NAME, "artifact is empty (0 bytes)");
    }
    return ValidationVerdict.pass(NAME);
  }
}
