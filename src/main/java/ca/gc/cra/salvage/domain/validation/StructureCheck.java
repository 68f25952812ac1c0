package ca.gc.cra.salvage.domain.validation;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.container.ContainerParsers;
import ca.gc.cra.salvage.domain.container.ContainerStructure;
import ca.gc.cra.salvage.domain.container.MalformedContainerException;
import ca.gc.cra.salvage.domain.container.Segment;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Container walk verdict: passes when the walk from the start marker reaches the end marker through consistent
 * units with image content and no foreign start marker. A misplaced start marker is the magic check's concern.
 *
 * @since 0.1.0
 */
public final class StructureCheck implements ArtifactCheck {
  public static final String NAME = "structure";

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
    return CheckCost.CHEAP;
  }

  @Override
  public ValidationVerdict check(ImageArtifact artifact) {
    ContainerStructure structure;
    try {
      structure = ContainerParsers.parse(artifact);
    } catch (MalformedContainerException ex) {
      return ValidationVerdict.fail(NAME, ex.getMessage());
    }
    if (structure.isStructurallySound()) {
      return ValidationVerdict.pass(NAME);
    }
    return ValidationVerdict.fail(NAME, describe(structure));
  }

  static String describe(ContainerStructure structure) {
    List<String> problems = new ArrayList<>();
    if (!structure.hasImageContent()) {
      problems.add("no image-defining segments");
    }
    if (!structure.hasEndMarker()) {
      problems.add("no end marker (stopped " + structure.endState().name().toLowerCase(Locale.ROOT)
          + " at offset " + structure.stoppedAtOffset() + ")");
    }
    structure.foreignStart().ifPresent(offset -> problems.add("second start marker at offset " + offset));
    for (Segment segment : structure.inconsistentSegments()) {
      problems.add(segment.kind() + "@" + segment.offset() + ": " + segment.diagnostic().orElse("inconsistent"));
    }
    return String.join("; ", problems);
  }
}
