package ca.gc.cra.salvage.domain.validation;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs the registered {@link ArtifactCheck}s over an artifact and collects verdicts.
 * <p><strong>Why:</strong> Classification and repair verification both need the same independent opinions, in the
 * same order, with unavailable checks degrading confidence instead of blocking.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Order checks by {@link CheckCost}, keeping registration order within a class.</li>
 *   <li>Stop after a failed check that is terminal on failure.</li>
 *   <li>Record checks that threw {@link CheckUnavailableException} as unavailable.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe to share across worker threads provided
 * the checks are.</p>
 *
 * @since 0.1.0
 */
public final class ValidationOracle {
  private static final Logger log = LoggerFactory.getLogger(ValidationOracle.class);

  private final List<ArtifactCheck> checks;
  private final Set<String> requiredChecks;

  /**
   * Creates an oracle over a fixed set of checks.
   *
   * @param checks checks to run; names must be unique
   */
  public ValidationOracle(List<? extends ArtifactCheck> checks) {
    Objects.requireNonNull(checks, "checks");
    List<ArtifactCheck> ordered = new ArrayList<>(checks);
    ordered.sort(Comparator.comparing(ArtifactCheck::cost));
    Set<String> names = new LinkedHashSet<>();
    Set<String> required = new LinkedHashSet<>();
    for (ArtifactCheck check : ordered) {
      if (!names.add(check.name())) {
        throw new IllegalArgumentException("duplicate check name: " + check.name());
      }
      if (check.required()) {
        required.add(check.name());
      }
    }
    this.checks = List.copyOf(ordered);
    this.requiredChecks = Set.copyOf(required);
  }

  /**
   * Oracle with only the always-available byte checks (size, magic, structure).
   *
   * @return oracle without optional checks
   */
  public static ValidationOracle builtIn() {
    return new ValidationOracle(builtInChecks());
  }

  /**
   * The required checks every oracle starts from.
   *
   * @return size, magic and structure checks
   */
  public static List<ArtifactCheck> builtInChecks() {
    return List.of(new SizeCheck(), new MagicByteCheck(), new StructureCheck());
  }

  /**
   * Runs every applicable check over {@code artifact}.
   *
   * @param artifact artifact to validate; never modified
   * @return collected verdicts
   */
  public ValidationReport validate(ImageArtifact artifact) {
    Objects.requireNonNull(artifact, "artifact");
    List<ValidationVerdict> verdicts = new ArrayList<>(checks.size());
    List<String> unavailable = new ArrayList<>();
    for (ArtifactCheck check : checks) {
      if (!check.appliesTo(artifact.format())) {
        continue;
      }
      ValidationVerdict verdict;
      try {
        verdict = check.check(artifact);
      } catch (CheckUnavailableException ex) {
        log.debug("Check {} unavailable for {}: {}", check.name(), artifact.id(), ex.getMessage());
        unavailable.add(check.name());
        continue;
      } catch (RuntimeException ex) {
        log.warn("Check {} failed unexpectedly for {}; treating as unavailable", check.name(), artifact.id(), ex);
        unavailable.add(check.name());
        continue;
      }
      verdicts.add(verdict);
      if (!verdict.passed() && check.terminalOnFailure()) {
        log.debug("Check {} failed for {}; skipping remaining checks", check.name(), artifact.id());
        break;
      }
    }
    return new ValidationReport(artifact.id(), verdicts, unavailable, requiredChecks);
  }

  /**
   * Names of the registered checks, in execution order.
   *
   * @return check names
   */
  public List<String> checkNames() {
    return checks.stream().map(ArtifactCheck::name).toList();
  }

  public Set<String> requiredChecks() {
    return requiredChecks;
  }
}
