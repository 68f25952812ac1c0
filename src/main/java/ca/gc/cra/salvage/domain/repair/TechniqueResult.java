package ca.gc.cra.salvage.domain.repair;

import java.util.Objects;
import java.util.Optional;

/**
 * One step of a technique: a candidate byte stream and its immediate self-check, or a failure note.
 *
 * @since 0.1.0
 */
public final class TechniqueResult {
  private final byte[] candidate;
  private final boolean locallyValid;
  private final String note;

  private TechniqueResult(byte[] candidate, boolean locallyValid, String note) {
    this.candidate = candidate;
    this.locallyValid = locallyValid;
    this.note = Objects.requireNonNull(note, "note");
  }

  /**
   * A candidate that passed the technique's structural self-check.
   *
   * @param candidate new bytes; copied
   * @param note what the step did
   * @return result
   */
  public static TechniqueResult produced(byte[] candidate, String note) {
    return new TechniqueResult(Objects.requireNonNull(candidate, "candidate").clone(), true, note);
  }

  /**
   * A step that produced nothing usable.
   *
   * @param note why the step failed
   * @return result
   */
  public static TechniqueResult failed(String note) {
    return new TechniqueResult(null, false, note);
  }

  public Optional<byte[]> candidate() {
    return candidate == null ? Optional.empty() : Optional.of(candidate.clone());
  }

  public boolean locallyValid() {
    return locallyValid;
  }

  public String note() {
    return note;
  }

  @Override
  public String toString() {
    return "TechniqueResult{locallyValid=" + locallyValid + ", note=" + note + '}';
  }
}
