package ca.gc.cra.salvage.domain.repair;

import ca.gc.cra.salvage.domain.classify.CorruptionType;

/**
 * Raised when a corruption type has no repair technique.
 *
 * @since 0.1.0
 */
public final class TechniqueNotApplicableException extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient CorruptionType corruptionType;

  public TechniqueNotApplicableException(CorruptionType corruptionType) {
    super("no repair technique for corruption type " + corruptionType.reportName());
    this.corruptionType = corruptionType;
  }

  public CorruptionType corruptionType() {
    return corruptionType;
  }
}
