package ca.gc.cra.salvage.domain.repair;

import java.util.Locale;

/** Per-artifact result of {@link RepairEngine#repair}. */
public enum RepairStatus {
  /** A technique produced output that passes every required check. */
  REPAIRED,
  /** Every attempt failed; the original stays as it was. */
  FAILED,
  /** The corruption type has no technique; nothing was attempted. */
  NOT_ATTEMPTED,
  /** The artifact was already valid. */
  UNCHANGED;

  public String reportName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
