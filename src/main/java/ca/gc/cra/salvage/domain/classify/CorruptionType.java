package ca.gc.cra.salvage.domain.classify;

import java.util.Locale;
import java.util.Optional;

/**
 * Corruption taxonomy with its fixed repairability tier.
 *
 * <p>Tier 1 is the most tractable, 5 is not repairable; {@link #NONE} (valid artifacts) carries tier 0. Tiers 1 to 3
 * have a mapped technique and form the repair pool.</p>
 *
 * @since 0.1.0
 */
public enum CorruptionType {
  NONE(0),
  MISSING_FOOTER(1),
  TRUNCATED(1),
  INVALID_HEADER(2),
  CORRUPT_SEGMENTS(2),
  CORRUPT_DATA(3),
  FRAGMENTED(4),
  FALSE_POSITIVE(5);

  /** Highest tier whose artifacts enter the repair pool. */
  public static final int MAX_REPAIRABLE_TIER = 3;

  private final int tier;

  CorruptionType(int tier) {
    this.tier = tier;
  }

  public int tier() {
    return tier;
  }

  /**
   * Whether artifacts of this type enter the repair pool.
   *
   * @return {@code true} for tiers 1 to 3
   */
  public boolean isRepairable() {
    return tier >= 1 && tier <= MAX_REPAIRABLE_TIER;
  }

  /**
   * Technique dispatched for this type.
   *
   * @return technique, or empty when no technique applies
   */
  public Optional<RepairTechnique> technique() {
    return switch (this) {
      case MISSING_FOOTER -> Optional.of(RepairTechnique.FOOTER_APPEND);
      case INVALID_HEADER -> Optional.of(RepairTechnique.HEADER_RECONSTRUCTION);
      case CORRUPT_SEGMENTS -> Optional.of(RepairTechnique.SEGMENT_STRIPPING);
      case CORRUPT_DATA, TRUNCATED -> Optional.of(RepairTechnique.PARTIAL_DECODE_REENCODE);
      case NONE, FRAGMENTED, FALSE_POSITIVE -> Optional.empty();
    };
  }

  public String reportName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static CorruptionType fromReportName(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("corruption type must not be blank");
    }
    return valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}
