package ca.gc.cra.salvage.domain.classify;

/**
 * Tunables for the {@link CorruptionClassifier}.
 *
 * @param footerToleranceBytes largest number of bytes a unit may be missing at the end of the stream for the break
 *     to still count as a missing footer rather than truncation
 * @since 0.1.0
 */
public record ClassifierSettings(int footerToleranceBytes) {
  /** Default tolerance: a lost PNG CRC field or a cut JPEG marker header. */
  public static final int DEFAULT_FOOTER_TOLERANCE = 4;

  public ClassifierSettings {
    if (footerToleranceBytes < 0) {
      throw new IllegalArgumentException("footerToleranceBytes must be non-negative");
    }
  }

  public static ClassifierSettings defaults() {
    return new ClassifierSettings(DEFAULT_FOOTER_TOLERANCE);
  }
}
