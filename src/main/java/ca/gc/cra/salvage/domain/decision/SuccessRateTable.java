package ca.gc.cra.salvage.domain.decision;

import ca.gc.cra.salvage.domain.classify.CorruptionType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable empirical repair success rate (percent) per corruption type.
 *
 * <p>Types without an entry use {@link #UNKNOWN_RATE}.</p>
 *
 * @since 0.1.0
 */
public final class SuccessRateTable {
  /** Rate assumed for a type with no entry. */
  public static final double UNKNOWN_RATE = 50.0;

  private final Map<CorruptionType, Double> rates;

  private SuccessRateTable(Map<CorruptionType, Double> rates) {
    this.rates = Collections.unmodifiableMap(rates);
  }

  /**
   * Builds a table from explicit rates.
   *
   * @param rates percent per type, each within [0, 100]
   * @return table
   */
  public static SuccessRateTable of(Map<CorruptionType, Double> rates) {
    Objects.requireNonNull(rates, "rates");
    EnumMap<CorruptionType, Double> copy = new EnumMap<>(CorruptionType.class);
    rates.forEach((type, rate) -> {
      Objects.requireNonNull(type, "type");
      if (rate == null || rate.isNaN() || rate < 0.0 || rate > 100.0) {
        throw new IllegalArgumentException("success rate for " + type.reportName() + " must be within [0, 100]");
      }
      copy.put(type, rate);
    });
    return new SuccessRateTable(copy);
  }

  /**
   * Empirical rates used when no table is configured.
   *
   * @return default table
   */
  public static SuccessRateTable defaults() {
    EnumMap<CorruptionType, Double> rates = new EnumMap<>(CorruptionType.class);
    rates.put(CorruptionType.MISSING_FOOTER, 85.0);
    rates.put(CorruptionType.TRUNCATED, 85.0);
    rates.put(CorruptionType.INVALID_HEADER, 70.0);
    rates.put(CorruptionType.CORRUPT_SEGMENTS, 60.0);
    rates.put(CorruptionType.CORRUPT_DATA, 40.0);
    rates.put(CorruptionType.FRAGMENTED, 15.0);
    rates.put(CorruptionType.FALSE_POSITIVE, 0.0);
    return new SuccessRateTable(rates);
  }

  /**
   * Copy with one rate replaced.
   *
   * @param type corruption type
   * @param rate percent within [0, 100]
   * @return new table
   */
  public SuccessRateTable with(CorruptionType type, double rate) {
    EnumMap<CorruptionType, Double> copy = new EnumMap<>(CorruptionType.class);
    copy.putAll(rates);
    copy.put(type, rate);
    return of(copy);
  }

  public double rateFor(CorruptionType type) {
    return rates.getOrDefault(type, UNKNOWN_RATE);
  }

  public Map<CorruptionType, Double> asMap() {
    return rates;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SuccessRateTable other && rates.equals(other.rates);
  }

  @Override
  public int hashCode() {
    return rates.hashCode();
  }

  @Override
  public String toString() {
    return "SuccessRateTable" + rates;
  }
}
