package ca.gc.cra.salvage.domain.decision;

import ca.gc.cra.salvage.domain.classify.CorruptionRecord;
import ca.gc.cra.salvage.domain.classify.CorruptionType;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Classification counts for one batch and the type distribution of its corrupted artifacts.
 *
 * @param valid valid artifacts
 * @param corrupted corrupted artifacts
 * @param unrecoverable unrecoverable artifacts
 * @param corruptedByType corrupted artifacts per corruption type; sums to {@code corrupted}
 * @since 0.1.0
 */
public record BatchStatistics(
    int valid, int corrupted, int unrecoverable, Map<CorruptionType, Integer> corruptedByType) {

  public BatchStatistics {
    if (valid < 0 || corrupted < 0 || unrecoverable < 0) {
      throw new IllegalArgumentException("counts must be non-negative");
    }
    Objects.requireNonNull(corruptedByType, "corruptedByType");
    EnumMap<CorruptionType, Integer> copy = new EnumMap<>(CorruptionType.class);
    int sum = 0;
    for (Map.Entry<CorruptionType, Integer> entry : corruptedByType.entrySet()) {
      int count = Objects.requireNonNull(entry.getValue(), "count");
      if (count < 0) {
        throw new IllegalArgumentException("type counts must be non-negative");
      }
      if (count > 0) {
        copy.put(Objects.requireNonNull(entry.getKey(), "type"), count);
        sum += count;
      }
    }
    if (sum != corrupted) {
      throw new IllegalArgumentException(
          "corrupted type counts sum to " + sum + " but corrupted is " + corrupted);
    }
    corruptedByType = Collections.unmodifiableMap(copy);
  }

  /**
   * Aggregates classification records.
   *
   * @param records one record per artifact
   * @return statistics
   */
  public static BatchStatistics from(Collection<CorruptionRecord> records) {
    Objects.requireNonNull(records, "records");
    int valid = 0;
    int corrupted = 0;
    int unrecoverable = 0;
    EnumMap<CorruptionType, Integer> byType = new EnumMap<>(CorruptionType.class);
    for (CorruptionRecord record : records) {
      switch (record.classification()) {
        case VALID -> valid++;
        case CORRUPTED -> {
          corrupted++;
          byType.merge(record.corruptionType(), 1, Integer::sum);
        }
        case UNRECOVERABLE -> unrecoverable++;
      }
    }
    return new BatchStatistics(valid, corrupted, unrecoverable, byType);
  }

  public int total() {
    return valid + corrupted + unrecoverable;
  }

  /**
   * Corrupted artifacts whose tier puts them in the repair pool.
   *
   * @return repairable count
   */
  public int repairableCount() {
    int count = 0;
    for (Map.Entry<CorruptionType, Integer> entry : corruptedByType.entrySet()) {
      if (entry.getKey().isRepairable()) {
        count += entry.getValue();
      }
    }
    return count;
  }

  /**
   * Share of valid artifacts, in percent, rounded to two decimals.
   *
   * @return integrity score; {@code 0.0} for an empty batch
   */
  public double integrityScore() {
    return Percentages.round2(valid * 100.0 / Math.max(total(), 1));
  }
}
