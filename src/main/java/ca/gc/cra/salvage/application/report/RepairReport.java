package ca.gc.cra.salvage.application.report;

import ca.gc.cra.salvage.domain.decision.BatchStatistics;
import ca.gc.cra.salvage.domain.decision.Percentages;
import ca.gc.cra.salvage.domain.decision.Strategy;
import ca.gc.cra.salvage.domain.repair.RepairStatus;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Batch repair result, the content of {@code repair_report.json}.
 * <p>Every non-valid artifact from the validation report appears exactly once, either in {@link #entries()} or in
 * {@link #notAttempted()}.</p>
 *
 * @param generatedAtMillis when the report was produced
 * @param effectiveStrategy strategy the repair stage ran under
 * @param entries attempted repairs, sorted by id
 * @param notAttempted artifacts left alone, sorted by id
 * @param finalStatistics classification counts after repair
 * @since 0.1.0
 */
public record RepairReport(
    long generatedAtMillis,
    Strategy effectiveStrategy,
    List<RepairEntry> entries,
    List<NotAttemptedEntry> notAttempted,
    BatchStatistics finalStatistics) {

  public RepairReport {
    Objects.requireNonNull(effectiveStrategy, "effectiveStrategy");
    Objects.requireNonNull(finalStatistics, "finalStatistics");
    List<RepairEntry> sortedEntries = new ArrayList<>(Objects.requireNonNull(entries, "entries"));
    sortedEntries.sort(Comparator.comparing(RepairEntry::id));
    List<NotAttemptedEntry> sortedSkipped = new ArrayList<>(Objects.requireNonNull(notAttempted, "notAttempted"));
    sortedSkipped.sort(Comparator.comparing(NotAttemptedEntry::id));
    entries = List.copyOf(sortedEntries);
    notAttempted = List.copyOf(sortedSkipped);
  }

  public int attempted() {
    return entries.size();
  }

  public int successful() {
    return (int) entries.stream().filter(entry -> entry.outcome().status() == RepairStatus.REPAIRED).count();
  }

  public int failed() {
    return attempted() - successful();
  }

  /**
   * Success rate per original corruption type over attempted repairs.
   *
   * @return percent keyed by corruption type report name
   */
  public SortedMap<String, Double> successRateByType() {
    SortedMap<String, int[]> tallies = new TreeMap<>();
    for (RepairEntry entry : entries) {
      int[] tally = tallies.computeIfAbsent(
          entry.outcome().originalRecord().corruptionType().reportName(), key -> new int[2]);
      tally[0]++;
      if (entry.outcome().repaired()) {
        tally[1]++;
      }
    }
    SortedMap<String, Double> rates = new TreeMap<>();
    tallies.forEach((type, tally) -> rates.put(type, Percentages.round2(tally[1] * 100.0 / tally[0])));
    return Collections.unmodifiableSortedMap(rates);
  }
}
