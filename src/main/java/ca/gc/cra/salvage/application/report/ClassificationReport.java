package ca.gc.cra.salvage.application.report;

import ca.gc.cra.salvage.domain.classify.CorruptionRecord;
import ca.gc.cra.salvage.domain.classify.CorruptionType;
import ca.gc.cra.salvage.domain.decision.BatchStatistics;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * <strong>What:</strong> Batch classification result, the content of {@code validation_report.json}.
 * <p>Entries are kept sorted by id so repeated runs over the same input produce identical documents. Summary
 * values are derived from the entries and never stored separately.</p>
 *
 * @param generatedAtMillis when the report was produced
 * @param artifacts classified artifacts
 * @param skipped inputs that could not be classified
 * @since 0.1.0
 */
public record ClassificationReport(long generatedAtMillis, List<ArtifactEntry> artifacts, List<SkippedEntry> skipped) {

  public ClassificationReport {
    List<ArtifactEntry> sortedArtifacts = new ArrayList<>(Objects.requireNonNull(artifacts, "artifacts"));
    sortedArtifacts.sort(Comparator.comparing(ArtifactEntry::id));
    for (int i = 1; i < sortedArtifacts.size(); i++) {
      if (sortedArtifacts.get(i).id().equals(sortedArtifacts.get(i - 1).id())) {
        throw new IllegalArgumentException("duplicate artifact id: " + sortedArtifacts.get(i).id());
      }
    }
    List<SkippedEntry> sortedSkipped = new ArrayList<>(Objects.requireNonNull(skipped, "skipped"));
    sortedSkipped.sort(Comparator.comparing(SkippedEntry::id));
    artifacts = List.copyOf(sortedArtifacts);
    skipped = List.copyOf(sortedSkipped);
  }

  public List<CorruptionRecord> records() {
    return artifacts.stream().map(ArtifactEntry::record).toList();
  }

  public BatchStatistics statistics() {
    return BatchStatistics.from(records());
  }

  public Optional<ArtifactEntry> find(String id) {
    return artifacts.stream().filter(entry -> entry.id().equals(id)).findFirst();
  }

  /**
   * Counts per corruption type over corrupted and unrecoverable artifacts.
   *
   * @return counts keyed by report name
   */
  public SortedMap<String, Integer> corruptionTypes() {
    SortedMap<String, Integer> counts = new TreeMap<>();
    for (ArtifactEntry entry : artifacts) {
      CorruptionType type = entry.record().corruptionType();
      if (type != CorruptionType.NONE) {
        counts.merge(type.reportName(), 1, Integer::sum);
      }
    }
    return Collections.unmodifiableSortedMap(counts);
  }

  public SortedMap<String, Breakdown> byFormat() {
    return breakdown(entry -> entry.format().reportName());
  }

  public SortedMap<String, Breakdown> bySource() {
    return breakdown(ArtifactEntry::recoveryMethod);
  }

  private SortedMap<String, Breakdown> breakdown(Function<ArtifactEntry, String> key) {
    SortedMap<String, Breakdown> groups = new TreeMap<>();
    for (ArtifactEntry entry : artifacts) {
      groups.merge(key.apply(entry), single(entry.record()), Breakdown::plus);
    }
    return Collections.unmodifiableSortedMap(groups);
  }

  private static Breakdown single(CorruptionRecord record) {
    return switch (record.classification()) {
      case VALID -> new Breakdown(1, 1, 0, 0);
      case CORRUPTED -> new Breakdown(1, 0, 1, 0);
      case UNRECOVERABLE -> new Breakdown(1, 0, 0, 1);
    };
  }
}
