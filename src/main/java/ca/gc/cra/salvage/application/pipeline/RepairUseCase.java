package ca.gc.cra.salvage.application.pipeline;

import ca.gc.cra.salvage.application.port.ArtifactSourcePort;
import ca.gc.cra.salvage.application.port.ArtifactStorePort;
import ca.gc.cra.salvage.application.port.ClockPort;
import ca.gc.cra.salvage.application.port.MetricsPort;
import ca.gc.cra.salvage.application.port.ReportWriterPort;
import ca.gc.cra.salvage.application.report.ArtifactEntry;
import ca.gc.cra.salvage.application.report.ClassificationReport;
import ca.gc.cra.salvage.application.report.NotAttemptedEntry;
import ca.gc.cra.salvage.application.report.RepairEntry;
import ca.gc.cra.salvage.application.report.RepairReport;
import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import ca.gc.cra.salvage.domain.classify.CorruptionRecord;
import ca.gc.cra.salvage.domain.classify.CorruptionType;
import ca.gc.cra.salvage.domain.classify.RepairTechnique;
import ca.gc.cra.salvage.domain.decision.BatchDecision;
import ca.gc.cra.salvage.domain.decision.BatchStatistics;
import ca.gc.cra.salvage.domain.decision.Strategy;
import ca.gc.cra.salvage.domain.repair.RepairEngine;
import ca.gc.cra.salvage.domain.repair.RepairOutcome;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Repairs the corrupted artifacts of a classified batch and writes the repair report.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Honour the effective strategy of the {@link BatchDecision}.</li>
 *   <li>Account for every non-valid artifact, either as an attempt or as not attempted with a reason.</li>
 *   <li>Re-read each original, refuse it if it changed since classification, and store verified repairs through
 *       the {@link ArtifactStorePort}. Originals are only ever read.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One run at a time; per-artifact work runs on {@code workers}.</p>
 *
 * @since 0.1.0
 */
public final class RepairUseCase {
  private static final Logger log = LoggerFactory.getLogger(RepairUseCase.class);

  private final ArtifactSourcePort source;
  private final RepairEngine engine;
  private final ArtifactStorePort store;
  private final ReportWriterPort reports;
  private final ExecutorService workers;
  private final MetricsPort metrics;
  private final ClockPort clock;

  public RepairUseCase(
      ArtifactSourcePort source,
      RepairEngine engine,
      ArtifactStorePort store,
      ReportWriterPort reports,
      ExecutorService workers,
      MetricsPort metrics,
      ClockPort clock) {
    this.source = Objects.requireNonNull(source, "source");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.store = Objects.requireNonNull(store, "store");
    this.reports = Objects.requireNonNull(reports, "reports");
    this.workers = Objects.requireNonNull(workers, "workers");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Repairs the batch according to the decision and writes the repair report.
   *
   * @param classification validation report for the batch
   * @param decision batch decision; its effective strategy governs whether anything is attempted
   * @return repair report
   * @throws PipelineException if a repaired artifact or the report cannot be written
   * @throws InterruptedException if the run is cancelled
   */
  public RepairReport run(ClassificationReport classification, BatchDecision decision)
      throws PipelineException, InterruptedException {
    Objects.requireNonNull(classification, "classification");
    Objects.requireNonNull(decision, "decision");
    Strategy strategy = decision.effectiveStrategy();

    List<NotAttemptedEntry> notAttempted = new ArrayList<>();
    List<ArtifactEntry> candidates = new ArrayList<>();
    for (ArtifactEntry entry : classification.artifacts()) {
      CorruptionRecord record = entry.record();
      CorruptionType type = record.corruptionType();
      if (record.isValid()) {
        continue;
      }
      if (record.isUnrecoverable()) {
        notAttempted.add(new NotAttemptedEntry(entry.id(), type.reportName(), "unrecoverable"));
      } else if (strategy == Strategy.SKIP_REPAIR) {
        notAttempted.add(new NotAttemptedEntry(entry.id(), type.reportName(), "batch strategy is skip_repair"));
      } else if (type.technique().isEmpty()) {
        notAttempted.add(new NotAttemptedEntry(
            entry.id(), type.reportName(), "no repair technique for " + type.reportName()));
      } else {
        candidates.add(entry);
      }
    }
    log.info("Repair stage under {}: {} candidates, {} not attempted", strategy.reportName(), candidates.size(),
        notAttempted.size());

    Map<String, String> fileNames = outputFileNames(candidates);
    List<Repaired> results = ParallelStage.map(
        workers, candidates, ArtifactEntry::id, entry -> repair(entry, fileNames.get(entry.id())));
    List<RepairEntry> entries = new ArrayList<>(results.size());
    Map<String, CorruptionRecord> finalRecords = new HashMap<>();
    for (Repaired result : results) {
      if (result.entry == null) {
        notAttempted.add(result.notAttempted);
        continue;
      }
      entries.add(result.entry);
      RepairOutcome outcome = result.entry.outcome();
      if (outcome.repaired()) {
        outcome.finalRecord().ifPresent(record -> finalRecords.put(outcome.artifactId(), record));
      }
    }

    List<CorruptionRecord> afterRepair = new ArrayList<>(classification.artifacts().size());
    for (ArtifactEntry entry : classification.artifacts()) {
      afterRepair.add(finalRecords.getOrDefault(entry.id(), entry.record()));
    }
    RepairReport report = new RepairReport(
        clock.nowMillis(), strategy, entries, notAttempted, BatchStatistics.from(afterRepair));
    try {
      Path written = reports.writeRepair(report);
      log.info("Repair report written to {}: {} attempted, {} successful, {} failed", written,
          report.attempted(), report.successful(), report.failed());
    } catch (IOException ex) {
      throw new PipelineException("Unable to write repair report: " + ex.getMessage(), ex);
    }
    return report;
  }

  private Repaired repair(ArtifactEntry entry, String fileName) throws PipelineException {
    String type = entry.record().corruptionType().reportName();
    ImageArtifact artifact;
    try {
      artifact = source.read(entry.toRef());
    } catch (IOException ex) {
      log.warn("Not repairing unreadable artifact {}: {}", entry.id(), ex.getMessage());
      return new Repaired(null, new NotAttemptedEntry(entry.id(), type, "unreadable: " + ex.getMessage()));
    }
    if (artifact.size() != entry.size()) {
      log.warn("Not repairing {}: size changed from {} to {} since classification", entry.id(), entry.size(),
          artifact.size());
      return new Repaired(null, new NotAttemptedEntry(entry.id(), type,
          "source changed since classification: " + artifact.size() + " bytes, expected " + entry.size()));
    }
    if (!entry.sha256().isEmpty() && !entry.sha256().equals(artifact.sha256())) {
      log.warn("Not repairing {}: content digest changed since classification", entry.id());
      return new Repaired(null, new NotAttemptedEntry(entry.id(), type,
          "source changed since classification: sha256 " + artifact.sha256() + ", expected " + entry.sha256()));
    }

    RepairOutcome outcome = engine.repair(artifact, entry.record());
    Optional<String> outputPath = Optional.empty();
    if (outcome.repaired() && outcome.artifact().isPresent()) {
      try {
        Path stored = store.store(outcome.artifact().get(), fileName);
        outputPath = Optional.of(stored.toString());
      } catch (FileAlreadyExistsException ex) {
        log.warn("Not keeping repair of {}: {} already exists", entry.id(), fileName);
        outcome = outcome.discarded("output " + fileName + " already exists: " + ex.getReason());
      } catch (IOException ex) {
        throw new PipelineException("Unable to store repaired artifact " + fileName + ": " + ex.getMessage(), ex);
      }
    }
    if (outcome.repaired()) {
      metrics.increment("repair.success");
      log.info("Repaired {} ({}) with {} as {}", entry.id(), type,
          outcome.technique().map(RepairTechnique::reportName).orElse("?"), fileName);
    } else {
      metrics.increment("repair.failed");
      log.info("Repair of {} ({}) failed: {}", entry.id(), type, outcome.note());
    }
    return new Repaired(new RepairEntry(outcome, outputPath), null);
  }

  /**
   * Output file names for the candidates, unique within the batch. Names that would clash, even only by case,
   * get a counter in classification order.
   */
  static Map<String, String> outputFileNames(List<ArtifactEntry> candidates) {
    Map<String, String> names = new HashMap<>();
    Set<String> taken = new HashSet<>();
    for (ArtifactEntry entry : candidates) {
      RepairTechnique technique = entry.record().corruptionType().technique()
          .orElseThrow(() -> new IllegalArgumentException("no repair technique for " + entry.id()));
      String name = outputFileName(entry.id(), technique, entry.format());
      String unique = name;
      for (int n = 2; !taken.add(unique.toLowerCase(Locale.ROOT)); n++) {
        int dot = name.lastIndexOf('.');
        unique = name.substring(0, dot) + "-" + n + name.substring(dot);
      }
      names.put(entry.id(), unique);
    }
    return names;
  }

  /**
   * File name for a repaired artifact: the artifact id made filesystem-safe, the technique and the format's
   * extension, e.g. {@code carved_f0001.jpg.footer_append.jpg}. The id keeps its own extension so
   * {@code x.jpg} and {@code x.jpeg} stay apart.
   */
  static String outputFileName(String artifactId, RepairTechnique technique, ImageFormat format) {
    String safe = artifactId.replaceAll("[^A-Za-z0-9._-]", "_");
    return safe + "." + technique.reportName() + "." + format.extension();
  }

  private static final class Repaired {
    private final RepairEntry entry;
    private final NotAttemptedEntry notAttempted;

    private Repaired(RepairEntry entry, NotAttemptedEntry notAttempted) {
      this.entry = entry;
      this.notAttempted = notAttempted;
    }
  }
}
