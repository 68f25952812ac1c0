package ca.gc.cra.salvage.application.pipeline;

import ca.gc.cra.salvage.application.port.ArtifactRef;
import ca.gc.cra.salvage.application.port.ArtifactSourcePort;
import ca.gc.cra.salvage.application.port.ClockPort;
import ca.gc.cra.salvage.application.port.MetricsPort;
import ca.gc.cra.salvage.application.port.ReportWriterPort;
import ca.gc.cra.salvage.application.report.ArtifactEntry;
import ca.gc.cra.salvage.application.report.ClassificationReport;
import ca.gc.cra.salvage.application.report.SkippedEntry;
import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.classify.CorruptionClassifier;
import ca.gc.cra.salvage.domain.classify.CorruptionRecord;
import ca.gc.cra.salvage.domain.validation.ValidationOracle;
import ca.gc.cra.salvage.domain.validation.ValidationReport;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Classifies every artifact in the evidence set and writes the validation report.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read each artifact through the {@link ArtifactSourcePort}; unreadable files are listed as skipped.</li>
 *   <li>Run the {@link ValidationOracle} and {@link CorruptionClassifier} on the worker pool.</li>
 *   <li>Write the sorted {@link ClassificationReport} and emit {@code classify.*} metrics.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One run at a time; per-artifact work runs on {@code workers}.</p>
 *
 * @since 0.1.0
 */
public final class ValidateUseCase {
  private static final Logger log = LoggerFactory.getLogger(ValidateUseCase.class);

  private final ArtifactSourcePort source;
  private final ValidationOracle oracle;
  private final CorruptionClassifier classifier;
  private final ReportWriterPort reports;
  private final ExecutorService workers;
  private final MetricsPort metrics;
  private final ClockPort clock;

  public ValidateUseCase(
      ArtifactSourcePort source,
      ValidationOracle oracle,
      CorruptionClassifier classifier,
      ReportWriterPort reports,
      ExecutorService workers,
      MetricsPort metrics,
      ClockPort clock) {
    this.source = Objects.requireNonNull(source, "source");
    this.oracle = Objects.requireNonNull(oracle, "oracle");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.reports = Objects.requireNonNull(reports, "reports");
    this.workers = Objects.requireNonNull(workers, "workers");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Classifies the evidence set and writes the validation report.
   *
   * @return classification report
   * @throws PipelineException if the evidence set cannot be listed or the report cannot be written
   * @throws InterruptedException if the run is cancelled
   */
  public ClassificationReport run() throws PipelineException, InterruptedException {
    List<ArtifactRef> refs;
    try {
      refs = source.list();
    } catch (IOException ex) {
      throw new PipelineException("Unable to enumerate evidence: " + ex.getMessage(), ex);
    }
    log.info("Validating {} artifacts with checks {}", refs.size(), oracle.checkNames());

    List<Classified> results = ParallelStage.map(workers, refs, ArtifactRef::id, this::classify);
    List<ArtifactEntry> entries = new ArrayList<>(results.size());
    List<SkippedEntry> skipped = new ArrayList<>();
    for (Classified result : results) {
      if (result.entry != null) {
        entries.add(result.entry);
      } else {
        skipped.add(result.skipped);
      }
    }
    ClassificationReport report = new ClassificationReport(clock.nowMillis(), entries, skipped);
    try {
      Path written = reports.writeValidation(report);
      log.info("Validation report written to {}: {} valid, {} corrupted, {} unrecoverable, {} skipped",
          written, report.statistics().valid(), report.statistics().corrupted(),
          report.statistics().unrecoverable(), skipped.size());
    } catch (IOException ex) {
      throw new PipelineException("Unable to write validation report: " + ex.getMessage(), ex);
    }
    return report;
  }

  private Classified classify(ArtifactRef ref) {
    long started = System.nanoTime();
    ImageArtifact artifact;
    try {
      artifact = source.read(ref);
    } catch (IOException ex) {
      metrics.increment("classify.skipped");
      log.warn("Skipping unreadable artifact {}: {}", ref.id(), ex.getMessage());
      return new Classified(null, new SkippedEntry(ref.id(), ref.path().toString(), "unreadable: " + ex.getMessage()));
    }
    ValidationReport verdicts = oracle.validate(artifact);
    for (int i = 0; i < verdicts.unavailableChecks().size(); i++) {
      metrics.increment("check.unavailable");
    }
    CorruptionRecord record = classifier.classify(artifact, verdicts);
    metrics.increment("classify." + record.classification().reportName());
    metrics.observe("classify.latencyNanos", System.nanoTime() - started);
    log.debug("Classified {} as {} ({}, tier {}, confidence {})", artifact.id(),
        record.classification().reportName(), record.corruptionType().reportName(), record.repairabilityTier(),
        record.confidence().reportName());
    return new Classified(new ArtifactEntry(artifact.id(), ref.path().toString(), artifact.recoveryMethod(),
        artifact.format(), artifact.size(), artifact.sha256(), record), null);
  }

  private static final class Classified {
    private final ArtifactEntry entry;
    private final SkippedEntry skipped;

    private Classified(ArtifactEntry entry, SkippedEntry skipped) {
      this.entry = entry;
      this.skipped = skipped;
    }
  }
}
