package ca.gc.cra.salvage.config;

import ca.gc.cra.salvage.application.pipeline.DecideUseCase;
import ca.gc.cra.salvage.application.pipeline.RepairUseCase;
import ca.gc.cra.salvage.application.pipeline.SalvagePipeline;
import ca.gc.cra.salvage.application.pipeline.ValidateUseCase;
import ca.gc.cra.salvage.application.port.ArtifactSourcePort;
import ca.gc.cra.salvage.application.port.ClockPort;
import ca.gc.cra.salvage.application.port.MetricsPort;
import ca.gc.cra.salvage.application.port.ReportReaderPort;
import ca.gc.cra.salvage.application.port.ReportWriterPort;
import ca.gc.cra.salvage.domain.classify.CorruptionClassifier;
import ca.gc.cra.salvage.domain.decision.DecisionEngine;
import ca.gc.cra.salvage.domain.repair.RepairEngine;
import ca.gc.cra.salvage.domain.validation.ArtifactCheck;
import ca.gc.cra.salvage.domain.validation.ValidationOracle;
import ca.gc.cra.salvage.infrastructure.check.ExternalToolCheck;
import ca.gc.cra.salvage.infrastructure.check.ImageIoDecodeCheck;
import ca.gc.cra.salvage.infrastructure.check.LocalProcessRunner;
import ca.gc.cra.salvage.infrastructure.check.ProcessRunner;
import ca.gc.cra.salvage.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.salvage.infrastructure.imageio.ImageIoPixelRecovery;
import ca.gc.cra.salvage.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.salvage.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.salvage.infrastructure.persistence.FileArtifactSource;
import ca.gc.cra.salvage.infrastructure.persistence.FileArtifactStore;
import ca.gc.cra.salvage.infrastructure.report.JsonReportReader;
import ca.gc.cra.salvage.infrastructure.report.JsonReportWriter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires configuration into domain engines, adapters and use cases.
 * <p><strong>Why:</strong> Keeps the CLI free of construction details and lets tests swap metrics, clock and the
 * external process runner.</p>
 * <p><strong>Thread-safety:</strong> Build and use from one thread; the worker pool it owns is closed by
 * {@link #close()}.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final long SHUTDOWN_TIMEOUT_MILLIS = 5_000L;

  private final SalvageConfig config;
  private final EngineSettings engineSettings;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ProcessRunner processRunner;
  private ExecutorService workers;

  public CompositionRoot(SalvageConfig config, EngineSettings engineSettings) {
    this(config, engineSettings, defaultMetrics(), ClockPort.SYSTEM, new LocalProcessRunner());
  }

  public CompositionRoot(
      SalvageConfig config,
      EngineSettings engineSettings,
      MetricsPort metrics,
      ClockPort clock,
      ProcessRunner processRunner) {
    this.config = Objects.requireNonNull(config, "config");
    this.engineSettings = Objects.requireNonNull(engineSettings, "engineSettings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.processRunner = Objects.requireNonNull(processRunner, "processRunner");
  }

  /** OpenTelemetry only when an exporter was selected; otherwise metrics are dropped. */
  static MetricsPort defaultMetrics() {
    String exporter = System.getProperty("otel.metrics.exporter", "none");
    return "none".equalsIgnoreCase(exporter.trim()) ? new NoOpMetricsAdapter() : new OpenTelemetryMetricsAdapter();
  }

  /** Built-in checks plus the optional checks enabled by configuration. */
  public ValidationOracle validationOracle() {
    List<ArtifactCheck> checks = new ArrayList<>(ValidationOracle.builtInChecks());
    if (config.decodeCheck()) {
      checks.add(new ImageIoDecodeCheck());
    }
    Duration timeout = Duration.ofMillis(config.checkTimeoutMillis());
    for (String tool : config.externalChecks()) {
      checks.add(ExternalToolCheck.named(tool, processRunner, timeout));
    }
    return new ValidationOracle(checks);
  }

  public CorruptionClassifier classifier() {
    return new CorruptionClassifier(engineSettings.classifier());
  }

  public RepairEngine repairEngine() {
    return new RepairEngine(validationOracle(), classifier(), new ImageIoPixelRecovery(), engineSettings.repair());
  }

  public DecisionEngine decisionEngine() {
    return new DecisionEngine(engineSettings.successRates(), engineSettings.thresholds());
  }

  /** Evidence source from {@code in} or {@code catalog}; otherwise reads only recorded report paths. */
  public ArtifactSourcePort artifactSource() {
    if (config.inputDirectory().isPresent()) {
      return FileArtifactSource.forDirectory(config.inputDirectory().get());
    }
    if (config.catalogFile().isPresent()) {
      return FileArtifactSource.forCatalog(config.catalogFile().get());
    }
    return FileArtifactSource.forRecordedPaths();
  }

  public ReportWriterPort reportWriter() {
    return new JsonReportWriter(config.outputDirectory(), config.allowOverwrite());
  }

  public ReportReaderPort reportReader() {
    return new JsonReportReader();
  }

  public ValidateUseCase validateUseCase() {
    return new ValidateUseCase(
        artifactSource(), validationOracle(), classifier(), reportWriter(), workers(), metrics, clock);
  }

  public DecideUseCase decideUseCase() {
    return new DecideUseCase(decisionEngine(), reportWriter(), clock);
  }

  public RepairUseCase repairUseCase() {
    return new RepairUseCase(
        artifactSource(),
        repairEngine(),
        new FileArtifactStore(config.outputDirectory(), config.allowOverwrite()),
        reportWriter(),
        workers(),
        metrics,
        clock);
  }

  public SalvagePipeline pipeline() {
    return new SalvagePipeline(validateUseCase(), decideUseCase(), repairUseCase());
  }

  public MetricsPort metrics() {
    return metrics;
  }

  private ExecutorService workers() {
    if (workers == null) {
      workers = ExecutorFactories.newWorkerPool(config.workers(), "salvage-worker",
          (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
    }
    return workers;
  }

  @Override
  public void close() {
    if (workers != null) {
      try {
        if (!ExecutorFactories.shutdown(workers, SHUTDOWN_TIMEOUT_MILLIS)) {
          log.warn("Worker pool did not stop within {} ms", SHUTDOWN_TIMEOUT_MILLIS);
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        workers.shutdownNow();
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}
