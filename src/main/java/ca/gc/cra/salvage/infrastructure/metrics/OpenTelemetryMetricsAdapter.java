package ca.gc.cra.salvage.infrastructure.metrics;

import ca.gc.cra.salvage.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} that forwards salvage counters and histograms to OpenTelemetry.
 * <p><strong>Why:</strong> Long evidence runs are watched from the same collector as other lab services.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created lazily in concurrent maps; safe for worker threads.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("salvage.metric.key");
  private static final String FALLBACK_METRIC_NAME = "salvage.metric";
  private static final Map<String, String> DESCRIPTIONS = Map.of(
      "classify.valid", "Artifacts classified valid",
      "classify.corrupted", "Artifacts classified corrupted",
      "classify.unrecoverable", "Artifacts classified unrecoverable",
      "classify.skipped", "Artifacts skipped because they could not be read",
      "classify.latencyNanos", "Time to read, validate and classify one artifact",
      "check.unavailable", "Optional checks that could not run",
      "repair.success", "Repairs that passed re-validation",
      "repair.failed", "Repairs whose attempts were all rejected");

  private final MetricsDelegate delegate;
  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;

  /** Creates an adapter wired to the exporter selected by system properties or the environment. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
      this.delegate = NoopDelegate.INSTANCE;
    } else {
      this.delegate = new OtelDelegate(bootstrap.meter());
    }
  }

  @Override
  public void increment(String key) {
    delegate.increment(key);
  }

  @Override
  public void observe(String key, long value) {
    delegate.observe(key, value);
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Flushes pending measurements and shuts the meter provider down. */
  @Override
  public void close() {
    bootstrap.close();
  }

  static String describe(String key) {
    return DESCRIPTIONS.getOrDefault(key, "Salvage metric " + key);
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private interface MetricsDelegate {
    void increment(String key);

    void observe(String key, long value);
  }

  private static final class NoopDelegate implements MetricsDelegate {
    private static final NoopDelegate INSTANCE = new NoopDelegate();

    @Override
    public void increment(String key) {
      // no-op
    }

    @Override
    public void observe(String key, long value) {
      // no-op
    }
  }

  private static final class OtelDelegate implements MetricsDelegate {
    private final Meter meter;
    private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

    private OtelDelegate(Meter meter) {
      this.meter = Objects.requireNonNull(meter, "meter");
    }

    @Override
    public void increment(String key) {
      CounterInstrument instrument = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::counter);
      instrument.counter().add(1, instrument.attributes());
    }

    @Override
    public void observe(String key, long value) {
      HistogramInstrument instrument =
          histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::histogram);
      instrument.histogram().record(value, instrument.attributes());
    }

    private CounterInstrument counter(String key) {
      String name = sanitizeName(key);
      LongCounter counter = meter.counterBuilder(name).setUnit("1").setDescription(describe(key)).build();
      if (!name.equals(key)) {
        log.debug("Sanitized counter name '{}' -> '{}'", key, name);
      }
      return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }

    private HistogramInstrument histogram(String key) {
      String name = sanitizeName(key);
      LongHistogram histogram = meter.histogramBuilder(name)
          .ofLongs()
          .setUnit(key.endsWith("Nanos") ? "ns" : "1")
          .setDescription(describe(key))
          .build();
      if (!name.equals(key)) {
        log.debug("Sanitized histogram name '{}' -> '{}'", key, name);
      }
      return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
