package ca.gc.cra.salvage.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY_ATTR = AttributeKey.stringKey("salvage.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("classify.corrupted");
    adapter.increment("classify.corrupted");
    adapter.increment("classify.corrupted");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "classify.corrupted").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    assertEquals("Artifacts classified corrupted", counter.getDescription());

    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("classify.corrupted", point.getAttributes().get(KEY_ATTR));

    assertEquals("salvage", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "Service instance id should be provided");
  }

  @Test
  void observeRecordsHistogramInNanoseconds() {
    adapter.observe("classify.latencyNanos", 1_000L);
    adapter.observe("classify.latencyNanos", 3_000L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "classify.latencynanos").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ns", histogram.getUnit());

    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000.0, point.getSum(), 0.0001);
    assertEquals("classify.latencyNanos", point.getAttributes().get(KEY_ATTR));
  }

  @Test
  void sanitizeNameLowercasesAndReplacesIllegalCharacters() {
    assertEquals("repair.success", OpenTelemetryMetricsAdapter.sanitizeName("repair.success"));
    assertEquals("check_unavailable_jpeginfo", OpenTelemetryMetricsAdapter.sanitizeName("Check unavailable/jpeginfo"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("salvage.metric", OpenTelemetryMetricsAdapter.sanitizeName("  "));
  }

  @Test
  void describeFallsBackForUnknownKeys() {
    assertEquals("Repairs that passed re-validation", OpenTelemetryMetricsAdapter.describe("repair.success"));
    assertEquals("Salvage metric custom.key", OpenTelemetryMetricsAdapter.describe("custom.key"));
  }

  @Test
  void noopBootstrapAcceptsMeasurements() {
    OpenTelemetryBootstrap.BootstrapResult noop = OpenTelemetryBootstrap.BootstrapResult.noop();
    assertTrue(noop.isNoop());
    try (OpenTelemetryMetricsAdapter disabled = new OpenTelemetryMetricsAdapter(noop)) {
      assertDoesNotThrow(() -> {
        disabled.increment("classify.valid");
        disabled.observe("classify.latencyNanos", 5L);
        disabled.forceFlush();
      });
    }
  }

  @Test
  void resourceAttributesParseAndSkipMalformedTokens() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("lab=ottawa, bad, case.id = 42 ,=x");
    assertEquals("ottawa", attributes.get(AttributeKey.stringKey("lab")));
    assertEquals("42", attributes.get(AttributeKey.stringKey("case.id")));
    assertEquals(2, attributes.size());
    assertTrue(OpenTelemetryBootstrap.parseResourceAttributes(" ").isEmpty());
  }

  @Test
  void exporterModeDefaultsToNone() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from(null));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from("prometheus"));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(" OTLP "));
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
