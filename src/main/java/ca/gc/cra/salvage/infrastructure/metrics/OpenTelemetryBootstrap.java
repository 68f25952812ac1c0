package ca.gc.cra.salvage.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the meter provider for salvage runs.
 *
 * <p>Exporting is off unless {@code otel.metrics.exporter} (or {@code OTEL_METRICS_EXPORTER}) selects
 * {@code otlp}; evidence workstations are usually offline.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.salvage";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(10);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize() {
    try {
      BootstrapConfig config = BootstrapConfig.fromEnvironment();
      if (config.exporter() == ExporterMode.NONE) {
        log.debug("OpenTelemetry metrics exporter disabled");
        return BootstrapResult.noop();
      }
      OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder().setEndpoint(config.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
      BootstrapResult result = active(reader, config.resource(), config.version());
      log.info("OpenTelemetry metrics exporting over OTLP to {}", config.endpoint());
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; continuing without export", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    Objects.requireNonNull(reader, "reader");
    String version = detectServiceVersion();
    return active(reader, buildResource(version, Attributes.empty()), version);
  }

  private static BootstrapResult active(MetricReader reader, Resource resource, String version) {
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return new BootstrapResult(meter, provider);
  }

  static Resource buildResource(String version, Attributes additional) {
    AttributesBuilder builder = Attributes.builder()
        .put(SERVICE_NAME, "salvage")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version)
        .put(SERVICE_INSTANCE_ID, detectInstanceId());
    Resource extra = additional.isEmpty() ? Resource.empty() : Resource.create(additional);
    return Resource.getDefault().merge(Resource.create(builder.build())).merge(extra);
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      int idx = trimmed.indexOf('=');
      if (idx <= 0 || idx == trimmed.length() - 1) {
        if (!trimmed.isEmpty()) {
          log.warn("Ignoring malformed resource attribute: {}", trimmed);
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(trimmed.substring(0, idx).trim()), trimmed.substring(idx + 1).trim());
    }
    return builder.build();
  }

  private static String detectInstanceId() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Host name unavailable for service.instance.id", ex);
      return "unknown";
    }
  }

  private static String detectServiceVersion() {
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(
        "/META-INF/maven/ca.gc.cra/salvage/pom.properties")) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read pom.properties for version detection", ex);
    }
    return "0.0.0-dev";
  }

  private static String firstNonBlank(String first, String second, String defaultValue) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return defaultValue;
  }

  record BootstrapConfig(ExporterMode exporter, String endpoint, Resource resource, String version) {
    static BootstrapConfig fromEnvironment() {
      Properties props = System.getProperties();
      ExporterMode exporter = ExporterMode.from(firstNonBlank(
          props.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER"), "none"));
      String endpoint = firstNonBlank(
          props.getProperty("otel.exporter.otlp.endpoint"),
          System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
          DEFAULT_ENDPOINT);
      String attributes = firstNonBlank(
          props.getProperty("otel.resource.attributes"), System.getenv("OTEL_RESOURCE_ATTRIBUTES"), "");
      String version = detectServiceVersion();
      return new BootstrapConfig(
          exporter, endpoint, buildResource(version, parseResourceAttributes(attributes)), version);
    }
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "otlp" -> OTLP;
        case "", "none" -> NONE;
        default -> {
          log.warn("Unknown metrics exporter '{}'; metrics will not be exported", raw);
          yield NONE;
        }
      };
    }
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush().join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode shutdown = provider.shutdown().join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
