package ca.gc.cra.salvage.api;

import ca.gc.cra.salvage.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves telemetry options out of the command configuration and into the system properties read when the
 * OpenTelemetry metrics adapter starts.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Consumes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} from {@code options}.
   *
   * @param options mutable configuration map
   * @return the exporter in effect, {@code none} when unset
   * @throws IllegalArgumentException if a value is malformed
   */
  static String configureMetrics(Map<String, String> options) {
    String exporter = blankToNull(options.remove("metricsExporter"));
    String endpoint = blankToNull(options.remove("otelEndpoint"));
    String attributes = blankToNull(options.remove("otelResourceAttributes"));

    String mode = exporter == null ? "none" : exporter.toLowerCase(Locale.ROOT);
    if (!mode.equals("otlp") && !mode.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    System.setProperty("otel.metrics.exporter", mode);
    log.debug("Metrics exporter: {}", mode);

    if (endpoint != null) {
      validateEndpoint(endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
      log.debug("OTLP endpoint: {}", endpoint);
    }
    if (attributes != null) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", attributes);
    }
    return mode;
  }

  private static void validateEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
