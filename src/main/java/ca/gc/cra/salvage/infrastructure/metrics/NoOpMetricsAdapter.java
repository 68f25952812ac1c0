package ca.gc.cra.salvage.infrastructure.metrics;

import ca.gc.cra.salvage.application.port.MetricsPort;

/**
 * Metrics adapter used for dry runs and when telemetry is disabled.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {
    // intentionally blank
  }

  @Override
  public void observe(String key, long value) {
    // intentionally blank
  }
}
