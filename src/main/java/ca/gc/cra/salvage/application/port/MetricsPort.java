package ca.gc.cra.salvage.application.port;

/**
 * <strong>What:</strong> Domain port for emitting counters and histograms.
 * <p><strong>Why:</strong> Keeps the pipeline independent of the telemetry backend.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use by worker threads.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code classify.corrupted}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, bytes)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
