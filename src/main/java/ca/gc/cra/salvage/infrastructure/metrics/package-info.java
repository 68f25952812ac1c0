/**
 * <strong>Purpose:</strong> Metrics adapters behind {@link ca.gc.cra.salvage.application.port.MetricsPort}.
 * <p><strong>Observability:</strong> Exports {@code classify.*}, {@code repair.*} and {@code check.*} metrics over
 * OTLP when enabled.
 *
 * @since 0.1.0
 */
package ca.gc.cra.salvage.infrastructure.metrics;
