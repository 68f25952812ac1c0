/**
 * <strong>Purpose:</strong> JSON report adapters: {@code validation_report.json}, {@code decision_report.json} and
 * {@code repair_report.json}.
 * <p>Built on the Jackson streaming API; no data binding.
 *
 * @since 0.1.0
 */
package ca.gc.cra.salvage.infrastructure.report;
