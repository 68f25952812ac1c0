/**
 * <strong>Purpose:</strong> Ports the salvage use cases depend on: evidence source, repaired-artifact store,
 * report documents, metrics and clock.
 * <p><strong>Concurrency:</strong> Source, store and metrics implementations are called from worker threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.salvage.application.port;
