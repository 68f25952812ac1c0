/**
 * Executor helpers for per-artifact worker pools.
 *
 * @since 0.1.0
 */
package ca.gc.cra.salvage.infrastructure.exec;
