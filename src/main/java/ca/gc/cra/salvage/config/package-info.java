/**
 * Configuration records, layered loading and composition root wiring for the salvage CLI.
 * <p><strong>Role:</strong> Bootstrap layer turning CLI, YAML and default settings into engines and use cases.</p>
 * <p><strong>Concurrency:</strong> Configuration records are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Paths are normalized here and validated again by the CLI before any write.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.salvage.config;
