/**
 * Command-line entry points for the salvage workflow: {@code validate}, {@code decide}, {@code repair} and
 * {@code run}.
 * <p><strong>Role:</strong> Driving adapters; parse arguments, merge YAML and defaults, configure logging and
 * telemetry, then invoke use cases through {@link ca.gc.cra.salvage.config.CompositionRoot}.</p>
 * <p><strong>Security:</strong> Evidence paths are validated and the output directory may never sit inside the
 * evidence tree.</p>
 */
package ca.gc.cra.salvage.api;
