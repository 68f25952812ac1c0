/**
 * <strong>Purpose:</strong> Adapters implementing application ports against the filesystem, ImageIO, external
 * tools, JSON and OpenTelemetry.
 *
 * @since 0.1.0
 */
package ca.gc.cra.salvage.infrastructure;
