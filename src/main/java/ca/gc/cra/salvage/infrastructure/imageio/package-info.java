/**
 * ImageIO-backed pixel recovery used by partial decode re-encode repairs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.salvage.infrastructure.imageio;
