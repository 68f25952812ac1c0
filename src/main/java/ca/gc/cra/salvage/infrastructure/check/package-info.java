/**
 * Optional validation checks: strict ImageIO decode and external auditors run through a {@link
 * ca.gc.cra.salvage.infrastructure.check.ProcessRunner}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.salvage.infrastructure.check;
