/**
 * Filesystem adapters for reading recovered evidence and storing repaired copies.
 *
 * <p>Evidence files are only ever opened for reading.
 *
 * @since 0.1.0
 */
package ca.gc.cra.salvage.infrastructure.persistence;
