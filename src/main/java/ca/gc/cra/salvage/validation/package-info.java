/**
 * <strong>Purpose:</strong> Input validation helpers shared by the CLI, configuration and catalog readers.
 * <p><strong>Concurrency:</strong> Stateless utilities.
 * <p><strong>Observability:</strong> No logging; violations raise {@link java.lang.IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.salvage.validation;
