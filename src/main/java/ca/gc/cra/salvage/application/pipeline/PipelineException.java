package ca.gc.cra.salvage.application.pipeline;

/**
 * Fatal environment failure that halts the whole batch: the evidence set cannot be enumerated or an output
 * location cannot be written. Per-artifact problems are never reported this way.
 *
 * @since 0.1.0
 */
public final class PipelineException extends Exception {
  private static final long serialVersionUID = 1L;

  public PipelineException(String message, Throwable cause) {
    super(message, cause);
  }
}
