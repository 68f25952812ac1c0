package ca.gc.cra.salvage.domain.validation;

/**
 * Cost classes used to order checks; the oracle runs cheaper classes first.
 *
 * @since 0.1.0
 */
public enum CheckCost {
  /** Constant-time inspection such as the size check. */
  TRIVIAL,
  /** Linear byte inspection (magic bytes, container walk). */
  CHEAP,
  /** Full decode inside the JVM. */
  DECODE,
  /** External process invocation. */
  EXTERNAL
}
