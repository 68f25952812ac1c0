package ca.gc.cra.salvage.domain.container;

/**
 * Where a container walk stopped.
 *
 * @since 0.1.0
 */
public enum EndState {
  /** The end marker (JPEG EOI, PNG IEND) was reached. */
  COMPLETE,
  /** The stream ended inside JPEG entropy-coded scan data. */
  IN_SCAN_DATA,
  /** The stream ended inside a length-prefixed segment or chunk. */
  IN_SEGMENT,
  /** The stream ended, or the walk stopped, between units. */
  AT_SEGMENT_BOUNDARY
}
