package ca.gc.cra.salvage.application.port;

/**
 * Source of wall-clock time for report timestamps and override records.
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
