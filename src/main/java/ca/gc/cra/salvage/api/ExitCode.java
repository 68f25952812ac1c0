package ca.gc.cra.salvage.api;

/**
 * <strong>What:</strong> Process exit codes shared by the salvage commands.
 * <p><strong>Why:</strong> Case-management scripts chain {@code validate}, {@code decide} and {@code repair} and
 * need to tell bad input apart from an unreadable evidence volume.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution, including a dry run. */
  SUCCESS(0),
  /** Command-line arguments or configuration values were invalid. */
  INVALID_ARGS(2),
  /** Evidence, reports or output could not be read or written. */
  IO_ERROR(3),
  /** Configuration was accepted but rejected by a stage. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
