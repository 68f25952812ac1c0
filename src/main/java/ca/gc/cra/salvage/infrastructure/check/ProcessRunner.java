package ca.gc.cra.salvage.infrastructure.check;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external command to completion within a time bound.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ProcessRunner {
  /**
   * Runs {@code command} and captures its combined stdout and stderr.
   *
   * @param command program and arguments
   * @param timeout maximum wall-clock time; the process is killed when exceeded
   * @return exit code and output
   * @throws IOException when the program cannot be started (for example it is not installed)
   * @throws TimeoutException when the process outlives {@code timeout}
   * @throws InterruptedException when interrupted while waiting
   */
  Result run(List<String> command, Duration timeout) throws IOException, TimeoutException, InterruptedException;

  /**
   * Completed process.
   *
   * @param exitCode process exit status
   * @param output combined stdout and stderr, decoded as UTF-8
   */
  record Result(int exitCode, String output) {
    public Result {
      output = Objects.requireNonNullElse(output, "");
    }

    public boolean succeeded() {
      return exitCode == 0;
    }
  }
}
