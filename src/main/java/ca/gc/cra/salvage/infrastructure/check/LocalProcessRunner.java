package ca.gc.cra.salvage.infrastructure.check;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}. Output is redirected to a temporary file so a chatty tool
 * cannot block on a full pipe.
 *
 * @since 0.1.0
 */
public final class LocalProcessRunner implements ProcessRunner {
  @Override
  public Result run(List<String> command, Duration timeout)
      throws IOException, TimeoutException, InterruptedException {
    Path output = Files.createTempFile("salvage-tool", ".out");
    try {
      Process process = new ProcessBuilder(command)
          .redirectErrorStream(true)
          .redirectOutput(output.toFile())
          .redirectInput(ProcessBuilder.Redirect.from(nullDevice()))
          .start();
      boolean finished;
      try {
        finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException ex) {
        process.destroyForcibly();
        throw ex;
      }
      if (!finished) {
        process.destroyForcibly();
        throw new TimeoutException(command.get(0) + " did not finish within " + timeout.toMillis() + " ms");
      }
      return new Result(process.exitValue(), new String(Files.readAllBytes(output), StandardCharsets.UTF_8));
    } finally {
      Files.deleteIfExists(output);
    }
  }

  private static File nullDevice() {
    boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    return new File(windows ? "NUL" : "/dev/null");
  }
}
