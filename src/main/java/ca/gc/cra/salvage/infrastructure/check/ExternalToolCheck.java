package ca.gc.cra.salvage.infrastructure.check;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import ca.gc.cra.salvage.domain.validation.ArtifactCheck;
import ca.gc.cra.salvage.domain.validation.CheckCost;
import ca.gc.cra.salvage.domain.validation.CheckUnavailableException;
import ca.gc.cra.salvage.domain.validation.ValidationVerdict;
import ca.gc.cra.salvage.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Optional check delegating to an installed image auditor ({@code jpeginfo}, {@code pngcheck},
 * ImageMagick {@code identify}).
 * <p><strong>Why:</strong> Independent decoders catch damage the in-process checks accept; their absence on a
 * workstation must only lower confidence, never fail a run.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Stage the artifact bytes in a private temporary file; the evidence file is never handed to the tool.</li>
 *   <li>Map exit status zero to a pass and anything else to a fail carrying the tool's output.</li>
 *   <li>Report a missing binary, start failure or timeout as {@link CheckUnavailableException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; each call stages its own file.</p>
 *
 * @since 0.1.0
 */
public final class ExternalToolCheck implements ArtifactCheck {
  private static final Logger log = LoggerFactory.getLogger(ExternalToolCheck.class);
  private static final int MAX_DIAGNOSTIC_BYTES = 200;

  private final String name;
  private final Optional<ImageFormat> onlyFor;
  private final List<String> arguments;
  private final ProcessRunner runner;
  private final Duration timeout;
  private final AtomicBoolean missing = new AtomicBoolean();

  ExternalToolCheck(
      String name, Optional<ImageFormat> onlyFor, List<String> arguments, ProcessRunner runner, Duration timeout) {
    this.name = Objects.requireNonNull(name, "name");
    this.onlyFor = Objects.requireNonNull(onlyFor, "onlyFor");
    this.arguments = List.copyOf(arguments);
    this.runner = Objects.requireNonNull(runner, "runner");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  /**
   * Builds one of the known auditors by tool name.
   *
   * @param tool {@code jpeginfo}, {@code pngcheck} or {@code identify}
   * @param runner process runner
   * @param timeout per-invocation time bound
   * @return configured check
   * @throws IllegalArgumentException for an unknown tool
   */
  public static ExternalToolCheck named(String tool, ProcessRunner runner, Duration timeout) {
    String normalized = Objects.requireNonNull(tool, "tool").trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "jpeginfo" -> new ExternalToolCheck(
          "jpeginfo", Optional.of(ImageFormat.JPEG), List.of("jpeginfo", "-c"), runner, timeout);
      case "pngcheck" -> new ExternalToolCheck(
          "pngcheck", Optional.of(ImageFormat.PNG), List.of("pngcheck", "-v"), runner, timeout);
      case "identify" -> new ExternalToolCheck(
          "identify", Optional.empty(), List.of("identify"), runner, timeout);
      default -> throw new IllegalArgumentException("unknown external check: " + tool);
    };
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean required() {
    return false;
  }

  @Override
  public CheckCost cost() {
    return CheckCost.EXTERNAL;
  }

  @Override
  public boolean appliesTo(ImageFormat format) {
    return onlyFor.map(format::equals).orElse(true);
  }

  @Override
  public ValidationVerdict check(ImageArtifact artifact) throws CheckUnavailableException {
    if (missing.get()) {
      throw new CheckUnavailableException(name, "not installed");
    }
    Path staged;
    try {
      staged = Files.createTempFile("salvage-" + name, "." + artifact.format().extension());
      Files.write(staged, artifact.content());
    } catch (IOException ex) {
      throw new CheckUnavailableException(name, "unable to stage artifact: " + ex.getMessage(), ex);
    }
    try {
      List<String> command = new ArrayList<>(arguments);
      command.add(staged.toString());
      ProcessRunner.Result result = runner.run(command, timeout);
      if (result.succeeded()) {
        return ValidationVerdict.pass(name);
      }
      String diagnostic = Logs.truncate(Logs.singleLine(result.output()), MAX_DIAGNOSTIC_BYTES);
      return ValidationVerdict.fail(
          name, "exit " + result.exitCode() + (diagnostic.isEmpty() ? "" : ": " + diagnostic));
    } catch (TimeoutException ex) {
      throw new CheckUnavailableException(name, "timed out after " + timeout.toMillis() + " ms", ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new CheckUnavailableException(name, "interrupted", ex);
    } catch (IOException ex) {
      if (missing.compareAndSet(false, true)) {
        log.warn("External check {} could not start ({}); treating it as unavailable for this run",
            name, ex.getMessage());
      }
      throw new CheckUnavailableException(name, Objects.requireNonNullElse(ex.getMessage(), "start failed"), ex);
    } finally {
      deleteQuietly(staged);
    }
  }

  private void deleteQuietly(Path staged) {
    try {
      Files.deleteIfExists(staged);
    } catch (IOException ex) {
      log.debug("Unable to delete staged copy {} for {}", staged, name, ex);
    }
  }
}
