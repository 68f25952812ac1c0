package ca.gc.cra.salvage.infrastructure.persistence;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes whole files through a sibling temporary file and a rename. Readers see either the previous content or the
 * complete new content, never a prefix.
 *
 * @since 0.1.0
 */
public final class AtomicFiles {
  private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);

  private AtomicFiles() {}

  /**
   * Writes {@code bytes} to {@code target}, creating parent directories.
   *
   * @param target destination file
   * @param bytes complete content
   * @param allowOverwrite whether an existing {@code target} may be replaced
   * @throws FileAlreadyExistsException if {@code target} exists and overwriting is not allowed
   * @throws IOException when writing or renaming fails
   */
  public static void write(Path target, byte[] bytes, boolean allowOverwrite) throws IOException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(bytes, "bytes");
    Path dir = target.toAbsolutePath().getParent();
    Files.createDirectories(dir);
    if (!allowOverwrite && Files.exists(target)) {
      throw new FileAlreadyExistsException(target.toString(), null, "re-run with --allow-overwrite to replace");
    }
    Path tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
    try {
      Files.write(tmp, bytes);
      if (allowOverwrite) {
        replace(tmp, target);
      } else {
        publish(tmp, target);
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  private static void replace(Path tmp, Path target) throws IOException {
    try {
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; falling back to replace", target);
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /** Publishes {@code tmp} as {@code target}, failing if {@code target} exists by then. */
  private static void publish(Path tmp, Path target) throws IOException {
    try {
      Files.createLink(target, tmp);
    } catch (FileAlreadyExistsException ex) {
      throw new FileAlreadyExistsException(target.toString(), null, "written concurrently by another task");
    } catch (UnsupportedOperationException | FileSystemException ex) {
      log.debug("Hard link to {} failed ({}); falling back to move", target, ex.toString());
      Files.move(tmp, target);
    }
  }
}
