package ca.gc.cra.salvage.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for evidence inputs and report outputs.
 * <p><strong>Why:</strong> Repaired artifacts and reports must never land on top of earlier results or inside the
 * evidence tree by accident.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize user-provided paths to real directories and files.</li>
 *   <li>Guard against reuse of populated output directories unless explicitly approved.</li>
 *   <li>Reject output directories located inside the evidence input directory.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @implNote Checks use {@link LinkOption#NOFOLLOW_LINKS} to avoid symlink traversal.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a writable output directory, optionally creating it.
   *
   * @param path candidate directory; must not be {@code null}
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @param allowReuse when {@code false}, existing non-empty directories are rejected
   * @return real directory path when it exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the directory is not writable, not empty, or creation fails
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing, boolean allowReuse) {
    Path normalized = normalize(path);
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
        ensureDirectory(real, allowReuse);
        return real;
      }
      Path parent = normalized.getParent();
      if (parent == null) {
        throw new IllegalArgumentException("path has no parent to validate: " + normalized);
      }
      Path existing = nearestExistingAncestor(parent);
      if (!Files.isDirectory(existing, LinkOption.NOFOLLOW_LINKS)) {
        throw new IllegalArgumentException("parent is not a directory: " + existing);
      }
      if (!Files.isWritable(existing)) {
        throw new IllegalArgumentException("parent directory is not writable: " + existing);
      }
      if (createIfMissing) {
        Files.createDirectories(normalized);
        Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
        ensureDirectory(real, allowReuse);
        return real;
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates a readable regular file.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate file
   * @return real file path
   * @throws IllegalArgumentException if the file is missing, not regular or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    Path normalized = normalize(path);
    if (!Files.isRegularFile(normalized) || !Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not a readable file: " + normalized);
    }
    return real(normalized);
  }

  /**
   * Validates a readable directory.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate directory
   * @return real directory path
   * @throws IllegalArgumentException if the directory is missing or unreadable
   */
  public static Path requireReadableDir(String name, Path path) {
    Path normalized = normalize(path);
    if (!Files.isDirectory(normalized) || !Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not a readable directory: " + normalized);
    }
    return real(normalized);
  }

  /**
   * Rejects an output location inside the evidence directory.
   *
   * @param output output directory
   * @param evidence evidence input directory
   * @throws IllegalArgumentException if {@code output} equals or lies within {@code evidence}
   */
  public static void requireOutside(Path output, Path evidence) {
    Path out = output.toAbsolutePath().normalize();
    Path in = evidence.toAbsolutePath().normalize();
    if (out.startsWith(in)) {
      throw new IllegalArgumentException("output " + out + " must not be inside evidence directory " + in);
    }
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    if (containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }

  private static Path real(Path path) {
    try {
      return path.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to resolve " + path + ": " + ex.getMessage(), ex);
    }
  }

  private static void ensureDirectory(Path dir, boolean allowReuse) throws IOException {
    if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("path is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
    if (!allowReuse) {
      try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
        if (entries.iterator().hasNext()) {
          throw new IllegalArgumentException(
              "directory " + dir + " is not empty; re-run with --allow-overwrite to reuse");
        }
      }
    }
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start;
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current.toRealPath(LinkOption.NOFOLLOW_LINKS);
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
