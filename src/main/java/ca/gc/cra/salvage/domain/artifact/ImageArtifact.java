package ca.gc.cra.salvage.domain.artifact;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable handle to a recovered image candidate plus its provenance.
 * <p><strong>Why:</strong> Evidence bytes must never be mutated; every repair produces a new artifact.</p>
 * <p><strong>Thread-safety:</strong> Immutable; content is copied on construction.</p>
 *
 * @param id stable identifier (relative path or catalog id); never blank
 * @param content artifact bytes; defensively copied
 * @param sourcePath path the bytes were read from, or {@code ""} for derived artifacts
 * @param recoveryMethod originating recovery method (e.g. {@code fs_based}, {@code carving}); {@code "unknown"} when absent
 * @param format container format attributed to the bytes
 * @since 0.1.0
 */
public record ImageArtifact(
    String id,
    byte[] content,
    String sourcePath,
    String recoveryMethod,
    ImageFormat format) {

  /**
   * Normalizes provenance and copies the content.
   */
  public ImageArtifact {
    Objects.requireNonNull(id, "id");
    if (id.isBlank()) {
      throw new IllegalArgumentException("id must not be blank");
    }
    content = content != null ? content.clone() : new byte[0];
    sourcePath = sourcePath == null ? "" : sourcePath;
    recoveryMethod = recoveryMethod == null || recoveryMethod.isBlank() ? "unknown" : recoveryMethod.trim();
    format = Objects.requireNonNullElse(format, ImageFormat.UNKNOWN);
  }

  /**
   * Creates an artifact whose format is detected from its bytes and source name.
   *
   * @param id identifier
   * @param content bytes
   * @param sourcePath source location
   * @param recoveryMethod recovery method label
   * @return new artifact
   */
  public static ImageArtifact of(String id, byte[] content, String sourcePath, String recoveryMethod) {
    return new ImageArtifact(
        id, content, sourcePath, recoveryMethod, ImageFormat.detect(content, sourcePath));
  }

  /**
   * Derives a new artifact carrying {@code newContent} and the same provenance and format.
   *
   * @param derivedId identifier of the derived artifact
   * @param newContent replacement bytes
   * @return fresh artifact; this instance is untouched
   */
  public ImageArtifact derive(String derivedId, byte[] newContent) {
    return new ImageArtifact(derivedId, newContent, "", recoveryMethod, format);
  }

  /**
   * Provides access to the content without copying.
   *
   * @return internal byte array; callers must not mutate it
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Content is copied on construction; techniques read it without extra allocations.")
  public byte[] content() {
    return content;
  }

  /**
   * Returns a private copy of the content for callers that need to edit bytes.
   *
   * @return mutable copy
   */
  public byte[] copyContent() {
    return content.clone();
  }

  /**
   * Size of the artifact in bytes.
   *
   * @return byte count
   */
  public int size() {
    return content.length;
  }

  /**
   * SHA-256 of the content, lower-case hex.
   *
   * @return content digest
   */
  public String sha256() {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 is not available", ex);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ImageArtifact other)) {
      return false;
    }
    return id.equals(other.id)
        && sourcePath.equals(other.sourcePath)
        && recoveryMethod.equals(other.recoveryMethod)
        && format == other.format
        && Arrays.equals(content, other.content);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(id, sourcePath, recoveryMethod, format);
    result = 31 * result + Arrays.hashCode(content);
    return result;
  }

  @Override
  public String toString() {
    return "ImageArtifact{"
        + "id=" + id
        + ", size=" + content.length
        + ", sourcePath=" + sourcePath
        + ", recoveryMethod=" + recoveryMethod
        + ", format=" + format
        + '}';
  }
}
