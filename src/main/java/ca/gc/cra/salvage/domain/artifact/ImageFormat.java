package ca.gc.cra.salvage.domain.artifact;

import ca.gc.cra.salvage.domain.util.Bytes;
import java.util.Locale;

/**
 * Image container formats understood by the engine.
 *
 * @since 0.1.0
 */
public enum ImageFormat {
  /** JPEG/JFIF stream delimited by SOI and EOI markers. */
  JPEG(Bytes.of(0xFF, 0xD8, 0xFF), "jpg", "jpeg", "jpe", "jfif"),
  /** PNG stream with the fixed eight-byte signature and CRC-protected chunks. */
  PNG(Bytes.of(0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A), "png"),
  /** Container could not be attributed to a supported format. */
  UNKNOWN(new byte[0]);

  private final byte[] signature;
  private final String[] extensions;

  ImageFormat(byte[] signature, String... extensions) {
    this.signature = signature;
    this.extensions = extensions;
  }

  /**
   * Returns a copy of the leading signature bytes.
   *
   * @return signature; empty for {@link #UNKNOWN}
   */
  public byte[] signature() {
    return signature.clone();
  }

  /**
   * Indicates whether {@code data} starts with this format's signature at offset zero.
   *
   * @param data candidate bytes
   * @return {@code true} when the signature matches
   */
  public boolean matchesSignature(byte[] data) {
    return signature.length > 0 && Bytes.startsWith(data, signature, 0);
  }

  /**
   * Returns the canonical file extension used when writing artifacts of this format.
   *
   * @return extension without a dot; {@code "bin"} for {@link #UNKNOWN}
   */
  public String extension() {
    return extensions.length == 0 ? "bin" : extensions[0];
  }

  /**
   * Lowercase identifier used in reports and catalogs.
   *
   * @return report name
   */
  public String reportName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Attributes a byte stream to a format. The signature at offset zero wins, then the file name
   * extension, then a signature found further into the stream (garbage-prefixed recoveries).
   *
   * @param data artifact bytes
   * @param fileName source file name; may be {@code null}
   * @return detected format, never {@code null}
   */
  public static ImageFormat detect(byte[] data, String fileName) {
    for (ImageFormat format : values()) {
      if (format.matchesSignature(data)) {
        return format;
      }
    }
    ImageFormat byName = fromFileName(fileName);
    if (byName != UNKNOWN) {
      return byName;
    }
    if (Bytes.indexOf(data, PNG.signature, 1) >= 0) {
      return PNG;
    }
    if (Bytes.indexOf(data, Bytes.of(0xFF, 0xD8), 1) >= 0) {
      return JPEG;
    }
    return UNKNOWN;
  }

  /**
   * Resolves a format from a file name extension.
   *
   * @param fileName name or path; may be {@code null}
   * @return matching format or {@link #UNKNOWN}
   */
  public static ImageFormat fromFileName(String fileName) {
    if (fileName == null) {
      return UNKNOWN;
    }
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return UNKNOWN;
    }
    String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    for (ImageFormat format : values()) {
      for (String candidate : format.extensions) {
        if (candidate.equals(ext)) {
          return format;
        }
      }
    }
    return UNKNOWN;
  }

  /**
   * Parses a report name such as {@code "jpeg"}; unknown or blank values map to {@link #UNKNOWN}.
   *
   * @param raw report value
   * @return parsed format
   */
  public static ImageFormat fromReportName(String raw) {
    if (raw == null || raw.isBlank()) {
      return UNKNOWN;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    if (normalized.equals("JPG")) {
      return JPEG;
    }
    for (ImageFormat format : values()) {
      if (format.name().equals(normalized)) {
        return format;
      }
    }
    return UNKNOWN;
  }
}
