package ca.gc.cra.salvage.domain.container;

import ca.gc.cra.salvage.domain.artifact.ImageFormat;

/**
 * Raised when a byte stream carries no recognizable start marker at all. Terminal for the artifact:
 * the classifier routes it straight to {@code unrecoverable}.
 *
 * @since 0.1.0
 */
public class MalformedContainerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ImageFormat format;
  private final int offset;

  /**
   * Creates the exception.
   *
   * @param format format the parser expected
   * @param offset offset at which parsing broke
   * @param message description of the failure
   */
  public MalformedContainerException(ImageFormat format, int offset, String message) {
    super(message + " (" + format.reportName() + " at offset " + offset + ")");
    this.format = format;
    this.offset = offset;
  }

  public ImageFormat format() {
    return format;
  }

  public int offset() {
    return offset;
  }
}
