package ca.gc.cra.salvage.domain.repair;

import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import ca.gc.cra.salvage.domain.container.ContainerParser;
import ca.gc.cra.salvage.domain.container.ContainerParsers;
import ca.gc.cra.salvage.domain.container.MalformedContainerException;
import java.io.ByteArrayOutputStream;
import java.util.Optional;

/**
 * Structural self-check and byte assembly shared by the techniques.
 */
final class SelfCheck {
  private SelfCheck() {}

  /** Whether {@code candidate} starts with the signature and walks cleanly to its end marker. */
  static boolean isSound(ImageFormat format, byte[] candidate) {
    if (!format.matchesSignature(candidate)) {
      return false;
    }
    Optional<ContainerParser> parser = ContainerParsers.forFormat(format);
    if (parser.isEmpty()) {
      return false;
    }
    try {
      return parser.get().parse(candidate).isStructurallySound();
    } catch (MalformedContainerException ex) {
      return false;
    }
  }

  static byte[] concat(byte[]... parts) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (byte[] part : parts) {
      out.writeBytes(part);
    }
    return out.toByteArray();
  }
}
