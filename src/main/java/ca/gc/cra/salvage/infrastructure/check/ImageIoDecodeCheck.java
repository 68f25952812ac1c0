package ca.gc.cra.salvage.infrastructure.check;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import ca.gc.cra.salvage.domain.validation.ArtifactCheck;
import ca.gc.cra.salvage.domain.validation.CheckCost;
import ca.gc.cra.salvage.domain.validation.CheckUnavailableException;
import ca.gc.cra.salvage.domain.validation.ValidationVerdict;
import ca.gc.cra.salvage.logging.Logs;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.MemoryCacheImageInputStream;

/**
 * Strict in-process decode with {@code javax.imageio}. Any decoder warning fails the check: the JDK readers report
 * premature stream ends and bad Huffman data as warnings and still return an image.
 *
 * @since 0.1.0
 */
public final class ImageIoDecodeCheck implements ArtifactCheck {
  public static final String NAME = "decode";
  private static final int MAX_DIAGNOSTIC_BYTES = 200;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean required() {
    return false;
  }

  @Override
  public CheckCost cost() {
    return CheckCost.DECODE;
  }

  @Override
  public boolean appliesTo(ImageFormat format) {
    return format != ImageFormat.UNKNOWN;
  }

  @Override
  public ValidationVerdict check(ImageArtifact artifact) throws CheckUnavailableException {
    ImageReader reader = readerFor(artifact.format());
    List<String> warnings = new CopyOnWriteArrayList<>();
    reader.addIIOReadWarningListener((source, warning) -> warnings.add(warning));
    try (ImageInputStream in = new MemoryCacheImageInputStream(new ByteArrayInputStream(artifact.content()))) {
      reader.setInput(in, true, true);
      BufferedImage image = reader.read(0);
      if (image == null) {
        return ValidationVerdict.fail(NAME, "decoder returned no image");
      }
      if (!warnings.isEmpty()) {
        return ValidationVerdict.fail(NAME, diagnostic("decoder warning: " + String.join("; ", warnings)));
      }
      return ValidationVerdict.pass(NAME);
    } catch (IOException ex) {
      return ValidationVerdict.fail(NAME, diagnostic("decode failed: " + withCause(ex)));
    } catch (RuntimeException ex) {
      // Malformed streams surface from the JDK readers as unchecked exceptions as well.
      return ValidationVerdict.fail(NAME, diagnostic("decoder error: " + ex));
    } finally {
      reader.dispose();
    }
  }

  static ImageReader readerFor(ImageFormat format) throws CheckUnavailableException {
    String formatName = switch (format) {
      case JPEG -> "jpeg";
      case PNG -> "png";
      case UNKNOWN -> throw new CheckUnavailableException(NAME, "no decoder for unknown format");
    };
    Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName(formatName);
    if (!readers.hasNext()) {
      throw new CheckUnavailableException(NAME, "no ImageIO reader installed for " + formatName);
    }
    return readers.next();
  }

  /** The PNG reader wraps the real failure, e.g. an {@code EOFException} from the inflater, in a generic one. */
  static String withCause(Throwable ex) {
    String message = String.valueOf(ex.getMessage());
    Throwable cause = ex.getCause();
    return cause == null ? message : message + " (" + cause + ")";
  }

  private static String diagnostic(String text) {
    return Logs.truncate(Logs.singleLine(text), MAX_DIAGNOSTIC_BYTES);
  }
}
