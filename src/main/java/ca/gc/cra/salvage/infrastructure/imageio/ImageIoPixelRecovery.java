package ca.gc.cra.salvage.infrastructure.imageio;

import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import ca.gc.cra.salvage.domain.repair.PixelRecovery;
import ca.gc.cra.salvage.domain.util.Bytes;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.event.IIOReadUpdateListener;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.MemoryCacheImageInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link PixelRecovery} on top of the JDK ImageIO readers and writers.
 * <p><strong>Why:</strong> The JPEG reader fills everything after a premature end with grey and the PNG reader
 * aborts mid-image; both still leave the rows decoded before the damage in the destination image.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decode into a preallocated destination so rows survive a reader exception.</li>
 *   <li>Count rows through {@link IIOReadUpdateListener} and freeze the count at the first decoder warning.</li>
 *   <li>Round JPEG row counts down to a whole MCU band, then crop and re-encode.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; each call obtains its own reader.</p>
 *
 * @since 0.1.0
 */
public final class ImageIoPixelRecovery implements PixelRecovery {
  private static final Logger log = LoggerFactory.getLogger(ImageIoPixelRecovery.class);
  private static final int BLOCK_SIZE = 8;

  @Override
  public Optional<RecoveredImage> recover(byte[] data, ImageFormat format) {
    if (data == null || data.length == 0 || format == ImageFormat.UNKNOWN) {
      return Optional.empty();
    }
    Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName(formatName(format));
    if (!readers.hasNext()) {
      log.warn("No ImageIO reader for {}; partial decode unavailable", format.reportName());
      return Optional.empty();
    }
    ImageReader reader = readers.next();
    try (ImageInputStream in = new MemoryCacheImageInputStream(new ByteArrayInputStream(data))) {
      reader.setInput(in, false, true);
      int width = reader.getWidth(0);
      int height = reader.getHeight(0);
      Iterator<ImageTypeSpecifier> types = reader.getImageTypes(0);
      if (width <= 0 || height <= 0 || !types.hasNext()) {
        return Optional.empty();
      }
      BufferedImage destination = types.next().createBufferedImage(width, height);
      ImageReadParam param = reader.getDefaultReadParam();
      param.setDestination(destination);

      RowTracker tracker = new RowTracker();
      reader.addIIOReadUpdateListener(tracker);
      reader.addIIOReadWarningListener((source, warning) -> tracker.freeze(warning));
      try {
        reader.read(0, param);
      } catch (IOException | RuntimeException ex) {
        tracker.freeze(String.valueOf(ex.getMessage()));
      }

      int rows = Math.min(tracker.rows(), height);
      if (format == ImageFormat.JPEG && rows < height) {
        int band = BLOCK_SIZE * maxVerticalSampling(data);
        rows = rows / band * band;
      }
      if (rows <= 0) {
        log.debug("No clean rows recovered ({})", tracker.reason());
        return Optional.empty();
      }
      byte[] encoded = encode(destination, width, rows, format);
      if (encoded.length == 0) {
        return Optional.empty();
      }
      return Optional.of(new RecoveredImage(encoded, rows, height));
    } catch (IOException | RuntimeException ex) {
      log.debug("Partial decode failed before any row was read: {}", ex.toString());
      return Optional.empty();
    } finally {
      reader.dispose();
    }
  }

  private static byte[] encode(BufferedImage source, int width, int rows, ImageFormat format) throws IOException {
    boolean alpha = format == ImageFormat.PNG && source.getColorModel().hasAlpha();
    BufferedImage cropped =
        new BufferedImage(width, rows, alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
    Graphics2D g = cropped.createGraphics();
    try {
      g.drawImage(source.getSubimage(0, 0, width, rows), 0, 0, null);
    } finally {
      g.dispose();
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    if (!ImageIO.write(cropped, formatName(format), out)) {
      log.warn("No ImageIO writer for {}", format.reportName());
      return new byte[0];
    }
    return out.toByteArray();
  }

  /**
   * Largest vertical sampling factor declared in the first frame header; 1 when none is found.
   */
  static int maxVerticalSampling(byte[] data) {
    for (int i = 0; i + 1 < data.length; i++) {
      if (Bytes.u8(data, i) != 0xFF || !isFrameHeader(Bytes.u8(data, i + 1))) {
        continue;
      }
      int components = i + 9 < data.length ? Bytes.u8(data, i + 9) : 0;
      int max = 1;
      for (int c = 0; c < components; c++) {
        int offset = i + 11 + c * 3;
        if (offset >= data.length) {
          break;
        }
        max = Math.max(max, Bytes.u8(data, offset) & 0x0F);
      }
      return Math.max(1, Math.min(max, 4));
    }
    return 1;
  }

  private static boolean isFrameHeader(int marker) {
    return marker >= 0xC0 && marker <= 0xCF && marker != 0xC4 && marker != 0xC8 && marker != 0xCC;
  }

  private static String formatName(ImageFormat format) {
    return format == ImageFormat.PNG ? "png" : "jpeg";
  }

  /** Tracks the highest decoded row until the first sign of damage. */
  private static final class RowTracker implements IIOReadUpdateListener {
    private final AtomicInteger rows = new AtomicInteger();
    private volatile boolean frozen;
    private volatile String reason = "complete";

    void freeze(String why) {
      if (!frozen) {
        frozen = true;
        reason = why;
      }
    }

    int rows() {
      return rows.get();
    }

    String reason() {
      return reason;
    }

    @Override
    public void imageUpdate(ImageReader source, BufferedImage theImage, int minX, int minY, int width, int height,
        int periodX, int periodY, int[] bands) {
      if (!frozen) {
        int lastRow = minY + (height - 1) * Math.max(periodY, 1);
        rows.accumulateAndGet(lastRow + 1, Math::max);
      }
    }

    @Override
    public void passStarted(ImageReader source, BufferedImage theImage, int pass, int minPass, int maxPass,
        int minX, int minY, int periodX, int periodY, int[] bands) {}

    @Override
    public void passComplete(ImageReader source, BufferedImage theImage) {}

    @Override
    public void thumbnailPassStarted(ImageReader source, BufferedImage theThumbnail, int pass, int minPass,
        int maxPass, int minX, int minY, int periodX, int periodY, int[] bands) {}

    @Override
    public void thumbnailPassComplete(ImageReader source, BufferedImage theThumbnail) {}

    @Override
    public void thumbnailUpdate(ImageReader source, BufferedImage theThumbnail, int minX, int minY, int width,
        int height, int periodX, int periodY, int[] bands) {}
  }
}
