package ca.gc.cra.salvage.domain.repair;

import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import java.util.Optional;

/**
 * Port for decoding as many pixel rows as possible from damaged image data and re-encoding them.
 *
 * <p>Implementations must not throw for undecodable input; they return empty instead.</p>
 *
 * @since 0.1.0
 */
public interface PixelRecovery {
  /**
   * Decodes the longest clean prefix of rows and encodes it as a fresh image of the same format.
   *
   * @param data damaged image bytes
   * @param format container format of {@code data}
   * @return re-encoded image, or empty when no complete row could be decoded
   */
  Optional<RecoveredImage> recover(byte[] data, ImageFormat format);

  /**
   * A freshly encoded image holding the recovered rows.
   *
   * @param encoded encoded image bytes
   * @param rowsRecovered rows kept
   * @param declaredHeight height declared by the damaged image
   */
  record RecoveredImage(byte[] encoded, int rowsRecovered, int declaredHeight) {
    public RecoveredImage {
      encoded = encoded.clone();
      if (rowsRecovered <= 0) {
        throw new IllegalArgumentException("rowsRecovered must be positive");
      }
    }

    @Override
    public byte[] encoded() {
      return encoded.clone();
    }
  }
}
