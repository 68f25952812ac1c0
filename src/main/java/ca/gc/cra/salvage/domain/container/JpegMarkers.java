package ca.gc.cra.salvage.domain.container;

import ca.gc.cra.salvage.domain.util.Bytes;
import java.util.Set;

/**
 * JPEG marker codes and naming helpers.
 *
 * @since 0.1.0
 */
public final class JpegMarkers {
  public static final int TEM = 0x01;
  public static final int DHT = 0xC4;
  public static final int JPG = 0xC8;
  public static final int DAC = 0xCC;
  public static final int RST0 = 0xD0;
  public static final int RST7 = 0xD7;
  public static final int SOI = 0xD8;
  public static final int EOI = 0xD9;
  public static final int SOS = 0xDA;
  public static final int DQT = 0xDB;
  public static final int DNL = 0xDC;
  public static final int DRI = 0xDD;
  public static final int APP0 = 0xE0;
  public static final int COM = 0xFE;

  /** Start-of-image marker bytes. */
  public static final byte[] SOI_BYTES = Bytes.of(0xFF, SOI);
  /** End-of-image marker bytes. */
  public static final byte[] EOI_BYTES = Bytes.of(0xFF, EOI);

  /**
   * Minimal JFIF APP0 segment (version 1.1, aspect ratio 1:1, no thumbnail) used when a header has to be
   * synthesized.
   */
  public static final byte[] JFIF_APP0 = Bytes.of(
      0xFF, APP0, 0x00, 0x10, 'J', 'F', 'I', 'F', 0x00,
      0x01, 0x01, 0x00, 0x00, 0x01, 0x00, 0x01, 0x00, 0x00);

  private static final Set<String> TABLE_AND_FRAME_KINDS = Set.of("DQT", "DHT", "DRI", "DAC");

  private JpegMarkers() {}

  /**
   * Whether the marker carries no length field.
   *
   * @param marker marker code (second byte)
   * @return {@code true} for TEM and RSTn
   */
  public static boolean isStandalone(int marker) {
    return marker == TEM || (marker >= RST0 && marker <= RST7);
  }

  /**
   * Whether the marker starts a frame header (SOF0..SOF15, excluding DHT, JPG and DAC).
   *
   * @param marker marker code
   * @return {@code true} for SOFn
   */
  public static boolean isStartOfFrame(int marker) {
    return marker >= 0xC0 && marker <= 0xCF && marker != DHT && marker != JPG && marker != DAC;
  }

  /**
   * Whether {@code marker} can legitimately follow an {@code 0xFF} prefix between segments.
   *
   * @param marker marker code
   * @return {@code true} for assigned marker codes
   */
  public static boolean isKnownMarker(int marker) {
    return marker == TEM || marker >= 0xC0 && marker <= 0xFE;
  }

  /**
   * Human-readable marker name used as {@link Segment#kind()}.
   *
   * @param marker marker code
   * @return marker name such as {@code SOF0} or {@code APP1}
   */
  public static String name(int marker) {
    if (isStartOfFrame(marker)) {
      return "SOF" + (marker - 0xC0);
    }
    if (marker >= RST0 && marker <= RST7) {
      return "RST" + (marker - RST0);
    }
    if (marker >= APP0 && marker <= 0xEF) {
      return "APP" + (marker - APP0);
    }
    return switch (marker) {
      case TEM -> "TEM";
      case DHT -> "DHT";
      case JPG -> "JPG";
      case DAC -> "DAC";
      case SOI -> "SOI";
      case EOI -> "EOI";
      case SOS -> "SOS";
      case DQT -> "DQT";
      case DNL -> "DNL";
      case DRI -> "DRI";
      case COM -> "COM";
      default -> String.format("RES%02X", marker);
    };
  }

  /**
   * Whether a segment kind must survive segment stripping: tables, frame and scan headers, scan data and
   * the end marker.
   *
   * @param kind segment kind
   * @return {@code true} for the critical allow-list
   */
  public static boolean isCritical(String kind) {
    return TABLE_AND_FRAME_KINDS.contains(kind)
        || kind.startsWith("SOF")
        || kind.equals("SOS")
        || kind.equals("SOI")
        || kind.equals("EOI")
        || kind.equals(Segment.ENTROPY_DATA)
        || kind.startsWith("RST");
  }

  /**
   * Whether a segment kind defines image content (tables, frame header, scan header).
   *
   * @param kind segment kind
   * @return {@code true} for image-defining kinds
   */
  public static boolean definesImage(String kind) {
    return kind.equals("DQT") || kind.equals("DHT") || kind.startsWith("SOF") || kind.equals("SOS");
  }

  /**
   * Whether a segment kind must be carried into a synthesized header (tables and frame header).
   *
   * @param kind segment kind
   * @return {@code true} for DQT, DHT, DRI, DAC and SOFn
   */
  public static boolean isHeaderTable(String kind) {
    return TABLE_AND_FRAME_KINDS.contains(kind) || kind.startsWith("SOF");
  }
}
