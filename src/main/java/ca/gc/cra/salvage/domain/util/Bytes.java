package ca.gc.cra.salvage.domain.util;

/**
 * <strong>What:</strong> Utility methods for reading unsigned integers and locating byte patterns in container data.
 *
 * @since 0.1.0
 */
public final class Bytes {
  private Bytes() {}

  /**
   * Reads an unsigned 8-bit value.
   *
   * @param a byte array source; may be {@code null}
   * @param off offset in the array
   * @return unsigned value in the range {@code [0,255]} or {@code 0} if out of bounds
   */
  public static int u8(byte[] a, int off) {
    if (a == null || off < 0 || off >= a.length) {
      return 0;
    }
    return a[off] & 0xFF;
  }

  /**
   * Reads an unsigned 16-bit big-endian value.
   *
   * @param a byte array source; may be {@code null}
   * @param off offset of the first byte
   * @return unsigned value or {@code 0} when insufficient bytes remain
   */
  public static int u16be(byte[] a, int off) {
    if (a == null || off < 0 || off + 1 >= a.length) {
      return 0;
    }
    return ((a[off] & 0xFF) << 8) | (a[off + 1] & 0xFF);
  }

  /**
   * Reads an unsigned 32-bit big-endian value widened to {@code long}.
   *
   * @param a byte array source; may be {@code null}
   * @param off offset of the most significant byte
   * @return unsigned value or {@code 0} if out of bounds
   */
  public static long u32be(byte[] a, int off) {
    if (a == null || off < 0 || off + 3 >= a.length) {
      return 0L;
    }
    return ((long) (a[off] & 0xFF) << 24)
        | ((a[off + 1] & 0xFF) << 16)
        | ((a[off + 2] & 0xFF) << 8)
        | (a[off + 3] & 0xFF);
  }

  /**
   * Finds the first occurrence of {@code pattern} at or after {@code from}.
   *
   * @param data haystack; may be {@code null}
   * @param pattern needle; an empty pattern matches at {@code from}
   * @param from first offset to examine
   * @return offset of the match or {@code -1}
   */
  public static int indexOf(byte[] data, byte[] pattern, int from) {
    if (data == null || pattern == null) {
      return -1;
    }
    int start = Math.max(0, from);
    int last = data.length - pattern.length;
    outer:
    for (int i = start; i <= last; i++) {
      for (int j = 0; j < pattern.length; j++) {
        if (data[i + j] != pattern[j]) {
          continue outer;
        }
      }
      return i;
    }
    return -1;
  }

  /**
   * Tests whether {@code data} carries {@code pattern} at {@code offset}.
   *
   * @param data haystack; may be {@code null}
   * @param pattern needle
   * @param offset position to compare at
   * @return {@code true} when every pattern byte matches
   */
  public static boolean startsWith(byte[] data, byte[] pattern, int offset) {
    if (data == null || pattern == null || offset < 0 || offset + pattern.length > data.length) {
      return false;
    }
    for (int j = 0; j < pattern.length; j++) {
      if (data[offset + j] != pattern[j]) {
        return false;
      }
    }
    return true;
  }

  /**
   * Builds a byte array from integer literals, keeping the low eight bits of each.
   *
   * @param values byte values written as ints (e.g. {@code 0xFF})
   * @return new array
   */
  public static byte[] of(int... values) {
    byte[] out = new byte[values.length];
    for (int i = 0; i < values.length; i++) {
      out[i] = (byte) values[i];
    }
    return out;
  }
}
