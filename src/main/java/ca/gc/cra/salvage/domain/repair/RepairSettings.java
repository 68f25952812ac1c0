package ca.gc.cra.salvage.domain.repair;

/**
 * Tunables for the {@link RepairEngine}.
 *
 * @param headerSearchWindow how far into the stream a start marker may sit for header reconstruction to simply
 *     discard the bytes before it
 * @since 0.1.0
 */
public record RepairSettings(int headerSearchWindow) {
  public static final int DEFAULT_HEADER_SEARCH_WINDOW = 65_536;

  public RepairSettings {
    if (headerSearchWindow < 0) {
      throw new IllegalArgumentException("headerSearchWindow must be non-negative");
    }
  }

  public static RepairSettings defaults() {
    return new RepairSettings(DEFAULT_HEADER_SEARCH_WINDOW);
  }
}
