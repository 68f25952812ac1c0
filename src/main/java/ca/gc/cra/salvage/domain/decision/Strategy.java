package ca.gc.cra.salvage.domain.decision;

import java.util.Locale;

/** Batch-level repair strategy. */
public enum Strategy {
  PERFORM_REPAIR,
  SKIP_REPAIR;

  public String reportName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Strategy fromReportName(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("strategy must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (Strategy strategy : values()) {
      if (strategy.name().equals(normalized)) {
        return strategy;
      }
    }
    throw new IllegalArgumentException("strategy must be perform_repair or skip_repair: " + raw);
  }
}
