package ca.gc.cra.salvage.domain.decision;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Half-up rounding for percentages written to reports. */
public final class Percentages {
  private Percentages() {}

  public static double round1(double value) {
    return round(value, 1);
  }

  public static double round2(double value) {
    return round(value, 2);
  }

  private static double round(double value, int scale) {
    return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
  }
}
