package io.saasfunnel.analytics.table;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Percentage and rounding helpers shared by the metric engines. */
public final class Ratios {

  private Ratios() {}

  /**
   * Returns {@code numerator / denominator * 100} rounded to two decimals, or {@code sentinel} when
   * the denominator is zero.
   */
  public static double percent(double numerator, double denominator, double sentinel) {
    if (denominator == 0) {
      return sentinel;
    }
    return round2(numerator / denominator * 100);
  }

  /** Rounds half-up to two decimals. */
  public static double round2(double value) {
    return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }

  /** Rounds half-up to two decimals. */
  public static BigDecimal round2(BigDecimal value) {
    return value.setScale(2, RoundingMode.HALF_UP);
  }

  /** Mean of {@code total} over {@code count} values, zero when there are none. */
  public static BigDecimal mean(BigDecimal total, long count) {
    if (count == 0) {
      return BigDecimal.ZERO.setScale(2);
    }
    return total.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP);
  }
}
