package com.edareport.analyzer.service.assembly;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/** Locale-independent text for statistics, so identical runs produce identical tables. */
public final class StatisticFormatter {

  public static final String NOT_APPLICABLE = "N/A";

  private static final int SCALE = 6;

  private StatisticFormatter() {}

  public static String format(Double value) {
    if (value == null || value.isNaN()) {
      return NOT_APPLICABLE;
    }
    if (value.isInfinite()) {
      return value > 0 ? "inf" : "-inf";
    }
    String plain =
        BigDecimal.valueOf(value)
            .setScale(SCALE, RoundingMode.HALF_EVEN)
            .stripTrailingZeros()
            .toPlainString();
    return plain.contains(".") ? plain : plain + ".0";
  }

  public static String format(long value) {
    return Long.toString(value);
  }

  public static String formatCoefficient(Double value) {
    if (value == null) {
      return NOT_APPLICABLE;
    }
    return String.format(Locale.ROOT, "%.4f", value);
  }

  public static String percentLabel(double percent) {
    return BigDecimal.valueOf(percent).stripTrailingZeros().toPlainString() + "%";
  }

  public static String share(long count, long total) {
    if (total <= 0) {
      return NOT_APPLICABLE;
    }
    return String.format(Locale.ROOT, "%.1f%%", 100.0 * count / total);
  }
}
