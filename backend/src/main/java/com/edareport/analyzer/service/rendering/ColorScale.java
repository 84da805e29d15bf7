package com.edareport.analyzer.service.rendering;

import java.util.Locale;

/** Fixed color scales for charts. */
final class ColorScale {

  private static final int[][] VIRIDIS = {
    {68, 1, 84},
    {72, 40, 120},
    {62, 74, 137},
    {49, 104, 142},
    {38, 130, 142},
    {31, 158, 137},
    {53, 183, 121},
    {109, 205, 89},
    {180, 222, 44},
    {253, 231, 37}
  };

  private static final int[] COOL = {59, 76, 192};
  private static final int[] NEUTRAL = {221, 221, 221};
  private static final int[] WARM = {180, 4, 38};

  private ColorScale() {}

  /** Sequential palette; {@code t} in [0, 1]. */
  static String viridis(double t) {
    double clamped = Math.max(0.0, Math.min(1.0, t));
    double position = clamped * (VIRIDIS.length - 1);
    int lower = (int) Math.floor(position);
    int upper = Math.min(lower + 1, VIRIDIS.length - 1);
    return interpolate(VIRIDIS[lower], VIRIDIS[upper], position - lower);
  }

  /** Diverging blue-grey-red palette centered at zero; {@code value} in [-1, 1]. */
  static String diverging(double value) {
    double clamped = Math.max(-1.0, Math.min(1.0, value));
    if (clamped < 0) {
      return interpolate(NEUTRAL, COOL, -clamped);
    }
    return interpolate(NEUTRAL, WARM, clamped);
  }

  private static String interpolate(int[] from, int[] to, double fraction) {
    int r = (int) Math.round(from[0] + (to[0] - from[0]) * fraction);
    int g = (int) Math.round(from[1] + (to[1] - from[1]) * fraction);
    int b = (int) Math.round(from[2] + (to[2] - from[2]) * fraction);
    return String.format(Locale.ROOT, "#%02x%02x%02x", r, g, b);
  }
}
