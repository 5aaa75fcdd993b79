package org.minnen.forecast.util;

import java.util.Arrays;

public final class Library
{
  public final static long   LNAN     = Long.MIN_VALUE;
  public final static double MINV_ABS = 1.0e-9;

  private Library()
  {}

  /** @return copy of `a` with all NaN and infinite values removed */
  public static double[] finite(double[] a)
  {
    return Arrays.stream(a).filter(Double::isFinite).toArray();
  }

  /** @return true if every non-NaN value is exactly zero or one (an empty array is not binary) */
  public static boolean isBinary(double[] a)
  {
    boolean bAny = false;
    for (double x : a) {
      if (Double.isNaN(x)) continue;
      if (x != 0.0 && x != 1.0) return false;
      bAny = true;
    }
    return bAny;
  }

  /** @return true if all finite values in `a` are equal (within MINV_ABS) */
  public static boolean isConstant(double[] a)
  {
    double first = Double.NaN;
    for (double x : a) {
      if (!Double.isFinite(x)) continue;
      if (Double.isNaN(first)) {
        first = x;
      } else if (Math.abs(x - first) > MINV_ABS) {
        return false;
      }
    }
    return true;
  }

  /** @return seconds formatted with two decimals, or "None" for a missing value */
  public static String formatSeconds(Double seconds)
  {
    return seconds == null ? "None" : String.format("%.2fs", seconds);
  }
}
