package org.minnen.ftcstanding.util;

import java.util.Arrays;

public final class Library
{
  public final static double INF = Double.POSITIVE_INFINITY;

  private Library()
  {}

  /** @return x limited to the range [lo, hi] */
  public static double clamp(double x, double lo, double hi)
  {
    assert lo <= hi;
    return Math.max(lo, Math.min(hi, x));
  }

  /** @return deep copy of the given matrix */
  public static double[][] copy(double[][] m)
  {
    double[][] c = new double[m.length][];
    for (int i = 0; i < m.length; ++i) {
      c[i] = Arrays.copyOf(m[i], m[i].length);
    }
    return c;
  }

  /** @return true if every value in `x` is neither NaN nor infinite. */
  public static boolean isFinite(double[] x)
  {
    for (double v : x) {
      if (!Double.isFinite(v)) return false;
    }
    return true;
  }

  /** @return number of columns in the (rectangular) matrix, or zero for an empty matrix. */
  public static int numCols(double[][] m)
  {
    return m.length == 0 ? 0 : m[0].length;
  }

  /** @return formatted value with NaN shown as a dash. */
  public static String formatMetric(double x, int width)
  {
    if (Double.isNaN(x)) {
      return String.format("%" + width + "s", "-");
    }
    return String.format("%" + width + ".2f", x);
  }
}
