package org.minnen.ftcstanding.math;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.minnen.ftcstanding.util.Library;

/** Condition number analysis based on the singular value decomposition. */
public final class Conditioning
{
  private Conditioning()
  {}

  /** @return singular values of `m` in non-increasing order */
  public static double[] singularValues(double[][] m)
  {
    if (m.length == 0 || Library.numCols(m) == 0) {
      return new double[0];
    }
    RealMatrix rm = MatrixUtils.createRealMatrix(m);
    return new SingularValueDecomposition(rm).getSingularValues();
  }

  /**
   * Compute the 2-norm condition number sigma_max / sigma_min.
   *
   * @return condition number, infinity if the smallest singular value is zero, or NaN for an empty matrix
   */
  public static double condition(double[][] m)
  {
    double[] s = singularValues(m);
    if (s.length == 0) return Double.NaN;
    final double smax = s[0];
    final double smin = s[s.length - 1];
    if (smin <= 0.0) return Library.INF;
    return smax / smin;
  }

  /** @return condition number of A'A + lambda I for the design matrix `a` */
  public static double regularizedCondition(double[][] a, double lambda)
  {
    double[][] ata = LinearAlgebra.normalMatrix(a);
    LinearAlgebra.addRegularization(ata, lambda);
    return condition(ata);
  }
}
