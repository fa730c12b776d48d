package org.minnen.ftcstanding.math;

import org.minnen.ftcstanding.util.Library;

/**
 * Dense matrix routines and a Gauss-Jordan solver for the (regularized) normal equations.
 *
 * Matrices are row-major `double[rows][cols]` arrays. Nothing here special-cases sparsity since the systems built
 * from one event or season have at most a few hundred unknowns.
 */
public final class LinearAlgebra
{
  /** Pivots with smaller magnitude mean the system is singular. */
  public static final double PIVOT_EPSILON = 1e-14;

  private LinearAlgebra()
  {}

  public static double[][] transpose(double[][] m)
  {
    final int rows = m.length;
    final int cols = Library.numCols(m);
    double[][] t = new double[cols][rows];
    for (int i = 0; i < rows; ++i) {
      for (int j = 0; j < cols; ++j) {
        t[j][i] = m[i][j];
      }
    }
    return t;
  }

  public static double[][] multiply(double[][] a, double[][] b)
  {
    final int n = Library.numCols(a);
    if (n != b.length) {
      throw new IllegalArgumentException(String.format("Dimension mismatch: %dx%d * %dx%d", a.length, n, b.length,
          Library.numCols(b)));
    }
    final int cols = Library.numCols(b);
    double[][] c = new double[a.length][cols];
    for (int i = 0; i < a.length; ++i) {
      for (int k = 0; k < n; ++k) {
        final double aik = a[i][k];
        if (aik == 0.0) continue;
        for (int j = 0; j < cols; ++j) {
          c[i][j] += aik * b[k][j];
        }
      }
    }
    return c;
  }

  public static double[] multiply(double[][] a, double[] x)
  {
    if (Library.numCols(a) != x.length && a.length > 0) {
      throw new IllegalArgumentException(String.format("Dimension mismatch: %dx%d * %d", a.length, Library.numCols(a),
          x.length));
    }
    double[] y = new double[a.length];
    for (int i = 0; i < a.length; ++i) {
      double sum = 0.0;
      for (int j = 0; j < x.length; ++j) {
        sum += a[i][j] * x[j];
      }
      y[i] = sum;
    }
    return y;
  }

  /** Add `lambda` to each diagonal entry of the square matrix `m` (in place). */
  public static void addRegularization(double[][] m, double lambda)
  {
    for (int i = 0; i < m.length; ++i) {
      m[i][i] += lambda;
    }
  }

  /** @return the Gram matrix A'A for the design matrix `a` */
  public static double[][] normalMatrix(double[][] a)
  {
    return multiply(transpose(a), a);
  }

  /**
   * Solve Ax = b with Gauss-Jordan elimination and partial pivoting.
   *
   * Both `a` and `b` are overwritten: on return `a` holds the identity and `b` holds the solution.
   *
   * @param a square coefficient matrix
   * @param b right-hand side with one entry per row of `a`
   * @return the solution vector (the same array as `b`)
   * @throws SingularSystemException if the largest available pivot is below {@link #PIVOT_EPSILON} or the solution is
   *           not finite
   */
  public static double[] gaussianEliminate(double[][] a, double[] b) throws SingularSystemException
  {
    final int n = b.length;
    if (a.length != n || Library.numCols(a) != n) {
      throw new IllegalArgumentException(String.format("Expected %dx%d matrix, not %dx%d", n, n, a.length,
          Library.numCols(a)));
    }

    for (int i = 0; i < n; ++i) {
      // Find the row with the largest magnitude in column i.
      int maxRow = i;
      for (int k = i + 1; k < n; ++k) {
        if (Math.abs(a[k][i]) > Math.abs(a[maxRow][i])) {
          maxRow = k;
        }
      }

      if (maxRow != i) {
        double[] rowTmp = a[i];
        a[i] = a[maxRow];
        a[maxRow] = rowTmp;
        double bTmp = b[i];
        b[i] = b[maxRow];
        b[maxRow] = bTmp;
      }

      final double pivot = a[i][i];
      if (!(Math.abs(pivot) >= PIVOT_EPSILON)) {
        throw new SingularSystemException(i, String.format("Singular system: pivot %g in column %d of %d", pivot, i, n));
      }

      for (int j = i; j < n; ++j) {
        a[i][j] /= pivot;
      }
      b[i] /= pivot;

      for (int k = 0; k < n; ++k) {
        if (k == i) continue;
        final double factor = a[k][i];
        if (factor == 0.0) continue;
        for (int j = i; j < n; ++j) {
          a[k][j] -= factor * a[i][j];
        }
        b[k] -= factor * b[i];
      }
    }

    if (!Library.isFinite(b)) {
      throw new SingularSystemException(-1, "Solution contains non-finite values");
    }
    return b;
  }

  /**
   * Solve the least-squares problem min ||Ax - b||^2 via the normal equations A'Ax = A'b.
   *
   * @throws SingularSystemException if A'A is singular (e.g., fewer independent rows than columns)
   */
  public static double[] solveLeastSquares(double[][] a, double[] b) throws SingularSystemException
  {
    return solveNormalEquations(a, b, 0.0);
  }

  /**
   * Solve the ridge regression problem min ||Ax - b||^2 + lambda ||x||^2 via (A'A + lambda I)x = A'b.
   *
   * @param lambda non-negative regularization strength
   * @throws SingularSystemException only if the regularized system is still numerically singular
   */
  public static double[] solveLeastSquaresRegularized(double[][] a, double[] b, double lambda)
      throws SingularSystemException
  {
    if (!(lambda >= 0.0) || Double.isInfinite(lambda)) {
      throw new IllegalArgumentException(String.format("Regularization must be finite and non-negative (%g)", lambda));
    }
    return solveNormalEquations(a, b, lambda);
  }

  private static double[] solveNormalEquations(double[][] a, double[] b, double lambda)
      throws SingularSystemException
  {
    if (a.length != b.length) {
      throw new IllegalArgumentException(String.format("Matrix has %d rows but target has %d", a.length, b.length));
    }
    double[][] at = transpose(a);
    double[][] ata = multiply(at, a);
    if (lambda > 0.0) {
      addRegularization(ata, lambda);
    }
    double[] atb = multiply(at, b);
    return gaussianEliminate(ata, atb);
  }
}
