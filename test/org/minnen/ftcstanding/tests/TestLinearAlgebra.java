package org.minnen.ftcstanding.tests;

import static org.junit.Assert.*;

import org.junit.Test;
import org.minnen.ftcstanding.math.LinearAlgebra;
import org.minnen.ftcstanding.math.SingularSystemException;

public class TestLinearAlgebra
{
  public final static double tol = 1e-9;

  @Test
  public void testTranspose()
  {
    double[][] m = new double[][] { { 1, 2, 3 }, { 4, 5, 6 } };
    double[][] t = LinearAlgebra.transpose(m);
    assertEquals(3, t.length);
    assertArrayEquals(new double[] { 1, 4 }, t[0], tol);
    assertArrayEquals(new double[] { 2, 5 }, t[1], tol);
    assertArrayEquals(new double[] { 3, 6 }, t[2], tol);
  }

  @Test
  public void testMultiply()
  {
    double[][] a = new double[][] { { 1, 2 }, { 3, 4 } };
    double[][] b = new double[][] { { 5, 6 }, { 7, 8 } };
    double[][] c = LinearAlgebra.multiply(a, b);
    assertArrayEquals(new double[] { 19, 22 }, c[0], tol);
    assertArrayEquals(new double[] { 43, 50 }, c[1], tol);

    assertArrayEquals(new double[] { 17, 39 }, LinearAlgebra.multiply(a, new double[] { 5, 6 }), tol);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMultiplyMismatch()
  {
    LinearAlgebra.multiply(new double[][] { { 1, 2, 3 } }, new double[][] { { 1, 2 }, { 3, 4 } });
  }

  @Test
  public void testGaussianEliminateNeedsPivot() throws SingularSystemException
  {
    // Zero in the leading position forces a row swap.
    double[][] a = new double[][] { { 0, 2, 1 }, { 1, 1, 1 }, { 2, 1, 0 } };
    double[] b = new double[] { 7, 6, 4 };
    double[] x = LinearAlgebra.gaussianEliminate(a, b);
    assertArrayEquals(new double[] { 1, 2, 3 }, x, tol);
  }

  @Test
  public void testGaussianEliminateSingular()
  {
    double[][] a = new double[][] { { 1, 2 }, { 2, 4 } };
    double[] b = new double[] { 3, 6 };
    try {
      LinearAlgebra.gaussianEliminate(a, b);
      fail("Expected SingularSystemException");
    } catch (SingularSystemException e) {
      assertEquals(1, e.column);
    }
  }

  @Test
  public void testLeastSquares() throws SingularSystemException
  {
    double[][] a = new double[][] { { 1, 0 }, { 1, 1 }, { 1, 2 } };
    double[] b = new double[] { 1, 3, 5 };
    assertArrayEquals(new double[] { 1, 2 }, LinearAlgebra.solveLeastSquares(a, b), tol);

    // Inputs are not modified.
    assertArrayEquals(new double[] { 1, 3, 5 }, b, tol);
    assertArrayEquals(new double[] { 1, 2 }, a[2], tol);
  }

  @Test
  public void testLeastSquaresRegularized() throws SingularSystemException
  {
    double[][] a = new double[][] { { 1 } };
    double[] b = new double[] { 2 };
    assertArrayEquals(new double[] { 1 }, LinearAlgebra.solveLeastSquaresRegularized(a, b, 1.0), tol);
    assertArrayEquals(new double[] { 2 }, LinearAlgebra.solveLeastSquaresRegularized(a, b, 0.0), tol);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeLambda() throws SingularSystemException
  {
    LinearAlgebra.solveLeastSquaresRegularized(new double[][] { { 1 } }, new double[] { 1 }, -0.1);
  }

  @Test
  public void testUnderdetermined()
  {
    // One match, two teams per alliance: two equations and four unknowns.
    double[][] a = new double[][] { { 1, 1, 0, 0 }, { 0, 0, 1, 1 } };
    double[] b = new double[] { 50, 40 };
    try {
      LinearAlgebra.solveLeastSquares(a, b);
      fail("Expected SingularSystemException");
    } catch (SingularSystemException e) {
      assertTrue(e.getMessage().startsWith("Singular"));
    }
  }

  @Test
  public void testUnderdeterminedRegularized() throws SingularSystemException
  {
    double[][] a = new double[][] { { 1, 1, 0, 0 }, { 0, 0, 1, 1 } };
    double[] b = new double[] { 50, 40 };
    double[] x = LinearAlgebra.solveLeastSquaresRegularized(a, b, 0.1);
    assertArrayEquals(new double[] { 50 / 2.1, 50 / 2.1, 40 / 2.1, 40 / 2.1 }, x, tol);
  }

  @Test
  public void testAddRegularization()
  {
    double[][] m = new double[][] { { 1, 2 }, { 3, 4 } };
    LinearAlgebra.addRegularization(m, 0.5);
    assertArrayEquals(new double[] { 1.5, 2 }, m[0], tol);
    assertArrayEquals(new double[] { 3, 4.5 }, m[1], tol);
  }
}
