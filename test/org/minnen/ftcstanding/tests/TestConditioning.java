package org.minnen.ftcstanding.tests;

import static org.junit.Assert.*;

import org.junit.Test;
import org.minnen.ftcstanding.math.Conditioning;
import org.minnen.ftcstanding.math.LinearAlgebra;

public class TestConditioning
{
  public final static double tol = 1e-9;

  @Test
  public void testDiagonal()
  {
    double[][] m = new double[][] { { 4, 0 }, { 0, 1 } };
    assertArrayEquals(new double[] { 4, 1 }, Conditioning.singularValues(m), tol);
    assertEquals(4.0, Conditioning.condition(m), tol);
    assertEquals(1.0, Conditioning.condition(new double[][] { { 3, 0 }, { 0, 3 } }), tol);
  }

  @Test
  public void testEmpty()
  {
    assertTrue(Double.isNaN(Conditioning.condition(new double[0][0])));
    assertEquals(0, Conditioning.singularValues(new double[0][0]).length);
  }

  @Test
  public void testSingular()
  {
    double[][] a = new double[][] { { 1, 1, 0, 0 }, { 0, 0, 1, 1 } };
    assertTrue(Conditioning.condition(LinearAlgebra.normalMatrix(a)) > 1e12);
  }

  @Test
  public void testRidgeNeverIncreasesCondition()
  {
    double[][] a = new double[][] { { 1, 1, 0, 0 }, { 0, 0, 1, 1 }, { 1, 0, 1, 0 } };
    double[] lambdas = new double[] { 0.001, 0.01, 0.1, 1.0, 10.0 };
    double prev = Double.POSITIVE_INFINITY;
    for (double lambda : lambdas) {
      double cond = Conditioning.regularizedCondition(a, lambda);
      assertTrue(cond >= 1.0);
      assertTrue(String.format("lambda=%g: %g > %g", lambda, cond, prev), cond <= prev);
      prev = cond;
    }
  }

  @Test
  public void testRegularizedConditionClosedForm()
  {
    // Eigenvalues of A'A are {2, 2, 0, 0}, so cond(A'A + lambda I) = (2 + lambda) / lambda.
    double[][] a = new double[][] { { 1, 1, 0, 0 }, { 0, 0, 1, 1 } };
    assertEquals(21.0, Conditioning.regularizedCondition(a, 0.1), 1e-6);
    assertEquals(3.0, Conditioning.regularizedCondition(a, 1.0), 1e-6);
  }
}
