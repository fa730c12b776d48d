package org.minnen.ftcstanding.tests;

import static org.junit.Assert.*;

import org.junit.Test;
import org.minnen.ftcstanding.lambda.AutoTunedPolicy;
import org.minnen.ftcstanding.lambda.ConstantPolicy;
import org.minnen.ftcstanding.lambda.ContinuousPolicy;
import org.minnen.ftcstanding.lambda.FixedBandPolicy;
import org.minnen.ftcstanding.lambda.LambdaChoice;
import org.minnen.ftcstanding.lambda.LambdaStrategy;
import org.minnen.ftcstanding.lambda.TeamCountPolicy;

public class TestLambdaPolicies
{
  public final static double tol = 1e-12;

  /** One match: teams 1,2 vs. 3,4. */
  private static final double[][] singleMatch = new double[][] { { 1, 1, 0, 0 }, { 0, 0, 1, 1 } };

  /** Every pairing of four teams. */
  private static final double[][] roundRobin  = new double[][] { { 1, 1, 0, 0 }, { 0, 0, 1, 1 }, { 1, 0, 1, 0 },
      { 0, 1, 0, 1 }, { 1, 0, 0, 1 }, { 0, 1, 1, 0 } };

  @Test
  public void testFixedBand()
  {
    FixedBandPolicy policy = new FixedBandPolicy();
    assertEquals(0.1, policy.chooseLambda(0), tol);
    assertEquals(0.1, policy.chooseLambda(19), tol);
    assertEquals(0.01, policy.chooseLambda(20), tol);
    assertEquals(0.01, policy.chooseLambda(60), tol);
    assertEquals(0.001, policy.chooseLambda(61), tol);
    assertEquals(0.001, policy.chooseLambda(500), tol);

    LambdaChoice choice = policy.chooseLambda(10, singleMatch);
    assertEquals(LambdaStrategy.FIXED_BAND, choice.strategy);
    assertTrue(Double.isNaN(choice.condition));
    assertFalse(choice.isIllConditioned());
  }

  @Test
  public void testContinuous()
  {
    ContinuousPolicy policy = new ContinuousPolicy();
    assertEquals(0.3, policy.chooseLambda(1), tol);
    assertEquals(0.1, policy.chooseLambda(25), tol);
    assertEquals(0.05, policy.chooseLambda(100), tol);
    assertEquals(0.001, policy.chooseLambda(1000000), tol);
    assertEquals(0.3, policy.chooseLambda(0), tol);
  }

  @Test
  public void testTeamCount()
  {
    TeamCountPolicy policy = new TeamCountPolicy();
    assertEquals(0.25, policy.chooseLambda(1, singleMatch).lambda, tol);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTeamCountNeedsMatrix()
  {
    new TeamCountPolicy().chooseLambda(10);
  }

  @Test
  public void testConstant()
  {
    assertEquals(0.0, new ConstantPolicy(0.0).chooseLambda(5), tol);
    assertEquals(0.2, new ConstantPolicy(0.2).chooseLambda(5, roundRobin).lambda, tol);
    assertFalse(new ConstantPolicy(0.0).chooseLambda(5, null).isRegularized());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeConstant()
  {
    new ConstantPolicy(-1.0);
  }

  @Test
  public void testAutoTunedWellConditioned()
  {
    LambdaChoice choice = new AutoTunedPolicy().chooseLambda(3, roundRobin);
    assertEquals(0.5 / Math.sqrt(3), choice.lambda, tol);
    assertEquals(1, choice.iterations);
    assertFalse(choice.isIllConditioned());
    assertTrue(choice.condition <= AutoTunedPolicy.DEFAULT_TARGET_CONDITION);
  }

  @Test
  public void testAutoTunedDoubles()
  {
    // cond(A'A + lambda I) = (2 + lambda) / lambda: 7.67 at 0.3, 4.33 at 0.6.
    LambdaChoice choice = new AutoTunedPolicy(5.0, 10.0, 10).chooseLambda(1, singleMatch);
    assertEquals(0.6, choice.lambda, tol);
    assertEquals(2, choice.iterations);
    assertEquals(2.6 / 0.6, choice.condition, 1e-6);
    assertFalse(choice.isIllConditioned());
  }

  @Test
  public void testAutoTunedHitsMaxLambda()
  {
    LambdaChoice choice = new AutoTunedPolicy(1.5, 1.0, 10).chooseLambda(1, singleMatch);
    assertEquals(1.0, choice.lambda, tol);
    assertEquals(3, choice.iterations);
    assertEquals(3.0, choice.condition, 1e-6);
    assertTrue(choice.isIllConditioned());
  }

  @Test
  public void testAutoTunedHitsIterationLimit()
  {
    LambdaChoice choice = new AutoTunedPolicy(1.5, 10.0, 2).chooseLambda(1, singleMatch);
    assertEquals(0.6, choice.lambda, tol);
    assertEquals(2, choice.iterations);
    assertTrue(choice.isIllConditioned());
  }

  @Test
  public void testAutoTunedWithoutMatrix()
  {
    LambdaChoice choice = new AutoTunedPolicy().chooseLambda(100, null);
    assertEquals(0.05, choice.lambda, tol);
    assertEquals(0, choice.iterations);
    assertFalse(choice.isIllConditioned());
  }

  @Test
  public void testParseStrategy()
  {
    assertEquals(LambdaStrategy.AUTO_TUNED, LambdaStrategy.parse("auto-tuned"));
    assertEquals(LambdaStrategy.CONSTANT, LambdaStrategy.parse(" CONSTANT "));
    assertEquals(LambdaStrategy.FIXED_BAND, LambdaStrategy.parse("Fixed_Band"));
    try {
      LambdaStrategy.parse("svd");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("svd"));
    }
  }
}
