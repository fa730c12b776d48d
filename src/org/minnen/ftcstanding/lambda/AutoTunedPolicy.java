package org.minnen.ftcstanding.lambda;

import org.minnen.ftcstanding.math.Conditioning;
import org.minnen.ftcstanding.math.LinearAlgebra;
import org.minnen.ftcstanding.util.Library;

/**
 * Find the smallest lambda (by doubling from the continuous heuristic) for which A'A + lambda I reaches a target
 * condition number.
 *
 * The design matrix should be the participation matrix for every active team in the event, so the same lambda is
 * used for every metric.
 */
public class AutoTunedPolicy implements RegularizationPolicy
{
  public static final double DEFAULT_TARGET_CONDITION = 1e7;
  public static final double DEFAULT_MAX_LAMBDA       = 10.0;
  public static final int    DEFAULT_MAX_ITERATIONS   = 10;

  public final double        targetCondition;
  public final double        maxLambda;
  public final int           maxIterations;

  public AutoTunedPolicy()
  {
    this(DEFAULT_TARGET_CONDITION, DEFAULT_MAX_LAMBDA, DEFAULT_MAX_ITERATIONS);
  }

  public AutoTunedPolicy(double targetCondition, double maxLambda, int maxIterations)
  {
    if (!(targetCondition >= 1.0)) {
      throw new IllegalArgumentException(String.format("Target condition must be >= 1 (%g)", targetCondition));
    }
    if (!(maxLambda > 0.0) || Double.isInfinite(maxLambda)) {
      throw new IllegalArgumentException(String.format("Max lambda must be positive and finite (%g)", maxLambda));
    }
    if (maxIterations < 1) {
      throw new IllegalArgumentException(String.format("Need at least one iteration (%d)", maxIterations));
    }
    this.targetCondition = targetCondition;
    this.maxLambda = maxLambda;
    this.maxIterations = maxIterations;
  }

  @Override
  public LambdaChoice chooseLambda(int matchCount, double[][] designMatrix)
  {
    double lambda = Math.min(ContinuousPolicy.continuousLambda(matchCount), maxLambda);
    if (designMatrix == null || designMatrix.length == 0 || Library.numCols(designMatrix) == 0) {
      return new LambdaChoice(getStrategy(), lambda);
    }

    final double[][] ata = LinearAlgebra.normalMatrix(designMatrix);
    double condition = Double.NaN;
    int iter = 0;
    while (iter < maxIterations) {
      double[][] m = Library.copy(ata);
      LinearAlgebra.addRegularization(m, lambda);
      condition = Conditioning.condition(m);
      ++iter;
      if (condition <= targetCondition) {
        return new LambdaChoice(getStrategy(), lambda, condition, iter, false);
      }
      if (lambda >= maxLambda || iter >= maxIterations) break;
      lambda = Math.min(2.0 * lambda, maxLambda);
    }

    System.err.printf("Warning: lambda=%g leaves condition number at %.3g (target=%.3g) after %d iterations\n", lambda,
        condition, targetCondition, iter);
    return new LambdaChoice(getStrategy(), lambda, condition, iter, true);
  }

  @Override
  public LambdaStrategy getStrategy()
  {
    return LambdaStrategy.AUTO_TUNED;
  }
}
