package org.minnen.ftcstanding.lambda;

import org.minnen.ftcstanding.util.Library;

/** Lambda = 0.5 / sqrt(matches), clamped to [0.001, 0.3]. */
public class ContinuousPolicy implements RegularizationPolicy
{
  public static final double SCALE      = 0.5;
  public static final double MIN_LAMBDA = 0.001;
  public static final double MAX_LAMBDA = 0.3;

  public static double continuousLambda(int matchCount)
  {
    if (matchCount <= 0) return MAX_LAMBDA;
    return Library.clamp(SCALE / Math.sqrt(matchCount), MIN_LAMBDA, MAX_LAMBDA);
  }

  @Override
  public LambdaChoice chooseLambda(int matchCount, double[][] designMatrix)
  {
    return new LambdaChoice(getStrategy(), continuousLambda(matchCount));
  }

  @Override
  public LambdaStrategy getStrategy()
  {
    return LambdaStrategy.CONTINUOUS;
  }
}
