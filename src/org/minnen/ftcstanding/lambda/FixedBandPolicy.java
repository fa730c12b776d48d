package org.minnen.ftcstanding.lambda;

/** Lambda from coarse bands on the number of matches. */
public class FixedBandPolicy implements RegularizationPolicy
{
  public static final double SMALL_LAMBDA  = 0.1;
  public static final double MEDIUM_LAMBDA = 0.01;
  public static final double LARGE_LAMBDA  = 0.001;

  public static double bandLambda(int matchCount)
  {
    if (matchCount < 20) {
      return SMALL_LAMBDA;
    } else if (matchCount <= 60) {
      return MEDIUM_LAMBDA;
    } else {
      return LARGE_LAMBDA;
    }
  }

  @Override
  public LambdaChoice chooseLambda(int matchCount, double[][] designMatrix)
  {
    return new LambdaChoice(getStrategy(), bandLambda(matchCount));
  }

  @Override
  public LambdaStrategy getStrategy()
  {
    return LambdaStrategy.FIXED_BAND;
  }
}
