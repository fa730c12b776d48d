package org.minnen.ftcstanding.lambda;

/** Caller-supplied lambda; zero means unregularized least squares. */
public class ConstantPolicy implements RegularizationPolicy
{
  public final double lambda;

  public ConstantPolicy(double lambda)
  {
    if (!(lambda >= 0.0) || Double.isInfinite(lambda)) {
      throw new IllegalArgumentException(String.format("Lambda must be finite and non-negative (%g)", lambda));
    }
    this.lambda = lambda;
  }

  @Override
  public LambdaChoice chooseLambda(int matchCount, double[][] designMatrix)
  {
    return new LambdaChoice(getStrategy(), lambda);
  }

  @Override
  public LambdaStrategy getStrategy()
  {
    return LambdaStrategy.CONSTANT;
  }
}
