package org.minnen.ftcstanding.lambda;

/**
 * Result of a lambda selection: the value itself and, when available, the condition number it achieves.
 */
public final class LambdaChoice
{
  public final LambdaStrategy strategy;
  public final double         lambda;

  /** Condition number of A'A + lambda I, or NaN if the policy did not compute it. */
  public final double         condition;

  /** Number of condition number evaluations (zero for heuristics). */
  public final int            iterations;

  private final boolean       illConditioned;

  public LambdaChoice(LambdaStrategy strategy, double lambda)
  {
    this(strategy, lambda, Double.NaN, 0, false);
  }

  public LambdaChoice(LambdaStrategy strategy, double lambda, double condition, int iterations, boolean illConditioned)
  {
    assert lambda >= 0.0 : lambda;
    this.strategy = strategy;
    this.lambda = lambda;
    this.condition = condition;
    this.iterations = iterations;
    this.illConditioned = illConditioned;
  }

  /**
   * @return true if the auto-tuner gave up (iteration limit or max lambda) before reaching its target condition
   *         number; lambda is still the best effort value
   */
  public boolean isIllConditioned()
  {
    return illConditioned;
  }

  public boolean isRegularized()
  {
    return lambda > 0.0;
  }

  @Override
  public String toString()
  {
    if (Double.isNaN(condition)) {
      return String.format("[%s: lambda=%g]", strategy, lambda);
    }
    return String.format("[%s: lambda=%g, cond=%.3g, iters=%d%s]", strategy, lambda, condition, iterations,
        illConditioned ? ", ill-conditioned" : "");
  }
}
