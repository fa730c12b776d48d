package org.minnen.ftcstanding.lambda;

/**
 * Strategy for choosing the ridge strength (lambda) used when solving for team metrics.
 */
public interface RegularizationPolicy
{
  /**
   * Choose a regularization strength.
   *
   * @param matchCount number of matches in the data set
   * @param designMatrix participation matrix for all active teams (rows = alliances, cols = teams); may be null for
   *          policies that don't inspect the matrix
   * @return the chosen lambda plus diagnostics
   */
  LambdaChoice chooseLambda(int matchCount, double[][] designMatrix);

  /** @return lambda for the given match count without access to a design matrix */
  default double chooseLambda(int matchCount)
  {
    return chooseLambda(matchCount, null).lambda;
  }

  LambdaStrategy getStrategy();
}
