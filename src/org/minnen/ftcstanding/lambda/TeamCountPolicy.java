package org.minnen.ftcstanding.lambda;

import org.minnen.ftcstanding.util.Library;

/** Lambda = 1 / (number of teams), where the team count is the number of design matrix columns. */
public class TeamCountPolicy implements RegularizationPolicy
{
  @Override
  public LambdaChoice chooseLambda(int matchCount, double[][] designMatrix)
  {
    if (designMatrix == null) {
      throw new IllegalArgumentException("Team-count lambda requires a design matrix");
    }
    final int nTeams = Library.numCols(designMatrix);
    return new LambdaChoice(getStrategy(), nTeams > 0 ? 1.0 / nTeams : ContinuousPolicy.MAX_LAMBDA);
  }

  @Override
  public LambdaStrategy getStrategy()
  {
    return LambdaStrategy.TEAM_COUNT;
  }
}
