package org.minnen.ftcstanding.ranking;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.minnen.ftcstanding.lambda.LambdaChoice;
import org.minnen.ftcstanding.performance.Metric;
import org.minnen.ftcstanding.performance.PerformanceResult.Status;

/** Team rankings for a single event along with the lambda and solver status used to compute them. */
public final class EventRankings
{
  public final String                    eventCode;
  public final int                       numMatches;
  public final LambdaChoice              lambda;

  private final List<TeamRanking>        rankings;
  private final EnumMap<Metric, Status> status;

  public EventRankings(String eventCode, int numMatches, LambdaChoice lambda, List<TeamRanking> rankings,
      Map<Metric, Status> status)
  {
    this.eventCode = eventCode;
    this.numMatches = numMatches;
    this.lambda = lambda;
    this.rankings = Collections.unmodifiableList(rankings);
    this.status = new EnumMap<>(status);
  }

  /** @return rankings sorted by team id */
  public List<TeamRanking> getRankings()
  {
    return rankings;
  }

  /** @return ranking for the given team or null if the team did not play at this event */
  public TeamRanking getRanking(int team)
  {
    for (TeamRanking ranking : rankings) {
      if (ranking.team == team) return ranking;
    }
    return null;
  }

  public Status getStatus(Metric metric)
  {
    return status.get(metric);
  }

  public int getNumTeams()
  {
    return rankings.size();
  }
}
