package org.minnen.ftcstanding.ranking;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import org.minnen.ftcstanding.lambda.LambdaChoice;
import org.minnen.ftcstanding.lambda.RegularizationPolicy;
import org.minnen.ftcstanding.performance.DesignMatrix;
import org.minnen.ftcstanding.performance.DesignMatrixBuilder;
import org.minnen.ftcstanding.performance.Match;
import org.minnen.ftcstanding.performance.Metric;
import org.minnen.ftcstanding.performance.PerformanceCalculator;
import org.minnen.ftcstanding.performance.PerformanceResult;
import org.minnen.ftcstanding.performance.PerformanceResult.Status;

/**
 * Computes per-team metrics for one event: picks lambda, solves every metric, and adds match counts and npAVG.
 */
public class EventRanker
{
  private final RegularizationPolicy policy;
  private final ExecutorService      executor;

  public EventRanker(RegularizationPolicy policy)
  {
    this(policy, null);
  }

  /**
   * @param policy chooses lambda for each event
   * @param executor if non-null, metrics are computed concurrently on this executor
   */
  public EventRanker(RegularizationPolicy policy, ExecutorService executor)
  {
    this.policy = policy;
    this.executor = executor;
  }

  public RegularizationPolicy getPolicy()
  {
    return policy;
  }

  public EventRankings rank(String eventCode, List<Match> matches) throws InterruptedException
  {
    final int[] teams = DesignMatrixBuilder.deriveTeams(matches);
    DesignMatrix participation = DesignMatrixBuilder.buildParticipation(matches, teams);
    LambdaChoice lambda = policy.chooseLambda(matches.size(), participation.a);
    System.out.printf("Ranking event %s: %d matches, %d teams, lambda=%s\n", eventCode, matches.size(), teams.length,
        lambda);

    PerformanceCalculator calculator = new PerformanceCalculator(matches, teams, lambda.lambda);
    EnumMap<Metric, PerformanceResult> results;
    if (executor == null) {
      results = calculator.calculateAll();
    } else {
      results = calculator.calculateAll(executor);
    }

    Map<Metric, Status> status = new EnumMap<>(Metric.class);
    for (PerformanceResult result : results.values()) {
      status.put(result.metric, result.status);
      if (result.status == Status.SINGULAR) {
        System.err.printf("Warning: %s for event %s is singular (lambda=%g)\n", result.metric.label, eventCode,
            result.lambda);
      }
    }

    List<TeamRanking> rankings = new ArrayList<>();
    for (int team : teams) {
      Map<Metric, Double> metrics = new EnumMap<>(Metric.class);
      for (PerformanceResult result : results.values()) {
        metrics.put(result.metric, result.get(team));
      }
      int numMatches = PerformanceCalculator.countMatches(matches, team);
      double npAvg = calculator.calculateNpAVG(team);
      rankings.add(new TeamRanking(team, numMatches, metrics, npAvg));
    }
    return new EventRankings(eventCode, matches.size(), lambda, rankings, status);
  }
}
