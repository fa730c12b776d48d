package org.minnen.ftcstanding.ranking;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.minnen.ftcstanding.performance.Metric;

/**
 * Combines per-event rankings into season totals.
 *
 * Each metric is averaged over a team's events weighted by the number of matches played at each event. Events where a
 * metric is NaN (unsolvable) don't contribute to that metric.
 */
public final class SeasonAggregator
{
  /** Sort by OPR (high to low, NaN last) then team id. */
  public static final Comparator<TeamPerformance> BY_OPR = (a, b) -> {
    double x = a.get(Metric.OPR);
    double y = b.get(Metric.OPR);
    if (Double.isNaN(x) != Double.isNaN(y)) {
      return Double.isNaN(x) ? 1 : -1;
    }
    int c = Double.compare(y, x);
    return c != 0 ? c : Integer.compare(a.team, b.team);
  };

  private SeasonAggregator()
  {}

  public static List<TeamPerformance> aggregate(List<EventRankings> events)
  {
    Map<Integer, List<TeamRanking>> byTeam = new TreeMap<>();
    for (EventRankings event : events) {
      for (TeamRanking ranking : event.getRankings()) {
        byTeam.computeIfAbsent(ranking.team, k -> new ArrayList<>()).add(ranking);
      }
    }

    List<TeamPerformance> results = new ArrayList<>();
    for (Map.Entry<Integer, List<TeamRanking>> entry : byTeam.entrySet()) {
      results.add(combine(entry.getKey(), entry.getValue()));
    }
    results.sort(BY_OPR);
    return results;
  }

  /** Compute match-weighted averages over the given per-event rankings for one team. */
  public static TeamPerformance combine(int team, List<TeamRanking> rankings)
  {
    int totalMatches = 0;
    double npAvgSum = 0.0;
    for (TeamRanking ranking : rankings) {
      assert ranking.team == team;
      totalMatches += ranking.numMatches;
      npAvgSum += ranking.npAvg * ranking.numMatches;
    }

    Map<Metric, Double> metrics = new EnumMap<>(Metric.class);
    for (Metric metric : Metric.values()) {
      double sum = 0.0;
      int weight = 0;
      for (TeamRanking ranking : rankings) {
        double x = ranking.get(metric);
        if (Double.isNaN(x)) continue;
        sum += x * ranking.numMatches;
        weight += ranking.numMatches;
      }
      metrics.put(metric, weight > 0 ? sum / weight : Double.NaN);
    }

    double npAvg = totalMatches > 0 ? npAvgSum / totalMatches : 0.0;
    return new TeamPerformance(team, totalMatches, rankings.size(), metrics, npAvg);
  }
}
