package org.minnen.ftcstanding.ranking;

import java.util.EnumMap;
import java.util.Map;

import org.minnen.ftcstanding.performance.Metric;

/** Match-weighted metrics for one team across several events. */
public final class TeamPerformance
{
  public final int                       team;
  public final int                       numMatches;
  public final int                       numEvents;
  public final double                    npAvg;

  private final EnumMap<Metric, Double> metrics;

  public TeamPerformance(int team, int numMatches, int numEvents, Map<Metric, Double> metrics, double npAvg)
  {
    this.team = team;
    this.numMatches = numMatches;
    this.numEvents = numEvents;
    this.npAvg = npAvg;
    this.metrics = new EnumMap<>(Metric.class);
    for (Metric metric : Metric.values()) {
      Double x = metrics.get(metric);
      this.metrics.put(metric, x == null ? Double.NaN : x);
    }
  }

  public double get(Metric metric)
  {
    return metrics.get(metric);
  }

  @Override
  public String toString()
  {
    return String.format("[%d: %d events, %d matches, OPR=%.2f]", team, numEvents, numMatches, get(Metric.OPR));
  }
}
