package org.minnen.ftcstanding.ranking;

import java.util.EnumMap;
import java.util.Map;

import org.minnen.ftcstanding.performance.Metric;

/** Metrics for one team at one event. Metrics that could not be computed are NaN. */
public final class TeamRanking
{
  public final int                       team;
  public final int                       numMatches;
  public final double                    npAvg;

  private final EnumMap<Metric, Double> metrics;

  public TeamRanking(int team, int numMatches, Map<Metric, Double> metrics, double npAvg)
  {
    this.team = team;
    this.numMatches = numMatches;
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

  public double getOPR()
  {
    return get(Metric.OPR);
  }

  public double getNpOPR()
  {
    return get(Metric.NP_OPR);
  }

  public double getDPR()
  {
    return get(Metric.DPR);
  }

  public double getNpDPR()
  {
    return get(Metric.NP_DPR);
  }

  public double getCCWM()
  {
    return get(Metric.CCWM);
  }

  @Override
  public String toString()
  {
    return String.format("[%d: %d matches, OPR=%.2f, CCWM=%.2f, npAVG=%.2f]", team, numMatches, getOPR(), getCCWM(),
        npAvg);
  }
}
