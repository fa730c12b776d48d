package org.minnen.ftcstanding.performance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Team -> value map for one metric, plus a status saying whether the map is meaningful.
 *
 * Only teams that appeared in at least one match are present. The map is empty unless the status is OK.
 */
public final class PerformanceResult
{
  public enum Status
  {
    /** System solved; values are valid. */
    OK,

    /** No matches or no active teams; the solver was never invoked. */
    INSUFFICIENT_DATA,

    /** The (unregularized) normal equations are singular; no unique solution exists. */
    SINGULAR
  }

  public final Metric               metric;
  public final Status               status;
  public final double               lambda;

  private final Map<Integer, Double> values;

  private PerformanceResult(Metric metric, Status status, double lambda, Map<Integer, Double> values)
  {
    this.metric = metric;
    this.status = status;
    this.lambda = lambda;
    this.values = Collections.unmodifiableMap(values);
  }

  public static PerformanceResult solved(Metric metric, double lambda, int[] teams, double[] x)
  {
    assert teams.length == x.length;
    Map<Integer, Double> values = new LinkedHashMap<>();
    for (int i = 0; i < teams.length; ++i) {
      values.put(teams[i], x[i]);
    }
    return new PerformanceResult(metric, Status.OK, lambda, values);
  }

  public static PerformanceResult failed(Metric metric, Status status, double lambda)
  {
    assert status != Status.OK;
    return new PerformanceResult(metric, status, lambda, new LinkedHashMap<>());
  }

  public boolean isOk()
  {
    return status == Status.OK;
  }

  /** @return unmodifiable team -> value map in column order */
  public Map<Integer, Double> getValues()
  {
    return values;
  }

  public boolean contains(int team)
  {
    return values.containsKey(team);
  }

  /** @return value for the given team, or NaN if the team has no value */
  public double get(int team)
  {
    Double x = values.get(team);
    return x == null ? Double.NaN : x;
  }

  public int size()
  {
    return values.size();
  }

  @Override
  public String toString()
  {
    return String.format("[%s: %s, lambda=%g, %d teams]", metric.label, status, lambda, values.size());
  }
}
