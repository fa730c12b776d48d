package org.minnen.ftcstanding.performance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.minnen.ftcstanding.math.LinearAlgebra;
import org.minnen.ftcstanding.math.SingularSystemException;
import org.minnen.ftcstanding.performance.PerformanceResult.Status;

/**
 * Computes OPR, npOPR, DPR, npDPR, and CCWM by (ridge) least squares over alliance participation, plus the
 * non-penalty average score.
 *
 * A calculator holds only immutable inputs, so every method is a pure function and different metrics may be computed
 * concurrently.
 */
public class PerformanceCalculator
{
  private final List<Match> matches;
  private final int[]       teams;

  /** Ridge strength; zero means unregularized least squares. */
  public final double       lambda;

  /** Create a calculator whose team universe is every team in the given matches. */
  public PerformanceCalculator(List<Match> matches, double lambda)
  {
    this(matches, DesignMatrixBuilder.deriveTeams(matches), lambda);
  }

  public PerformanceCalculator(List<Match> matches, int[] teams, double lambda)
  {
    if (!(lambda >= 0.0) || Double.isInfinite(lambda)) {
      throw new IllegalArgumentException(String.format("Lambda must be finite and non-negative (%g)", lambda));
    }
    this.matches = Collections.unmodifiableList(new ArrayList<>(matches));
    this.teams = teams.clone();
    this.lambda = lambda;
  }

  public List<Match> getMatches()
  {
    return matches;
  }

  public int[] getTeams()
  {
    return teams.clone();
  }

  public PerformanceResult calculateOPR()
  {
    return calculate(Metric.OPR);
  }

  public PerformanceResult calculateNpOPR()
  {
    return calculate(Metric.NP_OPR);
  }

  public PerformanceResult calculateDPR()
  {
    return calculate(Metric.DPR);
  }

  public PerformanceResult calculateNpDPR()
  {
    return calculate(Metric.NP_DPR);
  }

  public PerformanceResult calculateCCWM()
  {
    return calculate(Metric.CCWM);
  }

  /** Build and solve the system for the given metric. */
  public PerformanceResult calculate(Metric metric)
  {
    if (matches.isEmpty()) {
      return PerformanceResult.failed(metric, Status.INSUFFICIENT_DATA, lambda);
    }
    DesignMatrix dm = DesignMatrixBuilder.build(matches, teams, metric.scoreFunc);
    if (dm.isEmpty()) {
      return PerformanceResult.failed(metric, Status.INSUFFICIENT_DATA, lambda);
    }

    try {
      double[] x;
      if (lambda == 0.0) {
        x = LinearAlgebra.solveLeastSquares(dm.a, dm.b);
      } else {
        x = LinearAlgebra.solveLeastSquaresRegularized(dm.a, dm.b, lambda);
      }
      return PerformanceResult.solved(metric, lambda, dm.getActiveTeams(), x);
    } catch (SingularSystemException e) {
      return PerformanceResult.failed(metric, Status.SINGULAR, lambda);
    }
  }

  /** Compute every metric, one after another. */
  public EnumMap<Metric, PerformanceResult> calculateAll()
  {
    EnumMap<Metric, PerformanceResult> results = new EnumMap<>(Metric.class);
    for (Metric metric : Metric.values()) {
      results.put(metric, calculate(metric));
    }
    return results;
  }

  /**
   * Compute every metric with one task per metric on the given executor and wait for all of them.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public EnumMap<Metric, PerformanceResult> calculateAll(ExecutorService executor) throws InterruptedException
  {
    List<Callable<PerformanceResult>> tasks = new ArrayList<>();
    for (Metric metric : Metric.values()) {
      tasks.add(() -> calculate(metric));
    }

    List<Future<PerformanceResult>> futures = executor.invokeAll(tasks);
    EnumMap<Metric, PerformanceResult> results = new EnumMap<>(Metric.class);
    for (Future<PerformanceResult> future : futures) {
      try {
        PerformanceResult result = future.get();
        results.put(result.metric, result);
      } catch (ExecutionException e) {
        throw new RuntimeException("Metric calculation failed", e.getCause());
      }
    }
    return results;
  }

  /** @return mean non-penalty alliance score over this calculator's matches for the given team */
  public double calculateNpAVG(int team)
  {
    return calculateNpAVG(matches, team);
  }

  /**
   * Compute the average non-penalty score (score - penalties) of the alliances the team played on.
   *
   * @return average over the team's appearances, or zero if it never played
   */
  public static double calculateNpAVG(List<Match> matches, int team)
  {
    double total = 0.0;
    int count = 0;
    for (Match match : matches) {
      for (Alliance alliance : Alliance.values()) {
        if (match.hasTeam(alliance, team)) {
          total += match.getNonPenaltyScore(alliance);
          ++count;
        }
      }
    }
    return count == 0 ? 0.0 : total / count;
  }

  /** @return number of matches in which the team played on either alliance */
  public static int countMatches(List<Match> matches, int team)
  {
    int count = 0;
    for (Match match : matches) {
      if (match.findAlliance(team) != null) {
        ++count;
      }
    }
    return count;
  }
}
