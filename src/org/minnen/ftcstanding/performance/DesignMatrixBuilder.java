package org.minnen.ftcstanding.performance;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/** Builds design matrices from a list of matches. */
public final class DesignMatrixBuilder
{
  private DesignMatrixBuilder()
  {}

  /** @return sorted, distinct ids of all teams that appear in the matches */
  public static int[] deriveTeams(List<Match> matches)
  {
    Set<Integer> teams = new TreeSet<>();
    for (Match match : matches) {
      for (Alliance alliance : Alliance.values()) {
        for (int team : match.getTeams(alliance)) {
          teams.add(team);
        }
      }
    }
    return teams.stream().mapToInt(Integer::intValue).toArray();
  }

  /** @return the teams (in the given order) that play in at least one match */
  public static int[] findActiveTeams(List<Match> matches, int[] teams)
  {
    Set<Integer> participating = new LinkedHashSet<>();
    for (Match match : matches) {
      for (Alliance alliance : Alliance.values()) {
        for (int team : match.getTeams(alliance)) {
          participating.add(team);
        }
      }
    }

    Set<Integer> active = new LinkedHashSet<>();
    for (int team : teams) {
      if (participating.contains(team)) {
        active.add(team);
      }
    }
    return active.stream().mapToInt(Integer::intValue).toArray();
  }

  /**
   * Build the design matrix and targets for the given score function.
   *
   * Only teams in `teams` that appear in at least one match get a column. Teams in a match but not in `teams` are
   * dropped from that match's rows.
   *
   * @param matches matches in the order the rows should appear
   * @param teams candidate teams in the desired column order
   * @param scoreFunc computes the target for each alliance
   * @return design matrix with 2 * matches.size() rows
   */
  public static DesignMatrix build(List<Match> matches, int[] teams, ScoreFunction scoreFunc)
  {
    final int[] activeTeams = findActiveTeams(matches, teams);
    Map<Integer, Integer> teamIndex = new HashMap<>();
    for (int i = 0; i < activeTeams.length; ++i) {
      teamIndex.put(activeTeams[i], i);
    }

    final int nRows = 2 * matches.size();
    double[][] a = new double[nRows][activeTeams.length];
    double[] b = new double[nRows];
    int row = 0;
    for (Match match : matches) {
      for (Alliance alliance : Alliance.values()) {
        for (int team : match.getTeams(alliance)) {
          Integer col = teamIndex.get(team);
          if (col != null) {
            a[row][col] = 1.0;
          }
        }
        b[row] = scoreFunc.score(match, alliance);
        ++row;
      }
    }
    assert row == nRows;
    return new DesignMatrix(a, b, activeTeams);
  }

  /** @return participation matrix for the given teams (targets are all zero) */
  public static DesignMatrix buildParticipation(List<Match> matches, int[] teams)
  {
    return build(matches, teams, (m, a) -> 0.0);
  }
}
