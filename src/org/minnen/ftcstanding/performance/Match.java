package org.minnen.ftcstanding.performance;

import java.util.Arrays;

import org.apache.commons.lang3.ArrayUtils;

/**
 * Result of a single match between a red and a blue alliance.
 *
 * Penalties are the foul points awarded to an alliance (committed by its opponent), so the non-penalty score of an
 * alliance is its score minus its penalties.
 */
public final class Match
{
  private final int[] redTeams;
  private final int[] blueTeams;

  public final double redScore;
  public final double blueScore;
  public final double redPenalties;
  public final double bluePenalties;

  public Match(int[] redTeams, int[] blueTeams, double redScore, double blueScore)
  {
    this(redTeams, blueTeams, redScore, blueScore, 0.0, 0.0);
  }

  public Match(int[] redTeams, int[] blueTeams, double redScore, double blueScore, double redPenalties,
      double bluePenalties)
  {
    checkAlliance(redTeams, "red");
    checkAlliance(blueTeams, "blue");
    for (int team : redTeams) {
      if (ArrayUtils.contains(blueTeams, team)) {
        throw new IllegalArgumentException(String.format("Team %d is on both alliances (red=%s, blue=%s)", team,
            Arrays.toString(redTeams), Arrays.toString(blueTeams)));
      }
    }

    this.redTeams = redTeams.clone();
    this.blueTeams = blueTeams.clone();
    this.redScore = redScore;
    this.blueScore = blueScore;
    this.redPenalties = redPenalties;
    this.bluePenalties = bluePenalties;
  }

  private static void checkAlliance(int[] teams, String name)
  {
    if (teams == null) {
      throw new IllegalArgumentException(String.format("Missing %s alliance", name));
    }
    for (int i = 1; i < teams.length; ++i) {
      if (ArrayUtils.indexOf(teams, teams[i]) != i) {
        throw new IllegalArgumentException(String.format("Team %d listed twice in %s alliance", teams[i], name));
      }
    }
  }

  public int[] getTeams(Alliance alliance)
  {
    return (alliance == Alliance.RED ? redTeams : blueTeams).clone();
  }

  public double getScore(Alliance alliance)
  {
    return alliance == Alliance.RED ? redScore : blueScore;
  }

  public double getPenalties(Alliance alliance)
  {
    return alliance == Alliance.RED ? redPenalties : bluePenalties;
  }

  /** @return score minus penalty points for the given alliance */
  public double getNonPenaltyScore(Alliance alliance)
  {
    return getScore(alliance) - getPenalties(alliance);
  }

  public boolean hasTeam(Alliance alliance, int team)
  {
    return ArrayUtils.contains(alliance == Alliance.RED ? redTeams : blueTeams, team);
  }

  /** @return alliance containing the team, or null if the team did not play in this match */
  public Alliance findAlliance(int team)
  {
    if (ArrayUtils.contains(redTeams, team)) return Alliance.RED;
    if (ArrayUtils.contains(blueTeams, team)) return Alliance.BLUE;
    return null;
  }

  @Override
  public String toString()
  {
    return String.format("[%s %.0f (%.0f) vs. %s %.0f (%.0f)]", Arrays.toString(redTeams), redScore, redPenalties,
        Arrays.toString(blueTeams), blueScore, bluePenalties);
  }
}
