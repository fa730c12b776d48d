package org.minnen.ftcstanding.tests;

import static org.junit.Assert.*;

import org.junit.Test;
import org.minnen.ftcstanding.performance.Alliance;
import org.minnen.ftcstanding.performance.Match;

public class TestMatch
{
  public final static double tol = 1e-9;

  @Test
  public void testAccessors()
  {
    Match match = new Match(new int[] { 1, 2 }, new int[] { 3, 4 }, 100, 80, 10, 5);
    assertEquals(100.0, match.getScore(Alliance.RED), tol);
    assertEquals(80.0, match.getScore(Alliance.BLUE), tol);
    assertEquals(90.0, match.getNonPenaltyScore(Alliance.RED), tol);
    assertEquals(75.0, match.getNonPenaltyScore(Alliance.BLUE), tol);
    assertEquals(Alliance.RED, match.findAlliance(2));
    assertEquals(Alliance.BLUE, match.findAlliance(3));
    assertNull(match.findAlliance(5));
    assertTrue(match.hasTeam(Alliance.BLUE, 4));
    assertFalse(match.hasTeam(Alliance.RED, 4));
    assertEquals(Alliance.BLUE, Alliance.RED.opponent());
  }

  @Test
  public void testImmutable()
  {
    int[] red = new int[] { 1, 2 };
    Match match = new Match(red, new int[] { 3, 4 }, 10, 20);
    red[0] = 9;
    match.getTeams(Alliance.RED)[1] = 9;
    assertArrayEquals(new int[] { 1, 2 }, match.getTeams(Alliance.RED));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTeamOnBothAlliances()
  {
    new Match(new int[] { 1, 2 }, new int[] { 2, 3 }, 10, 20);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateTeam()
  {
    new Match(new int[] { 1, 1 }, new int[] { 2, 3 }, 10, 20);
  }
}
