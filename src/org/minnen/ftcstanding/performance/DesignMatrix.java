package org.minnen.ftcstanding.performance;

import org.apache.commons.lang3.ArrayUtils;

/**
 * Alliance participation matrix and regression targets for one metric.
 *
 * Row 2i holds the red alliance of match i and row 2i+1 the blue alliance. Column j corresponds to
 * `activeTeams[j]`.
 */
public final class DesignMatrix
{
  public final double[][] a;
  public final double[]   b;

  private final int[]     activeTeams;

  public DesignMatrix(double[][] a, double[] b, int[] activeTeams)
  {
    assert a.length == b.length;
    this.a = a;
    this.b = b;
    this.activeTeams = activeTeams.clone();
  }

  public int getNumRows()
  {
    return a.length;
  }

  public int getNumCols()
  {
    return activeTeams.length;
  }

  public int[] getActiveTeams()
  {
    return activeTeams.clone();
  }

  public int getTeam(int col)
  {
    return activeTeams[col];
  }

  /** @return column for the given team or -1 if the team isn't active */
  public int getColumn(int team)
  {
    return ArrayUtils.indexOf(activeTeams, team);
  }

  public boolean isEmpty()
  {
    return a.length == 0 || activeTeams.length == 0;
  }
}
