package org.minnen.ftcstanding.performance;

/** Regression-based team metrics and the alliance target each one regresses. */
public enum Metric
{
  /** Offensive Power Rating: points contributed to the alliance score. */
  OPR("OPR", (m, a) -> m.getScore(a)),

  /** OPR without penalty points. */
  NP_OPR("npOPR", (m, a) -> m.getNonPenaltyScore(a)),

  /** Defensive Power Rating: points allowed to the opposing alliance. */
  DPR("DPR", (m, a) -> m.getScore(a.opponent())),

  /** DPR without penalty points. */
  NP_DPR("npDPR", (m, a) -> m.getNonPenaltyScore(a.opponent())),

  /** Calculated Contribution to Winning Margin. */
  CCWM("CCWM", (m, a) -> m.getScore(a) - m.getScore(a.opponent()));

  public final String        label;
  public final ScoreFunction scoreFunc;

  private Metric(String label, ScoreFunction scoreFunc)
  {
    this.label = label;
    this.scoreFunc = scoreFunc;
  }
}
