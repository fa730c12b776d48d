package org.minnen.ftcstanding.performance;

/** Selects the quantity regressed for one alliance of a match. */
@FunctionalInterface
public interface ScoreFunction
{
  double score(Match match, Alliance alliance);
}
