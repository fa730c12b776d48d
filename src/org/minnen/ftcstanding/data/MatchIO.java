package org.minnen.ftcstanding.data;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.minnen.ftcstanding.performance.Match;

/**
 * Load match results from CSV files.
 *
 * Each row holds the red teams, the blue teams, then red score, blue score, red penalties, and blue penalties:
 *
 * <pre>
 * red1,red2,blue1,blue2,redScore,blueScore,redPenalties,bluePenalties
 * </pre>
 *
 * The alliance size is inferred from the number of columns. Blank or zero team ids mark an empty slot.
 */
public final class MatchIO
{
  /** Number of non-team columns at the end of each row. */
  public static final int NUM_SCORE_COLUMNS = 4;

  private MatchIO()
  {}

  /** @return event code for the given match file (its base name). */
  public static String getEventCode(File file)
  {
    return FilenameUtils.getBaseName(file.getName());
  }

  public static List<Match> loadMatchesCSV(File file) throws IOException
  {
    if (!file.canRead()) {
      throw new IOException(String.format("Can't read match file (%s)", file.getPath()));
    }
    System.out.printf("Loading match file: [%s]\n", file.getPath());
    return parseMatches(FileUtils.readLines(file, StandardCharsets.UTF_8));
  }

  /** Parse match rows, skipping blank lines, header lines, and rows that don't describe a valid match. */
  public static List<Match> parseMatches(List<String> lines)
  {
    List<Match> matches = new ArrayList<>();
    for (String line : lines) {
      line = line.trim();
      if (line.isEmpty() || line.startsWith("#") || Character.isLetter(line.charAt(0))) {
        continue;
      }
      try {
        Match match = parseMatch(line);
        if (match != null) {
          matches.add(match);
        }
      } catch (IllegalArgumentException e) {
        System.err.printf("Error parsing match data: [%s] (%s)\n", line, e.getMessage());
      }
    }
    return matches;
  }

  /**
   * Parse a single CSV row.
   *
   * @return the match or null if either alliance is empty
   * @throws IllegalArgumentException if the row is malformed
   */
  public static Match parseMatch(String line)
  {
    String[] toks = line.split(",", -1);
    final int nTeamCols = toks.length - NUM_SCORE_COLUMNS;
    if (nTeamCols < 2 || nTeamCols % 2 != 0) {
      throw new IllegalArgumentException(String.format("Unexpected number of columns: %d", toks.length));
    }
    final int allianceSize = nTeamCols / 2;

    int[] red = parseTeams(toks, 0, allianceSize);
    int[] blue = parseTeams(toks, allianceSize, allianceSize);
    if (red.length == 0 || blue.length == 0) {
      return null;
    }

    double redScore = Double.parseDouble(toks[nTeamCols].trim());
    double blueScore = Double.parseDouble(toks[nTeamCols + 1].trim());
    double redPenalties = Double.parseDouble(toks[nTeamCols + 2].trim());
    double bluePenalties = Double.parseDouble(toks[nTeamCols + 3].trim());
    return new Match(red, blue, redScore, blueScore, redPenalties, bluePenalties);
  }

  private static int[] parseTeams(String[] toks, int start, int n)
  {
    List<Integer> teams = new ArrayList<>();
    for (int i = start; i < start + n; ++i) {
      String s = toks[i].trim();
      if (s.isEmpty()) continue;
      int team = Integer.parseInt(s);
      if (team > 0) {
        teams.add(team);
      }
    }
    return teams.stream().mapToInt(Integer::intValue).toArray();
  }
}
