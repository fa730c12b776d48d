package org.minnen.ftcstanding;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.minnen.ftcstanding.data.MatchIO;
import org.minnen.ftcstanding.data.StandingConfig;
import org.minnen.ftcstanding.performance.Match;
import org.minnen.ftcstanding.performance.Metric;
import org.minnen.ftcstanding.ranking.EventRanker;
import org.minnen.ftcstanding.ranking.EventRankings;
import org.minnen.ftcstanding.ranking.SeasonAggregator;
import org.minnen.ftcstanding.ranking.TeamPerformance;
import org.minnen.ftcstanding.ranking.TeamRanking;
import org.minnen.ftcstanding.util.Library;

/** Compute team metrics for each match file given on the command line (one file per event). */
public class FtcStanding
{
  public static void main(String[] args) throws IOException, InterruptedException
  {
    if (args.length == 0) {
      System.err.println("Usage: FtcStanding <matches.csv> [<matches.csv> ...]");
      System.exit(1);
    }

    StandingConfig config = StandingConfig.load();
    ExecutorService executor = null;
    if (config.getThreads() > 1) {
      executor = Executors.newFixedThreadPool(config.getThreads());
    }

    try {
      EventRanker ranker = new EventRanker(config.buildPolicy(), executor);
      List<EventRankings> events = new ArrayList<>();
      for (String arg : args) {
        File file = new File(arg);
        List<Match> matches = MatchIO.loadMatchesCSV(file);
        if (matches.isEmpty()) {
          System.out.printf("No valid matches found for event %s\n", MatchIO.getEventCode(file));
          continue;
        }
        EventRankings rankings = ranker.rank(MatchIO.getEventCode(file), matches);
        printEvent(rankings);
        events.add(rankings);
      }

      if (events.size() > 1) {
        printSeason(SeasonAggregator.aggregate(events));
      }
    } finally {
      if (executor != null) {
        executor.shutdown();
      }
    }
  }

  private static void printEvent(EventRankings event)
  {
    System.out.printf("\nEvent: %s  (%d matches, %d teams, lambda=%s)\n", event.eventCode, event.numMatches,
        event.getNumTeams(), event.lambda);
    System.out.println(" Team | Matches |   OPR  |  npOPR |  CCWM  |   DPR  |  npDPR |  npAVG");
    System.out.println("------------------------------------------------------------------------");
    for (TeamRanking r : event.getRankings()) {
      System.out.printf("%5d | %7d | %s | %s | %s | %s | %s | %s\n", r.team, r.numMatches,
          Library.formatMetric(r.getOPR(), 6), Library.formatMetric(r.getNpOPR(), 6),
          Library.formatMetric(r.getCCWM(), 6), Library.formatMetric(r.getDPR(), 6),
          Library.formatMetric(r.getNpDPR(), 6), Library.formatMetric(r.npAvg, 6));
    }
  }

  private static void printSeason(List<TeamPerformance> season)
  {
    System.out.printf("\nSeason (%d teams)\n", season.size());
    System.out.println(" Rank | Team | Events | Matches |   OPR  |  npOPR |  CCWM  |   DPR  |  npDPR |  npAVG");
    System.out.println("---------------------------------------------------------------------------------------");
    int rank = 1;
    for (TeamPerformance p : season) {
      System.out.printf("%5d |%5d | %6d | %7d | %s | %s | %s | %s | %s | %s\n", rank++, p.team, p.numEvents,
          p.numMatches, Library.formatMetric(p.get(Metric.OPR), 6), Library.formatMetric(p.get(Metric.NP_OPR), 6),
          Library.formatMetric(p.get(Metric.CCWM), 6), Library.formatMetric(p.get(Metric.DPR), 6),
          Library.formatMetric(p.get(Metric.NP_DPR), 6), Library.formatMetric(p.npAvg, 6));
    }
  }
}
