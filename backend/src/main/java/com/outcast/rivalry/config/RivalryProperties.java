package com.outcast.rivalry.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Tuning knobs for the rivalry aggregation run.
 *
 * <p>A "fast" profile and a "comprehensive" profile are the same aggregator with different
 * values here (smaller {@code maxLeagues}, looser termination thresholds), not separate code
 * paths.
 */
@ConfigurationProperties(prefix = "rivalry")
public class RivalryProperties {

    /** Leagues dispatched together before the termination check runs. */
    private int batchSize = 6;
    /** Worker pool size, i.e. league fetches in flight at once. */
    private int maxConcurrency = 6;
    /**
     * Working budget of one league task, counted from when the task starts running. Weeks not
     * fetched by then are left out. Zero derives it from the completed weeks and the upstream
     * worst-case call.
     */
    private Duration leagueTimeout = Duration.ZERO;
    /** Cap on prioritized leagues considered per run; 0 means no cap. */
    private int maxLeagues = 0;
    private boolean earlyTerminationEnabled = true;

    private final Termination termination = new Termination();
    private final Selection selection = new Selection();
    private final CacheTtl cache = new CacheTtl();
    private final Season season = new Season();

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public int getMaxConcurrency() { return maxConcurrency; }
    public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

    public Duration getLeagueTimeout() { return leagueTimeout; }
    public void setLeagueTimeout(Duration leagueTimeout) { this.leagueTimeout = leagueTimeout; }

    public int getMaxLeagues() { return maxLeagues; }
    public void setMaxLeagues(int maxLeagues) { this.maxLeagues = maxLeagues; }

    public boolean isEarlyTerminationEnabled() { return earlyTerminationEnabled; }
    public void setEarlyTerminationEnabled(boolean earlyTerminationEnabled) { this.earlyTerminationEnabled = earlyTerminationEnabled; }

    public Termination getTermination() { return termination; }
    public Selection getSelection() { return selection; }
    public CacheTtl getCache() { return cache; }
    public Season getSeason() { return season; }

    /**
     * Confidence thresholds for stopping before every league is resolved. Both the win leader
     * and the loss leader have to clear them in the same check.
     */
    public static class Termination {
        private int minBatches = 2;
        private int minOpponents = 3;
        private int minLeaderMatchups = 7;
        private int minLeaderGap = 2;

        public int getMinBatches() { return minBatches; }
        public void setMinBatches(int minBatches) { this.minBatches = minBatches; }

        public int getMinOpponents() { return minOpponents; }
        public void setMinOpponents(int minOpponents) { this.minOpponents = minOpponents; }

        public int getMinLeaderMatchups() { return minLeaderMatchups; }
        public void setMinLeaderMatchups(int minLeaderMatchups) { this.minLeaderMatchups = minLeaderMatchups; }

        public int getMinLeaderGap() { return minLeaderGap; }
        public void setMinLeaderGap(int minLeaderGap) { this.minLeaderGap = minLeaderGap; }
    }

    /** Minimum-sample floors for leagues entering the run and tallies leaving it. */
    public static class Selection {
        private int minLeagueGames = 2;
        private int minTotalGames = 2;
        private int minWins = 2;
        private int minLosses = 2;

        public int getMinLeagueGames() { return minLeagueGames; }
        public void setMinLeagueGames(int minLeagueGames) { this.minLeagueGames = minLeagueGames; }

        public int getMinTotalGames() { return minTotalGames; }
        public void setMinTotalGames(int minTotalGames) { this.minTotalGames = minTotalGames; }

        public int getMinWins() { return minWins; }
        public void setMinWins(int minWins) { this.minWins = minWins; }

        public int getMinLosses() { return minLosses; }
        public void setMinLosses(int minLosses) { this.minLosses = minLosses; }
    }

    /** Read-time freshness requirements, one per cache. */
    public static class CacheTtl {
        private Duration rosters = Duration.ofHours(24);
        private Duration matchups = Duration.ofHours(24);
        private Duration accountNames = Duration.ofHours(1);
        private Duration result = Duration.ofMinutes(15);
        private Duration purgeInterval = Duration.ofMinutes(30);

        public Duration getRosters() { return rosters; }
        public void setRosters(Duration rosters) { this.rosters = rosters; }

        public Duration getMatchups() { return matchups; }
        public void setMatchups(Duration matchups) { this.matchups = matchups; }

        public Duration getAccountNames() { return accountNames; }
        public void setAccountNames(Duration accountNames) { this.accountNames = accountNames; }

        public Duration getResult() { return result; }
        public void setResult(Duration result) { this.result = result; }

        public Duration getPurgeInterval() { return purgeInterval; }
        public void setPurgeInterval(Duration purgeInterval) { this.purgeInterval = purgeInterval; }
    }

    public static class Season {
        /** Date week 1 kicks off, per season. Seasons missing here are treated as complete. */
        private Map<String, LocalDate> startDates = new HashMap<>(Map.of(
                "2025", LocalDate.of(2025, 9, 4),
                "2026", LocalDate.of(2026, 9, 10)));
        private String defaultSeason = "2026";
        private int maxWeeks = 18;
        private int completedSeasonWeeks = 14;

        public Map<String, LocalDate> getStartDates() { return startDates; }
        public void setStartDates(Map<String, LocalDate> startDates) { this.startDates = startDates; }

        public String getDefaultSeason() { return defaultSeason; }
        public void setDefaultSeason(String defaultSeason) { this.defaultSeason = defaultSeason; }

        public int getMaxWeeks() { return maxWeeks; }
        public void setMaxWeeks(int maxWeeks) { this.maxWeeks = maxWeeks; }

        public int getCompletedSeasonWeeks() { return completedSeasonWeeks; }
        public void setCompletedSeasonWeeks(int completedSeasonWeeks) { this.completedSeasonWeeks = completedSeasonWeeks; }
    }
}
