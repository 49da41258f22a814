package com.outcast.rivalry.cache;

import com.outcast.rivalry.config.RivalryProperties;
import com.outcast.rivalry.model.MatchupRecord;
import com.outcast.rivalry.model.RivalryResult;
import com.outcast.rivalry.model.Roster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The caches one engine instance shares across runs, each with its own read TTL.
 */
@Component
public class EngineCaches {

    private static final Logger log = LoggerFactory.getLogger(EngineCaches.class);

    private final RivalryProperties.CacheTtl ttl;
    private final TtlCache<String, List<Roster>> rosters;
    private final TtlCache<String, List<MatchupRecord>> matchups;
    private final TtlCache<String, String> accountNames;
    private final TtlCache<String, RivalryResult> results;

    public EngineCaches(RivalryProperties properties, Clock clock) {
        this.ttl = properties.getCache();
        this.rosters = new TtlCache<>("rosters", clock);
        this.matchups = new TtlCache<>("matchups", clock);
        this.accountNames = new TtlCache<>("accountNames", clock);
        this.results = new TtlCache<>("results", clock);
    }

    public static String rosterKey(String leagueId) {
        return "rosters_" + leagueId;
    }

    public static String matchupKey(String leagueId, int week) {
        return "matchups_" + leagueId + "_" + week;
    }

    public static String accountNameKey(String accountId) {
        return "user_name_" + accountId;
    }

    public static String resultKey(String accountId, String season) {
        return "rivalry_" + accountId + "_" + season;
    }

    public TtlCache<String, List<Roster>> rosters() { return rosters; }
    public TtlCache<String, List<MatchupRecord>> matchups() { return matchups; }
    public TtlCache<String, String> accountNames() { return accountNames; }
    public TtlCache<String, RivalryResult> results() { return results; }

    public Map<String, Integer> stats() {
        Map<String, Integer> stats = new LinkedHashMap<>();
        stats.put(rosters.getName(), rosters.size());
        stats.put(matchups.getName(), matchups.size());
        stats.put(accountNames.getName(), accountNames.size());
        stats.put(results.getName(), results.size());
        return stats;
    }

    @Scheduled(fixedDelayString = "${rivalry.cache.purge-interval:PT30M}",
            initialDelayString = "${rivalry.cache.purge-interval:PT30M}")
    public void purgeExpired() {
        int purged = rosters.purgeOlderThan(ttl.getRosters())
                + matchups.purgeOlderThan(ttl.getMatchups())
                + accountNames.purgeOlderThan(ttl.getAccountNames())
                + results.purgeOlderThan(ttl.getResult());
        if (purged > 0) {
            log.info("[Cache][Purge] removed={} remaining={}", purged, stats());
        }
    }
}
