package com.outcast.rivalry.service;

import com.outcast.rivalry.cache.EngineCaches;
import com.outcast.rivalry.client.RetryPolicy;
import com.outcast.rivalry.cache.TtlCache;
import com.outcast.rivalry.config.RivalryProperties;
import com.outcast.rivalry.config.SleeperApiProperties;
import com.outcast.rivalry.model.HeadToHeadRecord;
import com.outcast.rivalry.model.LeagueHeadToHead;
import com.outcast.rivalry.model.MatchupRecord;
import com.outcast.rivalry.model.Roster;
import com.outcast.rivalry.model.WeekRange;
import com.outcast.rivalry.source.LeagueDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Walks the completed weeks of one league and records, per opposing account, how often the
 * target roster won and lost. Bye weeks (both scores zero) and exact ties count for neither side.
 * A bad week is skipped; it never fails the league.
 *
 * <p>Each league gets a working budget counted from when its task starts. Weeks not yet fetched
 * when the budget runs out are left out; weeks already resolved are kept.
 */
@Service
public class HeadToHeadResolver {

    private static final Logger log = LoggerFactory.getLogger(HeadToHeadResolver.class);

    /** Opponent and outcome of one week, from the target roster's side. */
    record WeekOutcome(String opponentId, int wins, int losses) {}

    private final LeagueDataSource dataSource;
    private final SeasonCalendar calendar;
    private final OpponentNameResolver nameResolver;
    private final TtlCache<String, List<MatchupRecord>> matchupCache;
    private final Duration matchupTtl;
    private final Duration leagueTimeout;
    private final Duration callBudget;
    private final Clock clock;

    public HeadToHeadResolver(LeagueDataSource dataSource,
                              SeasonCalendar calendar,
                              OpponentNameResolver nameResolver,
                              EngineCaches caches,
                              RivalryProperties properties,
                              SleeperApiProperties apiProperties,
                              Clock clock) {
        this.dataSource = dataSource;
        this.calendar = calendar;
        this.nameResolver = nameResolver;
        this.matchupCache = caches.matchups();
        this.matchupTtl = properties.getCache().getMatchups();
        this.leagueTimeout = properties.getLeagueTimeout();
        this.callBudget = RetryPolicy.from(apiProperties.getRetry()).worstCase(apiProperties.getCallTimeout());
        this.clock = clock;
    }

    /**
     * Resolves the season's completed weeks.
     *
     * @param started when the league task began running; the budget counts from here
     */
    public LeagueHeadToHead resolve(String leagueId, List<Roster> rosters, int accountRosterId, String season, Instant started) {
        WeekRange weeks = calendar.completedWeeks(season);
        return resolve(leagueId, rosters, accountRosterId, weeks, started.plus(budgetFor(weeks)));
    }

    /** Configured league timeout, or one worst-case upstream call per week plus the roster call. */
    Duration budgetFor(WeekRange weeks) {
        if (leagueTimeout != null && !leagueTimeout.isZero() && !leagueTimeout.isNegative()) return leagueTimeout;
        return callBudget.multipliedBy(weeks.size() + 1L);
    }

    /** {@code deadline} may be null for no budget. */
    public LeagueHeadToHead resolve(String leagueId, List<Roster> rosters, int accountRosterId, WeekRange weeks, Instant deadline) {
        CallCounter calls = new CallCounter();
        Map<Integer, String> rosterToOwner = new HashMap<>();
        for (Roster r : rosters) {
            if (r != null && r.hasOwner()) rosterToOwner.put(r.rosterId(), r.ownerId());
        }

        Map<String, HeadToHeadRecord> opponents = new LinkedHashMap<>();
        for (int week : weeks.weeks().toArray()) {
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                log.warn("[H2H] leagueId={} budget spent, weeks {}..{} left out", leagueId, week, weeks.last());
                break;
            }
            try {
                List<MatchupRecord> matchups = matchupsFor(leagueId, week, calls);
                Optional<WeekOutcome> outcome = resolveWeek(matchups, accountRosterId, rosterToOwner);
                if (outcome.isEmpty()) continue;

                WeekOutcome o = outcome.get();
                HeadToHeadRecord record = opponents.get(o.opponentId());
                if (record == null) {
                    String name = nameResolver.resolve(o.opponentId(), rosters, calls);
                    record = new HeadToHeadRecord(o.opponentId(), name, 0, 0);
                }
                opponents.put(o.opponentId(), record.plus(o.wins(), o.losses()));
            } catch (RuntimeException e) {
                log.debug("[H2H] leagueId={} week={} skipped: {}", leagueId, week, e.getMessage());
            }
        }

        log.debug("[H2H] leagueId={} weeks={} opponents={} callsMade={} callsSaved={}",
                leagueId, weeks.size(), opponents.size(), calls.made, calls.saved);
        return new LeagueHeadToHead(leagueId, opponents, calls.made, calls.saved);
    }

    private List<MatchupRecord> matchupsFor(String leagueId, int week, CallCounter calls) {
        String key = EngineCaches.matchupKey(leagueId, week);
        Optional<List<MatchupRecord>> cached = matchupCache.get(key, matchupTtl);
        if (cached.isPresent()) {
            calls.saved();
            return cached.get();
        }
        calls.made();
        List<MatchupRecord> fetched = dataSource.fetchLeagueMatchups(leagueId, week);
        if (fetched != null && !fetched.isEmpty()) {
            matchupCache.set(key, List.copyOf(fetched));
            return fetched;
        }
        return List.of();
    }

    /**
     * Pairs the target roster with whoever shares its matchup id that week. Empty when either
     * side is missing, the week is a bye, the opponent's roster has no owner, or the score is tied.
     */
    static Optional<WeekOutcome> resolveWeek(List<MatchupRecord> matchups, int accountRosterId, Map<Integer, String> rosterToOwner) {
        if (matchups == null || matchups.isEmpty()) return Optional.empty();

        MatchupRecord own = null;
        for (MatchupRecord m : matchups) {
            if (m != null && m.rosterId() == accountRosterId) {
                own = m;
                break;
            }
        }
        if (own == null || own.matchupId() == null) return Optional.empty();

        MatchupRecord opponent = null;
        for (MatchupRecord m : matchups) {
            if (m != null && m.rosterId() != accountRosterId && Objects.equals(m.matchupId(), own.matchupId())) {
                opponent = m;
                break;
            }
        }
        if (opponent == null) return Optional.empty();
        if (own.points() == 0.0 && opponent.points() == 0.0) return Optional.empty();

        String opponentId = rosterToOwner.get(opponent.rosterId());
        if (opponentId == null) return Optional.empty();

        int cmp = Double.compare(own.points(), opponent.points());
        if (cmp == 0) return Optional.empty();
        return Optional.of(cmp > 0
                ? new WeekOutcome(opponentId, 1, 0)
                : new WeekOutcome(opponentId, 0, 1));
    }
}
