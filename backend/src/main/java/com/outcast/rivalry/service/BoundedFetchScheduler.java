package com.outcast.rivalry.service;

import com.outcast.rivalry.cache.EngineCaches;
import com.outcast.rivalry.cache.TtlCache;
import com.outcast.rivalry.config.RivalryProperties;
import com.outcast.rivalry.model.LeagueHeadToHead;
import com.outcast.rivalry.model.LeagueSummary;
import com.outcast.rivalry.model.PerformanceMetrics;
import com.outcast.rivalry.model.Roster;
import com.outcast.rivalry.source.LeagueDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one batch of league tasks on the fetch pool. A task loads the league's rosters
 * (cache first), finds the account's roster and resolves its head-to-head weeks. A task that
 * throws is counted and dropped; it never fails the batch. Time limits are applied inside the
 * task, per upstream call and per league budget, so time spent queued is not held against it.
 */
@Service
public class BoundedFetchScheduler {

    private static final Logger log = LoggerFactory.getLogger(BoundedFetchScheduler.class);

    public enum LeagueStatus { PROCESSED, SKIPPED, FAILED }

    /** Outcome of one league task; {@code headToHead} is null unless processed. */
    public record LeagueOutcome(LeagueSummary league, LeagueStatus status, LeagueHeadToHead headToHead, String reason) {
        static LeagueOutcome processed(LeagueSummary league, LeagueHeadToHead h2h) {
            return new LeagueOutcome(league, LeagueStatus.PROCESSED, h2h, null);
        }

        static LeagueOutcome skipped(LeagueSummary league, String reason) {
            return new LeagueOutcome(league, LeagueStatus.SKIPPED, null, reason);
        }

        static LeagueOutcome failed(LeagueSummary league, String reason) {
            return new LeagueOutcome(league, LeagueStatus.FAILED, null, reason);
        }
    }

    /** Batch outcomes in submission order. */
    public record BatchOutcome(List<LeagueOutcome> outcomes) {
        public List<LeagueHeadToHead> headToHeads() {
            List<LeagueHeadToHead> list = new ArrayList<>();
            for (LeagueOutcome o : outcomes) {
                if (o.status() == LeagueStatus.PROCESSED) list.add(o.headToHead());
            }
            return list;
        }

        public int count(LeagueStatus status) {
            int n = 0;
            for (LeagueOutcome o : outcomes) {
                if (o.status() == status) n++;
            }
            return n;
        }
    }

    private final LeagueDataSource dataSource;
    private final HeadToHeadResolver resolver;
    private final TtlCache<String, List<Roster>> rosterCache;
    private final Duration rosterTtl;
    private final Clock clock;
    private final Executor executor;

    private final AtomicLong totalCallsMade = new AtomicLong();
    private final AtomicLong totalCallsSaved = new AtomicLong();

    public BoundedFetchScheduler(LeagueDataSource dataSource,
                                 HeadToHeadResolver resolver,
                                 EngineCaches caches,
                                 RivalryProperties properties,
                                 Clock clock,
                                 @Qualifier("rivalryFetchExecutor") Executor executor) {
        this.dataSource = dataSource;
        this.resolver = resolver;
        this.rosterCache = caches.rosters();
        this.rosterTtl = properties.getCache().getRosters();
        this.clock = clock;
        this.executor = executor;
    }

    public BatchOutcome dispatch(List<LeagueSummary> batch, String accountId, String season, PerformanceMetrics metrics) {
        List<CompletableFuture<LeagueOutcome>> futures = new ArrayList<>(batch.size());
        AtomicInteger completed = new AtomicInteger();

        for (LeagueSummary league : batch) {
            Optional<List<Roster>> cached = rosterCache.get(EngineCaches.rosterKey(league.leagueId()), rosterTtl);
            if (cached.isPresent()) {
                metrics.addApiCallsSaved(1);
                totalCallsSaved.incrementAndGet();
            }
            List<Roster> cachedRosters = cached.orElse(null);

            CompletableFuture<LeagueOutcome> future;
            try {
                future = CompletableFuture
                        .supplyAsync(() -> runLeague(league, cachedRosters, accountId, season, metrics), executor)
                        .exceptionally(ex -> failedOutcome(league, ex))
                        .whenComplete((o, ex) -> log.debug("[Fetch][Done] leagueId={} status={} order={}",
                                league.leagueId(), o == null ? "?" : o.status(), completed.incrementAndGet()));
            } catch (RejectedExecutionException e) {
                throw new RivalryUnavailableException("Fetch pool rejected league " + league.leagueId(), e);
            }
            futures.add(future);
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<LeagueOutcome> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<LeagueOutcome> f : futures) {
            LeagueOutcome outcome = f.join();
            outcomes.add(outcome);
            switch (outcome.status()) {
                case PROCESSED -> {
                    LeagueHeadToHead h2h = outcome.headToHead();
                    metrics.recordLeagueProcessed();
                    metrics.addApiCallsMade(h2h.apiCallsMade());
                    metrics.addApiCallsSaved(h2h.apiCallsSaved());
                    totalCallsMade.addAndGet(h2h.apiCallsMade());
                    totalCallsSaved.addAndGet(h2h.apiCallsSaved());
                }
                case SKIPPED -> {
                    metrics.addLeaguesSkipped(1);
                    log.warn("[Fetch][Skip] leagueId={} name='{}' reason={}", outcome.league().leagueId(),
                            outcome.league().leagueName(), outcome.reason());
                }
                case FAILED -> {
                    metrics.recordLeagueFailed();
                    log.warn("[Fetch][Fail] leagueId={} name='{}' reason={}", outcome.league().leagueId(),
                            outcome.league().leagueName(), outcome.reason());
                }
            }
        }
        return new BatchOutcome(outcomes);
    }

    private LeagueOutcome runLeague(LeagueSummary league, List<Roster> cachedRosters, String accountId,
                                    String season, PerformanceMetrics metrics) {
        Instant started = clock.instant();
        List<Roster> rosters = cachedRosters;
        if (rosters == null) {
            metrics.addApiCallsMade(1);
            totalCallsMade.incrementAndGet();
            rosters = dataSource.fetchLeagueRosters(league.leagueId());
            if (rosters != null && !rosters.isEmpty()) {
                rosterCache.set(EngineCaches.rosterKey(league.leagueId()), List.copyOf(rosters));
            }
        }
        if (rosters == null || rosters.isEmpty()) {
            return LeagueOutcome.skipped(league, "no rosters");
        }

        Integer accountRosterId = null;
        for (Roster r : rosters) {
            if (r != null && accountId.equals(r.ownerId())) {
                accountRosterId = r.rosterId();
                break;
            }
        }
        if (accountRosterId == null) {
            return LeagueOutcome.skipped(league, "account not in league");
        }

        return LeagueOutcome.processed(league, resolver.resolve(league.leagueId(), rosters, accountRosterId, season, started));
    }

    private LeagueOutcome failedOutcome(LeagueSummary league, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        return LeagueOutcome.failed(league, cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    public long getTotalCallsMade() {
        return totalCallsMade.get();
    }

    public long getTotalCallsSaved() {
        return totalCallsSaved.get();
    }
}
