package com.outcast.rivalry.service;

import com.outcast.rivalry.cache.EngineCaches;
import com.outcast.rivalry.cache.TtlCache;
import com.outcast.rivalry.config.RivalryProperties;
import com.outcast.rivalry.model.HeadToHeadRecord;
import com.outcast.rivalry.model.LeagueHeadToHead;
import com.outcast.rivalry.model.LeagueSummary;
import com.outcast.rivalry.model.OpponentTally;
import com.outcast.rivalry.model.PerformanceMetrics;
import com.outcast.rivalry.model.RivalryRecord;
import com.outcast.rivalry.model.RivalryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes an account's headline rivalries across its leagues: the opponent it beat most and the
 * opponent that beat it most.
 *
 * <p>Leagues are resolved in priority order, one batch at a time on the fetch pool. After each
 * batch the per-league records are folded into the run's tallies on the calling thread and the
 * {@link EarlyTerminationPolicy} decides whether to keep going. Finished results are cached per
 * account and season.
 */
@Service
public class RivalryAggregator {

    private static final Logger log = LoggerFactory.getLogger(RivalryAggregator.class);

    private final LeaguePrioritySelector selector;
    private final BoundedFetchScheduler scheduler;
    private final EarlyTerminationPolicy terminationPolicy;
    private final TtlCache<String, RivalryResult> resultCache;
    private final RivalryProperties properties;

    public RivalryAggregator(LeaguePrioritySelector selector,
                             BoundedFetchScheduler scheduler,
                             EarlyTerminationPolicy terminationPolicy,
                             EngineCaches caches,
                             RivalryProperties properties) {
        this.selector = selector;
        this.scheduler = scheduler;
        this.terminationPolicy = terminationPolicy;
        this.resultCache = caches.results();
        this.properties = properties;
    }

    /**
     * Blocks until the run finishes. Input problems yield an empty result with zeroed metrics.
     *
     * @throws RivalryUnavailableException when every dispatched league failed or the pool refused work
     */
    public RivalryResult computeRivalries(String accountId, List<LeagueSummary> leagues, String season) {
        PerformanceMetrics metrics = new PerformanceMetrics();
        if (accountId == null || accountId.isBlank() || leagues == null || leagues.isEmpty()) {
            log.warn("[Rivalry][Input] missing account id or leagues (account={}, leagues={})",
                    accountId, leagues == null ? null : leagues.size());
            return RivalryResult.empty(metrics);
        }

        long t0 = System.currentTimeMillis();
        String cacheKey = EngineCaches.resultKey(accountId, season);
        Optional<RivalryResult> cached = resultCache.get(cacheKey, properties.getCache().getResult());
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            metrics.setDurationMs(System.currentTimeMillis() - t0);
            log.info("[Rivalry][CacheHit] account={} season={}", accountId, season);
            return cached.get().withPerformance(metrics);
        }
        metrics.recordCacheMiss();

        LeaguePrioritySelector.PrioritizedLeagues prioritized = selector.prioritize(leagues);
        metrics.addLeaguesSkipped(prioritized.skipped());
        List<LeagueSummary> ordered = prioritized.leagues();

        int batchSize = Math.max(1, properties.getBatchSize());
        int batchCount = (ordered.size() + batchSize - 1) / batchSize;
        log.info("[Rivalry][Start] account={} season={} leagues={} skipped={} batches={} batchSize={}",
                accountId, season, ordered.size(), prioritized.skipped(), batchCount, batchSize);

        Map<String, OpponentTally> tallies = new HashMap<>();
        int dispatched = 0;
        int failed = 0;
        for (int i = 0; i < ordered.size(); i += batchSize) {
            List<LeagueSummary> batch = ordered.subList(i, Math.min(i + batchSize, ordered.size()));
            int batchIndex = i / batchSize + 1;
            long batchStart = System.currentTimeMillis();

            BoundedFetchScheduler.BatchOutcome outcome = scheduler.dispatch(batch, accountId, season, metrics);
            dispatched += batch.size();
            failed += outcome.count(BoundedFetchScheduler.LeagueStatus.FAILED);
            merge(tallies, outcome.headToHeads());
            metrics.recordBatch();

            log.info("[Rivalry][BatchEnd] account={} batch={}/{} processed={} skipped={} failed={} opponents={} ms={}",
                    accountId, batchIndex, batchCount,
                    outcome.count(BoundedFetchScheduler.LeagueStatus.PROCESSED),
                    outcome.count(BoundedFetchScheduler.LeagueStatus.SKIPPED),
                    outcome.count(BoundedFetchScheduler.LeagueStatus.FAILED),
                    tallies.size(), System.currentTimeMillis() - batchStart);

            if (properties.isEarlyTerminationEnabled()
                    && terminationPolicy.shouldTerminate(metrics.getBatchesProcessed(), tallies.values())) {
                metrics.markEarlyTermination();
                log.info("[Rivalry][EarlyStop] account={} after {} leagues, {} left unresolved",
                        accountId, i + batch.size(), ordered.size() - i - batch.size());
                break;
            }
        }

        if (dispatched > 0 && failed == dispatched) {
            throw new RivalryUnavailableException("All " + dispatched + " league fetches failed for account " + accountId);
        }

        RivalryProperties.Selection floors = properties.getSelection();
        RivalryResult result = new RivalryResult(
                mostWinsAgainst(tallies.values(), floors).map(RivalryRecord::of).orElse(null),
                mostLossesTo(tallies.values(), floors).map(RivalryRecord::of).orElse(null),
                metrics);
        metrics.setDurationMs(System.currentTimeMillis() - t0);
        resultCache.set(cacheKey, result);

        log.info("[Rivalry][Done] account={} opponents={} mostWinsAgainst={} mostLossesTo={} metrics={}",
                accountId, tallies.size(), result.mostWinsAgainst(), result.mostLossesTo(), metrics);
        return result;
    }

    /** Adds each league's records onto the run tallies. Order of leagues does not change the counts. */
    static void merge(Map<String, OpponentTally> tallies, List<LeagueHeadToHead> leagues) {
        for (LeagueHeadToHead league : leagues) {
            for (HeadToHeadRecord record : league.opponents().values()) {
                tallies.computeIfAbsent(record.opponentId(), id -> new OpponentTally(id, record.displayName()))
                        .merge(record);
            }
        }
    }

    static Optional<OpponentTally> mostWinsAgainst(Collection<OpponentTally> tallies, RivalryProperties.Selection floors) {
        return tallies.stream()
                .filter(t -> t.getMatchups() >= floors.getMinTotalGames() && t.getWins() >= floors.getMinWins())
                .min(EarlyTerminationPolicy.BY_WINS);
    }

    static Optional<OpponentTally> mostLossesTo(Collection<OpponentTally> tallies, RivalryProperties.Selection floors) {
        return tallies.stream()
                .filter(t -> t.getMatchups() >= floors.getMinTotalGames() && t.getLosses() >= floors.getMinLosses())
                .min(EarlyTerminationPolicy.BY_LOSSES);
    }
}
