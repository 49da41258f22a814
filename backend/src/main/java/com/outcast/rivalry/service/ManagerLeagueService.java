package com.outcast.rivalry.service;

import com.outcast.rivalry.cache.EngineCaches;
import com.outcast.rivalry.cache.TtlCache;
import com.outcast.rivalry.config.RivalryProperties;
import com.outcast.rivalry.model.AccountInfo;
import com.outcast.rivalry.model.LeagueRef;
import com.outcast.rivalry.model.LeagueSummary;
import com.outcast.rivalry.model.Roster;
import com.outcast.rivalry.source.AccountDirectory;
import com.outcast.rivalry.source.LeagueDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Resolves a username to its account and the league summaries a rivalry run starts from. The
 * account's games per league come from its roster record; rosters fetched here warm the same
 * cache the rivalry run reads.
 */
@Service
public class ManagerLeagueService {

    private static final Logger log = LoggerFactory.getLogger(ManagerLeagueService.class);

    public record ManagerLeagues(AccountInfo account, String season, List<LeagueSummary> leagues) {}

    private final AccountDirectory directory;
    private final LeagueDataSource dataSource;
    private final TtlCache<String, List<Roster>> rosterCache;
    private final Duration rosterTtl;
    private final Executor executor;
    private final int waveSize;

    public ManagerLeagueService(AccountDirectory directory,
                                LeagueDataSource dataSource,
                                EngineCaches caches,
                                RivalryProperties properties,
                                @Qualifier("rivalryFetchExecutor") Executor executor) {
        this.directory = directory;
        this.dataSource = dataSource;
        this.rosterCache = caches.rosters();
        this.rosterTtl = properties.getCache().getRosters();
        this.executor = executor;
        this.waveSize = Math.max(1, properties.getBatchSize());
    }

    public Optional<ManagerLeagues> resolve(String username, String season) {
        if (username == null || username.isBlank()) return Optional.empty();
        Optional<AccountInfo> account = directory.findAccount(username.trim());
        if (account.isEmpty()) {
            log.info("[Manager] username={} not found", username);
            return Optional.empty();
        }
        String accountId = account.get().accountId();
        List<LeagueRef> refs = directory.fetchLeagues(accountId, season);
        log.info("[Manager] username={} accountId={} season={} leagues={}", username, accountId, season, refs.size());

        // waves of batchSize keep at most one batch of summaries queued on the shared pool
        List<LeagueSummary> summaries = new ArrayList<>(refs.size());
        int waveCount = (refs.size() + waveSize - 1) / waveSize;
        for (int i = 0; i < refs.size(); i += waveSize) {
            List<LeagueRef> wave = refs.subList(i, Math.min(i + waveSize, refs.size()));
            List<CompletableFuture<LeagueSummary>> futures = new ArrayList<>(wave.size());
            try {
                for (LeagueRef ref : wave) {
                    futures.add(CompletableFuture.supplyAsync(() -> summarize(ref, accountId), executor));
                }
            } catch (RejectedExecutionException e) {
                throw new RivalryUnavailableException("Fetch pool rejected league summaries for " + username, e);
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            for (CompletableFuture<LeagueSummary> f : futures) {
                summaries.add(f.join());
            }
            log.debug("[Manager][WaveEnd] username={} wave={}/{} summarized={}",
                    username, i / waveSize + 1, waveCount, summaries.size());
        }
        return Optional.of(new ManagerLeagues(account.get(), season, summaries));
    }

    private LeagueSummary summarize(LeagueRef ref, String accountId) {
        String key = EngineCaches.rosterKey(ref.leagueId());
        List<Roster> rosters = rosterCache.get(key, rosterTtl).orElse(null);
        if (rosters == null) {
            rosters = dataSource.fetchLeagueRosters(ref.leagueId());
            if (!rosters.isEmpty()) rosterCache.set(key, List.copyOf(rosters));
        }
        int games = 0;
        for (Roster r : rosters) {
            if (r != null && accountId.equals(r.ownerId())) {
                games = r.decidedGames();
                break;
            }
        }
        return new LeagueSummary(ref.leagueId(), ref.name(), games);
    }
}
