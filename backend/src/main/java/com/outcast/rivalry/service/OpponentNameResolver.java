package com.outcast.rivalry.service;

import com.outcast.rivalry.cache.EngineCaches;
import com.outcast.rivalry.cache.TtlCache;
import com.outcast.rivalry.config.RivalryProperties;
import com.outcast.rivalry.model.AccountInfo;
import com.outcast.rivalry.model.OpponentTally;
import com.outcast.rivalry.model.Roster;
import com.outcast.rivalry.source.LeagueDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Display name for an opponent: the team name on their roster, else the cached account name,
 * else a remote account lookup, else {@code User_<id>}.
 */
@Component
public class OpponentNameResolver {

    private static final Logger log = LoggerFactory.getLogger(OpponentNameResolver.class);

    private final LeagueDataSource dataSource;
    private final TtlCache<String, String> names;
    private final Duration ttl;

    public OpponentNameResolver(LeagueDataSource dataSource, EngineCaches caches, RivalryProperties properties) {
        this.dataSource = dataSource;
        this.names = caches.accountNames();
        this.ttl = properties.getCache().getAccountNames();
    }

    String resolve(String accountId, List<Roster> rosters, CallCounter calls) {
        for (Roster roster : rosters) {
            if (roster != null && accountId.equals(roster.ownerId()) && roster.hasTeamName()) {
                return roster.teamName();
            }
        }

        String key = EngineCaches.accountNameKey(accountId);
        Optional<String> cached = names.get(key, ttl);
        if (cached.isPresent()) {
            calls.saved();
            return cached.get();
        }

        calls.made();
        String name = dataSource.fetchAccountInfo(accountId)
                .map(AccountInfo::preferredName)
                .orElse(null);
        if (name == null) {
            log.debug("[Names] no account name for {}, using placeholder", accountId);
            name = OpponentTally.placeholderName(accountId);
        }
        names.set(key, name);
        return name;
    }
}
