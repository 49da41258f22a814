package com.outcast.rivalry.service;

import com.outcast.rivalry.cache.EngineCaches;
import com.outcast.rivalry.cache.MutableClock;
import com.outcast.rivalry.config.FetchExecutorConfig;
import com.outcast.rivalry.config.RivalryProperties;
import com.outcast.rivalry.model.AccountInfo;
import com.outcast.rivalry.model.LeagueRef;
import com.outcast.rivalry.model.LeagueSummary;
import com.outcast.rivalry.model.Roster;
import com.outcast.rivalry.source.AccountDirectory;
import com.outcast.rivalry.source.LeagueDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ManagerLeagueServiceTest {

    @Mock private AccountDirectory directory;
    @Mock private LeagueDataSource dataSource;

    private RivalryProperties props;
    private EngineCaches caches;
    private ManagerLeagueService service;

    @BeforeEach
    void setUp() {
        props = new RivalryProperties();
        caches = new EngineCaches(props, new MutableClock(Instant.parse("2026-01-15T00:00:00Z")));
        service = new ManagerLeagueService(directory, dataSource, caches, props, Runnable::run);
    }

    @Test
    void summarizesEachLeagueFromTheAccountsRoster() {
        given(directory.findAccount("dana")).willReturn(Optional.of(new AccountInfo("u1", "Dana", "dana")));
        given(directory.fetchLeagues("u1", "2025")).willReturn(List.of(
                new LeagueRef("L1", "Dynasty", 12), new LeagueRef("L2", "Redraft", 10)));
        given(dataSource.fetchLeagueRosters("L1")).willReturn(List.of(
                new Roster(1, "u1", "Mine", 9, 4, 1), new Roster(2, "u2", "Theirs", 4, 9, 1)));
        caches.rosters().set(EngineCaches.rosterKey("L2"), List.of(new Roster(3, "u1", null, 2, 1, 0)));

        ManagerLeagueService.ManagerLeagues result = service.resolve(" dana ", "2025").orElseThrow();

        assertThat(result.account().accountId()).isEqualTo("u1");
        assertThat(result.leagues()).containsExactly(
                new LeagueSummary("L1", "Dynasty", 13),
                new LeagueSummary("L2", "Redraft", 3));
        verify(dataSource, never()).fetchLeagueRosters("L2");
        assertThat(caches.rosters().get(EngineCaches.rosterKey("L1"), Duration.ofHours(1))).isPresent();
    }

    @Test
    void unknownUsername_isEmpty() {
        given(directory.findAccount("ghost")).willReturn(Optional.empty());

        assertThat(service.resolve("ghost", "2025")).isEmpty();
        assertThat(service.resolve(" ", "2025")).isEmpty();
        verify(directory, never()).fetchLeagues(anyString(), anyString());
    }

    @Test
    void rejectedWork_meansUnavailable() {
        ManagerLeagueService rejecting = new ManagerLeagueService(directory, dataSource, caches, props,
                task -> { throw new RejectedExecutionException("full"); });
        given(directory.findAccount("dana")).willReturn(Optional.of(new AccountInfo("u1", "Dana", "dana")));
        given(directory.fetchLeagues("u1", "2025")).willReturn(List.of(new LeagueRef("L1", "Dynasty", 12)));

        assertThatThrownBy(() -> rejecting.resolve("dana", "2025")).isInstanceOf(RivalryUnavailableException.class);
    }

    @Test
    void hundredsOfLeagues_fitThroughTheSharedPool() {
        ThreadPoolTaskExecutor pool = new FetchExecutorConfig().rivalryFetchExecutor(props);
        try {
            ManagerLeagueService pooled = new ManagerLeagueService(directory, dataSource, caches, props, pool);
            List<LeagueRef> refs = new ArrayList<>();
            for (int i = 0; i < 200; i++) refs.add(new LeagueRef("L" + i, "League " + i, 12));
            given(directory.findAccount("dana")).willReturn(Optional.of(new AccountInfo("u1", "Dana", "dana")));
            given(directory.fetchLeagues("u1", "2025")).willReturn(refs);
            given(dataSource.fetchLeagueRosters(anyString())).willAnswer(inv -> {
                Thread.sleep(5);
                return List.of(new Roster(1, "u1", null, 2, 1, 0));
            });

            ManagerLeagueService.ManagerLeagues result = pooled.resolve("dana", "2025").orElseThrow();

            assertThat(result.leagues()).hasSize(200);
            assertThat(result.leagues().get(0).leagueId()).isEqualTo("L0");
            assertThat(result.leagues().get(199).leagueId()).isEqualTo("L199");
            assertThat(result.leagues()).allMatch(l -> l.totalGamesForAccount() == 3);
        } finally {
            pool.shutdown();
        }
    }
}
