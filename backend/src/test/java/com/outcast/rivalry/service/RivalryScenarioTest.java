package com.outcast.rivalry.service;

import com.outcast.rivalry.cache.EngineCaches;
import com.outcast.rivalry.cache.MutableClock;
import com.outcast.rivalry.config.RivalryProperties;
import com.outcast.rivalry.config.SleeperApiProperties;
import com.outcast.rivalry.model.LeagueSummary;
import com.outcast.rivalry.model.MatchupRecord;
import com.outcast.rivalry.model.Roster;
import com.outcast.rivalry.model.RivalryResult;
import com.outcast.rivalry.source.LeagueDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;

/** Full pipeline over a stubbed data source. */
@ExtendWith(MockitoExtension.class)
class RivalryScenarioTest {

    private static final List<Roster> ROSTERS = List.of(
            new Roster(1, "me", "Mine"), new Roster(2, "x", "X Factor"), new Roster(3, "y", "Yolo"));

    @Mock private LeagueDataSource dataSource;

    private RivalryProperties props;
    private SleeperApiProperties apiProps;
    private EngineCaches caches;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        props = new RivalryProperties();
        apiProps = new SleeperApiProperties();
        caches = new EngineCaches(props, new MutableClock(Instant.parse("2026-01-15T00:00:00Z")));
        pool = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private RivalryAggregator aggregator(Clock clock, Executor executor) {
        HeadToHeadResolver resolver = new HeadToHeadResolver(dataSource, new SeasonCalendar(props, clock),
                new OpponentNameResolver(dataSource, caches, props), caches, props, apiProps, clock);
        BoundedFetchScheduler scheduler =
                new BoundedFetchScheduler(dataSource, resolver, caches, props, clock, executor);
        return new RivalryAggregator(new LeaguePrioritySelector(props), scheduler,
                new EarlyTerminationPolicy(props), caches, props);
    }

    private static List<MatchupRecord> week(int week, double mine, int opponentRoster, double theirs) {
        return List.of(new MatchupRecord(week, 1, 1, mine), new MatchupRecord(week, opponentRoster, 1, theirs));
    }

    @Test
    void opponentWhoWonTwoOfThree_isMostLossesTo() {
        props.getSeason().setCompletedSeasonWeeks(3);
        given(dataSource.fetchLeagueRosters("L1")).willReturn(ROSTERS);
        given(dataSource.fetchLeagueMatchups("L1", 1)).willReturn(week(1, 90, 2, 110));
        given(dataSource.fetchLeagueMatchups("L1", 2)).willReturn(week(2, 85.5, 2, 101));
        given(dataSource.fetchLeagueMatchups("L1", 3)).willReturn(week(3, 130, 2, 99));

        RivalryResult result = aggregator(Clock.systemUTC(), Runnable::run)
                .computeRivalries("me", List.of(new LeagueSummary("L1", "Dynasty", 3)), "2019");

        assertThat(result.mostWinsAgainst()).isNull();
        assertThat(result.mostLossesTo().opponentId()).isEqualTo("x");
        assertThat(result.mostLossesTo().opponentName()).isEqualTo("X Factor");
        assertThat(result.mostLossesTo().wins()).isEqualTo(1);
        assertThat(result.mostLossesTo().losses()).isEqualTo(2);
        assertThat(result.performance().getLeaguesProcessed()).isEqualTo(1);
        assertThat(result.performance().getApiCallsMade()).isEqualTo(4);
        assertThat(result.performance().getBatchesProcessed()).isEqualTo(1);
    }

    @Test
    void weekThatTimesOut_doesNotCostTheOtherWeeks() {
        props.getSeason().setCompletedSeasonWeeks(8);
        // upstream limits scaled down; week 5 below outlasts its call timeout
        apiProps.setCallTimeout(Duration.ofMillis(200));
        apiProps.getRetry().setMaxAttempts(1);
        caches.matchups().set(EngineCaches.matchupKey("L1", 1), week(1, 120, 2, 100));
        caches.matchups().set(EngineCaches.matchupKey("L1", 2), week(2, 110, 3, 90));
        caches.matchups().set(EngineCaches.matchupKey("L1", 3), week(3, 101, 2, 99));
        given(dataSource.fetchLeagueRosters("L1")).willReturn(ROSTERS);
        given(dataSource.fetchLeagueMatchups("L1", 4)).willReturn(week(4, 80, 2, 95));
        given(dataSource.fetchLeagueMatchups("L1", 5)).willAnswer(inv -> {
            // what the data source reports once the call timed out: no data
            Thread.sleep(400);
            return List.of();
        });
        given(dataSource.fetchLeagueMatchups("L1", 6)).willReturn(week(6, 140, 2, 70));
        given(dataSource.fetchLeagueMatchups("L1", 7)).willReturn(week(7, 88, 3, 91));
        given(dataSource.fetchLeagueMatchups("L1", 8)).willReturn(week(8, 77, 3, 104));

        RivalryResult result = aggregator(Clock.systemUTC(), pool)
                .computeRivalries("me", List.of(new LeagueSummary("L1", "Dynasty", 8)), "2019");

        assertThat(result.mostWinsAgainst().opponentId()).isEqualTo("x");
        assertThat(result.mostWinsAgainst().wins()).isEqualTo(3);
        assertThat(result.mostWinsAgainst().losses()).isEqualTo(1);
        assertThat(result.mostLossesTo().opponentId()).isEqualTo("y");
        assertThat(result.mostLossesTo().wins()).isEqualTo(1);
        assertThat(result.mostLossesTo().losses()).isEqualTo(2);
        assertThat(result.performance().getLeaguesProcessed()).isEqualTo(1);
        assertThat(result.performance().getLeaguesFailed()).isZero();
        // roster call plus weeks 4..8; weeks 1..3 came from cache
        assertThat(result.performance().getApiCallsMade()).isEqualTo(6);
        assertThat(result.performance().getApiCallsSaved()).isEqualTo(3);
    }
}
