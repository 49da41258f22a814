package com.outcast.rivalry.cache;

import com.outcast.rivalry.config.RivalryProperties;
import com.outcast.rivalry.model.Roster;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EngineCachesTest {

    @Test
    void purge_dropsOnlyEntriesPastTheirOwnTtl() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-15T00:00:00Z"));
        EngineCaches caches = new EngineCaches(new RivalryProperties(), clock);
        caches.rosters().set(EngineCaches.rosterKey("L1"), List.of(new Roster(1, "u1", null)));
        caches.accountNames().set(EngineCaches.accountNameKey("u1"), "Dana");

        clock.advance(Duration.ofHours(2));
        caches.purgeExpired();

        assertThat(caches.stats()).containsEntry("rosters", 1).containsEntry("accountNames", 0);
    }

    @Test
    void keys_areNamespacedPerKind() {
        assertThat(EngineCaches.matchupKey("L1", 3)).isEqualTo("matchups_L1_3");
        assertThat(EngineCaches.resultKey("u1", "2025")).isEqualTo("rivalry_u1_2025");
        assertThat(EngineCaches.rosterKey("L1")).isNotEqualTo(EngineCaches.accountNameKey("L1"));
    }
}
