package com.outcast.rivalry.service;

import com.outcast.rivalry.config.RivalryProperties;
import com.outcast.rivalry.model.WeekRange;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class SeasonCalendarTest {

    private SeasonCalendar calendarAt(String isoInstant) {
        return new SeasonCalendar(new RivalryProperties(), Clock.fixed(Instant.parse(isoInstant), ZoneOffset.UTC));
    }

    @Test
    void midSeason_excludesWeekInProgress() {
        // 2025 kicked off 2025-09-04; 45 days later is week 7
        SeasonCalendar calendar = calendarAt("2025-10-19T18:00:00Z");

        assertThat(calendar.currentWeek("2025")).isEqualTo(7);
        assertThat(calendar.completedWeeks("2025")).isEqualTo(new WeekRange(1, 6));
    }

    @Test
    void openingWeek_hasNoCompletedWeeks() {
        SeasonCalendar calendar = calendarAt("2025-09-06T12:00:00Z");

        assertThat(calendar.currentWeek("2025")).isEqualTo(1);
        assertThat(calendar.completedWeeks("2025").isEmpty()).isTrue();
    }

    @Test
    void beforeKickoff_hasNoCompletedWeeks() {
        SeasonCalendar calendar = calendarAt("2026-08-01T12:00:00Z");
        assertThat(calendar.completedWeeks("2026").weeks()).isEmpty();
    }

    @Test
    void finishedOrUnknownSeason_usesRegularSeasonLength() {
        SeasonCalendar calendar = calendarAt("2026-03-01T12:00:00Z");

        assertThat(calendar.isInProgress("2025")).isFalse();
        assertThat(calendar.completedWeeks("2025")).isEqualTo(WeekRange.through(14));
        assertThat(calendar.completedWeeks("2019")).isEqualTo(WeekRange.through(14));
        assertThat(calendar.currentWeek("2019")).isEqualTo(18);
    }

    @Test
    void lateInProgressSeason_neverCountsPlayoffWeeks() {
        // 2025-12-25 is in week 17 of the 2025 season
        SeasonCalendar calendar = calendarAt("2025-12-25T12:00:00Z");

        assertThat(calendar.isInProgress("2025")).isTrue();
        assertThat(calendar.currentWeek("2025")).isEqualTo(17);
        assertThat(calendar.completedWeeks("2025")).isEqualTo(WeekRange.through(14));
        assertThat(calendarAt("2026-02-01T12:00:00Z").completedWeeks("2025")).isEqualTo(WeekRange.through(14));
    }
}
