package com.outcast.rivalry.service;

import com.outcast.rivalry.config.RivalryProperties;
import com.outcast.rivalry.model.WeekRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Wall-clock week arithmetic for a season. Only completed weeks are handed to the
 * head-to-head resolver; the week in progress would otherwise show partial scores.
 */
@Component
public class SeasonCalendar {

    private static final Logger log = LoggerFactory.getLogger(SeasonCalendar.class);

    private final RivalryProperties.Season season;
    private final Clock clock;

    public SeasonCalendar(RivalryProperties properties, Clock clock) {
        this.season = properties.getSeason();
        this.clock = clock;
    }

    /**
     * Week in progress for the season, 1..maxWeeks. Seasons without a configured start date
     * are considered finished and report {@code maxWeeks}.
     */
    public int currentWeek(String seasonKey) {
        LocalDate start = season.getStartDates().get(seasonKey);
        if (start == null) return season.getMaxWeeks();
        long days = ChronoUnit.DAYS.between(start, LocalDate.now(clock));
        return (int) Math.min(Math.max(1, days / 7 + 1), season.getMaxWeeks());
    }

    public boolean isInProgress(String seasonKey) {
        LocalDate start = season.getStartDates().get(seasonKey);
        if (start == null) return false;
        LocalDate today = LocalDate.now(clock);
        return !today.isBefore(start) && today.isBefore(start.plusWeeks(season.getMaxWeeks()));
    }

    public WeekRange completedWeeks(String seasonKey) {
        LocalDate start = season.getStartDates().get(seasonKey);
        if (start != null && LocalDate.now(clock).isBefore(start)) {
            return WeekRange.none();
        }
        if (isInProgress(seasonKey)) {
            // regular season only, live or finished
            WeekRange range = WeekRange.through(Math.min(currentWeek(seasonKey) - 1, season.getCompletedSeasonWeeks()));
            log.debug("[Season] season={} in progress, completed weeks {}..{}", seasonKey, range.first(), range.last());
            return range;
        }
        return WeekRange.through(season.getCompletedSeasonWeeks());
    }
}
