package com.outcast.rivalry.model;

/**
 * One roster's line in a week's matchups. Two records of the same week sharing a
 * {@code matchupId} face each other; {@code matchupId} is null when the roster had no game.
 */
public record MatchupRecord(
        int week,
        int rosterId,
        Integer matchupId,
        double points
) {}
