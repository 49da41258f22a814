package com.outcast.rivalry.model;

import java.util.Map;

/**
 * Per-league outcome of one fetch task: opponent records keyed by opponent account id plus
 * the remote calls the task made and avoided.
 */
public record LeagueHeadToHead(
        String leagueId,
        Map<String, HeadToHeadRecord> opponents,
        int apiCallsMade,
        int apiCallsSaved
) {
    public LeagueHeadToHead {
        opponents = opponents == null ? Map.of() : Map.copyOf(opponents);
    }

    public static LeagueHeadToHead empty(String leagueId) {
        return new LeagueHeadToHead(leagueId, Map.of(), 0, 0);
    }
}
