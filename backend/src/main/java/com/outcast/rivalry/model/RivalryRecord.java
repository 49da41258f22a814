package com.outcast.rivalry.model;

/** Immutable snapshot of an {@link OpponentTally} selected as a headline rivalry. */
public record RivalryRecord(
        String opponentId,
        String opponentName,
        int wins,
        int losses,
        int matchups,
        double winPercentage
) {
    public static RivalryRecord of(OpponentTally tally) {
        int games = tally.getMatchups();
        double pct = games > 0 ? (double) tally.getWins() / games : 0.0;
        return new RivalryRecord(tally.getOpponentId(), tally.getDisplayName(),
                tally.getWins(), tally.getLosses(), games, pct);
    }
}
