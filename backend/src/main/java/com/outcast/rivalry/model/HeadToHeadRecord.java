package com.outcast.rivalry.model;

/** The account's record against one opponent inside a single league. */
public record HeadToHeadRecord(
        String opponentId,
        String displayName,
        int wins,
        int losses
) {
    public HeadToHeadRecord plus(int addWins, int addLosses) {
        return new HeadToHeadRecord(opponentId, displayName, wins + addWins, losses + addLosses);
    }
}
