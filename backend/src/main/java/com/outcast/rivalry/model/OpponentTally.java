package com.outcast.rivalry.model;

/**
 * Running record against one opposing account across every league merged so far. Owned by a
 * single aggregation run and only touched from its aggregation thread.
 */
public class OpponentTally {

    private final String opponentId;
    private String displayName;
    private int wins;
    private int losses;

    public OpponentTally(String opponentId, String displayName) {
        this.opponentId = opponentId;
        this.displayName = displayName;
    }

    public void merge(HeadToHeadRecord record) {
        if (record.wins() < 0 || record.losses() < 0) {
            throw new IllegalArgumentException("Negative record for opponent " + opponentId);
        }
        wins += record.wins();
        losses += record.losses();
        if (isPlaceholder(displayName) && !isPlaceholder(record.displayName())) {
            displayName = record.displayName();
        }
    }

    private boolean isPlaceholder(String name) {
        return name == null || name.isBlank() || name.equals(placeholderName(opponentId));
    }

    public static String placeholderName(String accountId) {
        return "User_" + accountId;
    }

    public String getOpponentId() { return opponentId; }
    public String getDisplayName() { return displayName; }
    public int getWins() { return wins; }
    public int getLosses() { return losses; }

    public int getMatchups() {
        return wins + losses;
    }

    @Override
    public String toString() {
        return displayName + " (" + wins + "W-" + losses + "L)";
    }
}
