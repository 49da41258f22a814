package com.outcast.rivalry.model;

/**
 * A participant's entry in one league. {@code ownerId} is null for an orphaned slot;
 * {@code teamName} is null when the owner never set one.
 */
public record Roster(
        int rosterId,
        String ownerId,
        String teamName,
        int wins,
        int losses,
        int ties
) {
    public Roster(int rosterId, String ownerId, String teamName) {
        this(rosterId, ownerId, teamName, 0, 0, 0);
    }

    public boolean hasOwner() {
        return ownerId != null && !ownerId.isBlank();
    }

    public boolean hasTeamName() {
        return teamName != null && !teamName.isBlank();
    }

    public int decidedGames() {
        return wins + losses;
    }
}
