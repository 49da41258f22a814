package com.outcast.rivalry.model;

/**
 * One league an account belongs to, as resolved upstream of the rivalry run.
 * {@code totalGamesForAccount} is the account's decided games in that league and drives
 * prioritization.
 */
public record LeagueSummary(
        String leagueId,
        String leagueName,
        int totalGamesForAccount
) {
    public LeagueSummary {
        if (leagueName == null || leagueName.isBlank()) {
            leagueName = "League " + leagueId;
        }
    }
}
