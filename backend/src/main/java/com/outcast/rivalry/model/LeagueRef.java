package com.outcast.rivalry.model;

/** A league as listed for an account, before the account's record in it is known. */
public record LeagueRef(
        String leagueId,
        String name,
        int totalRosters
) {}
