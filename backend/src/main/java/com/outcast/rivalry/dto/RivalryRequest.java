package com.outcast.rivalry.dto;

import com.outcast.rivalry.model.LeagueSummary;

import java.util.List;

public record RivalryRequest(
        String accountId,
        String season,
        List<LeagueSummary> leagues
) {}
