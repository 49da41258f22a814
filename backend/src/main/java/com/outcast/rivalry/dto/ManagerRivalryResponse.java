package com.outcast.rivalry.dto;

import com.outcast.rivalry.model.RivalryResult;

public record ManagerRivalryResponse(
        String accountId,
        String displayName,
        String season,
        int totalLeagues,
        RivalryResult rivalries
) {}
