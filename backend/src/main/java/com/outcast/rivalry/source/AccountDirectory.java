package com.outcast.rivalry.source;

import com.outcast.rivalry.model.AccountInfo;
import com.outcast.rivalry.model.LeagueRef;

import java.util.List;
import java.util.Optional;

/** Looks up accounts and the leagues they belong to. Same fail-soft rules as {@link LeagueDataSource}. */
public interface AccountDirectory {

    Optional<AccountInfo> findAccount(String username);

    List<LeagueRef> fetchLeagues(String accountId, String season);
}
