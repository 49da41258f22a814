package com.outcast.rivalry.source;

import com.outcast.rivalry.model.AccountInfo;
import com.outcast.rivalry.model.MatchupRecord;
import com.outcast.rivalry.model.Roster;

import java.util.List;
import java.util.Optional;

/**
 * League data as the rivalry engine consumes it.
 *
 * <p>Implementations are called from several fetch workers at once and fail soft: transient
 * failures are retried internally and anything left over comes back as an empty list or
 * {@link Optional#empty()}, never as an exception.
 */
public interface LeagueDataSource {

    List<Roster> fetchLeagueRosters(String leagueId);

    List<MatchupRecord> fetchLeagueMatchups(String leagueId, int week);

    Optional<AccountInfo> fetchAccountInfo(String accountId);
}
