package com.outcast.rivalry.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.outcast.rivalry.client.SleeperApiClient;
import com.outcast.rivalry.model.AccountInfo;
import com.outcast.rivalry.model.LeagueRef;
import com.outcast.rivalry.model.MatchupRecord;
import com.outcast.rivalry.model.Roster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link LeagueDataSource} and {@link AccountDirectory} over the Sleeper API. Retries live in the
 * client; this layer maps JSON to records and turns every leftover failure into "no data".
 */
@Service
public class SleeperLeagueDataSource implements LeagueDataSource, AccountDirectory {

    private static final Logger log = LoggerFactory.getLogger(SleeperLeagueDataSource.class);

    private final SleeperApiClient apiClient;

    public SleeperLeagueDataSource(SleeperApiClient apiClient) {
        this.apiClient = apiClient;
    }

    @Override
    public List<Roster> fetchLeagueRosters(String leagueId) {
        if (leagueId == null || leagueId.isBlank()) return List.of();
        try {
            JsonNode result = apiClient.getRosters(leagueId);
            if (result == null || !result.isArray()) {
                log.warn("[Sleeper][Rosters] leagueId={} returned no roster array", leagueId);
                return List.of();
            }
            List<Roster> rosters = new ArrayList<>();
            for (JsonNode node : result) {
                Integer rosterId = getIntOrNull(node, "roster_id");
                if (rosterId == null) continue;
                JsonNode metadata = node.path("metadata");
                JsonNode settings = node.path("settings");
                rosters.add(new Roster(
                        rosterId,
                        getTextOrNull(node, "owner_id"),
                        getTextOrNull(metadata, "team_name"),
                        settings.path("wins").asInt(0),
                        settings.path("losses").asInt(0),
                        settings.path("ties").asInt(0)));
            }
            return rosters;
        } catch (WebClientResponseException e) {
            log.warn("[Sleeper][Rosters] leagueId={} status={} giving up", leagueId, e.getStatusCode());
            return List.of();
        } catch (Exception e) {
            log.warn("[Sleeper][Rosters] leagueId={} error={}", leagueId, e.getMessage());
            return List.of();
        }
    }

    @Override
    public List<MatchupRecord> fetchLeagueMatchups(String leagueId, int week) {
        if (leagueId == null || leagueId.isBlank() || week < 1) return List.of();
        try {
            JsonNode result = apiClient.getMatchups(leagueId, week);
            if (result == null || !result.isArray()) {
                return List.of();
            }
            List<MatchupRecord> matchups = new ArrayList<>();
            for (JsonNode node : result) {
                Integer rosterId = getIntOrNull(node, "roster_id");
                if (rosterId == null) continue;
                matchups.add(new MatchupRecord(
                        week,
                        rosterId,
                        getIntOrNull(node, "matchup_id"),
                        node.path("points").asDouble(0.0)));
            }
            return matchups;
        } catch (WebClientResponseException e) {
            log.warn("[Sleeper][Matchups] leagueId={} week={} status={} giving up", leagueId, week, e.getStatusCode());
            return List.of();
        } catch (Exception e) {
            log.warn("[Sleeper][Matchups] leagueId={} week={} error={}", leagueId, week, e.getMessage());
            return List.of();
        }
    }

    @Override
    public Optional<AccountInfo> fetchAccountInfo(String accountId) {
        return lookupUser(accountId);
    }

    @Override
    public Optional<AccountInfo> findAccount(String username) {
        return lookupUser(username);
    }

    @Override
    public List<LeagueRef> fetchLeagues(String accountId, String season) {
        if (accountId == null || accountId.isBlank()) return List.of();
        try {
            JsonNode result = apiClient.getLeagues(accountId, season);
            if (result == null || !result.isArray()) return List.of();
            List<LeagueRef> leagues = new ArrayList<>();
            for (JsonNode node : result) {
                String leagueId = getTextOrNull(node, "league_id");
                if (leagueId == null) continue;
                leagues.add(new LeagueRef(leagueId, getTextOrNull(node, "name"), node.path("total_rosters").asInt(0)));
            }
            return leagues;
        } catch (Exception e) {
            log.warn("[Sleeper][Leagues] accountId={} season={} error={}", accountId, season, e.getMessage());
            return List.of();
        }
    }

    private Optional<AccountInfo> lookupUser(String key) {
        if (key == null || key.isBlank()) return Optional.empty();
        try {
            JsonNode node = apiClient.getUser(key);
            // unknown users come back as a literal null body
            if (node == null || !node.isObject()) return Optional.empty();
            String userId = getTextOrNull(node, "user_id");
            if (userId == null) {
                log.warn("[Sleeper][User] key={} response has no user_id", key);
                return Optional.empty();
            }
            return Optional.of(new AccountInfo(userId, getTextOrNull(node, "display_name"), getTextOrNull(node, "username")));
        } catch (Exception e) {
            log.warn("[Sleeper][User] key={} error={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private static String getTextOrNull(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) return null;
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static Integer getIntOrNull(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) return null;
        if (value.canConvertToInt()) return value.asInt();
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
