package com.outcast.rivalry.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.outcast.rivalry.config.SleeperApiProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * Client for the Sleeper fantasy league API.
 * Methods return the raw JSON; mapping to typed records happens in the data source.
 */
@Component
public class SleeperApiClient {

    private static final Logger log = LoggerFactory.getLogger(SleeperApiClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final Duration callTimeout;

    @Autowired
    public SleeperApiClient(WebClient sleeperWebClient, SleeperApiProperties properties, ObjectMapper objectMapper) {
        this(sleeperWebClient, objectMapper, RetryPolicy.from(properties.getRetry()), properties.getCallTimeout());
    }

    public SleeperApiClient(WebClient webClient, ObjectMapper objectMapper, RetryPolicy retryPolicy, Duration callTimeout) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
        this.callTimeout = callTimeout;
    }

    /**
     * Get a user by account id or username
     */
    public JsonNode getUser(String userIdOrName) {
        return callApi("/user/{user}", userIdOrName);
    }

    /**
     * Get the leagues a user played in for a season
     */
    public JsonNode getLeagues(String userId, String season) {
        return callApi("/user/{userId}/leagues/nfl/{season}", userId, season);
    }

    /**
     * Get every roster of a league
     */
    public JsonNode getRosters(String leagueId) {
        return callApi("/league/{leagueId}/rosters", leagueId);
    }

    /**
     * Get one week's matchups of a league
     */
    public JsonNode getMatchups(String leagueId, int week) {
        return callApi("/league/{leagueId}/matchups/{week}", leagueId, week);
    }

    /**
     * Generic GET with the retry policy applied.
     * Throws WebClientResponseException for HTTP errors that survive retries.
     */
    public JsonNode callApi(String path, Object... uriVariables) {
        log.debug("Calling Sleeper: path={}, vars={}", path, uriVariables);

        try {
            String body = webClient.get()
                    .uri(path, uriVariables)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(callTimeout)
                    .retryWhen(retryPolicy.toReactorRetry())
                    .block();

            if (body == null || body.isBlank()) {
                return NullNode.getInstance();
            }
            return objectMapper.readTree(body);
        } catch (WebClientResponseException e) {
            log.warn("Sleeper HTTP error: path={}, status={}, error={}", path, e.getStatusCode(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.warn("Error calling Sleeper: path={}, error={}", path, e.getMessage());
            throw new SleeperApiException("Failed to call Sleeper " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Failure that is not an HTTP status: connection refused, timeout, unreadable body
     */
    public static class SleeperApiException extends RuntimeException {
        public SleeperApiException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
