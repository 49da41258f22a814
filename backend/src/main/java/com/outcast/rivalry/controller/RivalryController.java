package com.outcast.rivalry.controller;

import com.outcast.rivalry.cache.EngineCaches;
import com.outcast.rivalry.config.RivalryProperties;
import com.outcast.rivalry.dto.ManagerRivalryResponse;
import com.outcast.rivalry.dto.RivalryRequest;
import com.outcast.rivalry.model.RivalryResult;
import com.outcast.rivalry.service.ManagerLeagueService;
import com.outcast.rivalry.service.RivalryAggregator;
import com.outcast.rivalry.service.RivalryUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class RivalryController {

    private static final Logger log = LoggerFactory.getLogger(RivalryController.class);
    static final String UNAVAILABLE = "Rivalry data temporarily unavailable";

    private final RivalryAggregator aggregator;
    private final ManagerLeagueService managerLeagueService;
    private final EngineCaches caches;
    private final RivalryProperties properties;

    public RivalryController(RivalryAggregator aggregator,
                             ManagerLeagueService managerLeagueService,
                             EngineCaches caches,
                             RivalryProperties properties) {
        this.aggregator = aggregator;
        this.managerLeagueService = managerLeagueService;
        this.caches = caches;
        this.properties = properties;
    }

    @PostMapping("/rivalries")
    public RivalryResult calculate(@RequestBody(required = false) RivalryRequest request) {
        if (request == null || request.accountId() == null || request.accountId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "accountId is required");
        }
        String season = seasonOrDefault(request.season());
        long start = System.currentTimeMillis();
        log.info("[Rivalry][REQ] accountId={}, season={}, leagues={}", request.accountId(), season,
                request.leagues() == null ? 0 : request.leagues().size());
        try {
            RivalryResult result = aggregator.computeRivalries(request.accountId(), request.leagues(), season);
            log.info("[Rivalry][OK] accountId={}, ms={}", request.accountId(), System.currentTimeMillis() - start);
            return result;
        } catch (RivalryUnavailableException ex) {
            log.error("[Rivalry][ERR] accountId={}, msg={}", request.accountId(), ex.getMessage());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, UNAVAILABLE, ex);
        }
    }

    @GetMapping("/managers/{username}/rivalries")
    public ManagerRivalryResponse forManager(@PathVariable String username,
                                             @RequestParam(name = "season", required = false) String seasonParam) {
        String season = seasonOrDefault(seasonParam);
        long start = System.currentTimeMillis();
        log.info("[Rivalry][REQ] username={}, season={}", username, season);
        try {
            ManagerLeagueService.ManagerLeagues manager = managerLeagueService.resolve(username, season)
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Manager not found: " + username));
            RivalryResult result = aggregator.computeRivalries(manager.account().accountId(), manager.leagues(), season);
            log.info("[Rivalry][OK] username={}, leagues={}, ms={}", username, manager.leagues().size(),
                    System.currentTimeMillis() - start);
            String displayName = manager.account().preferredName() != null ? manager.account().preferredName() : username;
            return new ManagerRivalryResponse(manager.account().accountId(), displayName, season,
                    manager.leagues().size(), result);
        } catch (RivalryUnavailableException ex) {
            log.error("[Rivalry][ERR] username={}, msg={}", username, ex.getMessage());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, UNAVAILABLE, ex);
        }
    }

    @GetMapping("/rivalries/cache-stats")
    public Map<String, Integer> cacheStats() {
        return caches.stats();
    }

    private String seasonOrDefault(String season) {
        return season == null || season.isBlank() ? properties.getSeason().getDefaultSeason() : season.trim();
    }
}
