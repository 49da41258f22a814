package com.outcast.rivalry.service;

import com.outcast.rivalry.config.RivalryProperties;
import com.outcast.rivalry.model.LeagueSummary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Orders candidate leagues so the ones with the most games for the account are resolved first.
 * Leagues under the game floor, duplicates and entries without an id are dropped and counted.
 */
@Component
public class LeaguePrioritySelector {

    public record PrioritizedLeagues(List<LeagueSummary> leagues, int skipped) {}

    private final RivalryProperties properties;

    public LeaguePrioritySelector(RivalryProperties properties) {
        this.properties = properties;
    }

    public PrioritizedLeagues prioritize(List<LeagueSummary> candidates) {
        if (candidates == null || candidates.isEmpty()) return new PrioritizedLeagues(List.of(), 0);

        int minGames = properties.getSelection().getMinLeagueGames();
        Set<String> seen = new HashSet<>();
        List<LeagueSummary> kept = new ArrayList<>();
        int skipped = 0;
        for (LeagueSummary league : candidates) {
            if (league == null || league.leagueId() == null || league.leagueId().isBlank()
                    || league.totalGamesForAccount() < minGames
                    || !seen.add(league.leagueId())) {
                skipped++;
                continue;
            }
            kept.add(league);
        }
        // stable: equal game counts keep caller order
        kept.sort(Comparator.comparingInt(LeagueSummary::totalGamesForAccount).reversed());

        int cap = properties.getMaxLeagues();
        if (cap > 0 && kept.size() > cap) {
            skipped += kept.size() - cap;
            kept = new ArrayList<>(kept.subList(0, cap));
        }
        return new PrioritizedLeagues(List.copyOf(kept), skipped);
    }
}
