package com.outcast.rivalry.service;

import com.outcast.rivalry.config.RivalryProperties;
import com.outcast.rivalry.model.OpponentTally;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Decides whether the leaders are settled enough to stop dispatching batches. Fires only when the
 * win leader and the loss leader each have enough matchups and a clear gap over the runner-up.
 */
@Component
public class EarlyTerminationPolicy {

    /** Most wins first; ties go to fewer losses, then opponent id. */
    static final Comparator<OpponentTally> BY_WINS = Comparator
            .comparingInt(OpponentTally::getWins).reversed()
            .thenComparingInt(OpponentTally::getLosses)
            .thenComparing(OpponentTally::getOpponentId);

    /** Most losses first; ties go to fewer wins, then opponent id. */
    static final Comparator<OpponentTally> BY_LOSSES = Comparator
            .comparingInt(OpponentTally::getLosses).reversed()
            .thenComparingInt(OpponentTally::getWins)
            .thenComparing(OpponentTally::getOpponentId);

    private final RivalryProperties.Termination thresholds;

    public EarlyTerminationPolicy(RivalryProperties properties) {
        this.thresholds = properties.getTermination();
    }

    public boolean shouldTerminate(int batchesProcessed, Collection<OpponentTally> tallies) {
        if (batchesProcessed < thresholds.getMinBatches()) return false;
        if (tallies.size() < Math.max(2, thresholds.getMinOpponents())) return false;

        List<OpponentTally> byWins = new ArrayList<>(tallies);
        byWins.sort(BY_WINS);
        List<OpponentTally> byLosses = new ArrayList<>(tallies);
        byLosses.sort(BY_LOSSES);

        OpponentTally winLeader = byWins.get(0);
        OpponentTally lossLeader = byLosses.get(0);
        int winGap = winLeader.getWins() - byWins.get(1).getWins();
        int lossGap = lossLeader.getLosses() - byLosses.get(1).getLosses();

        return winLeader.getMatchups() >= thresholds.getMinLeaderMatchups()
                && winGap >= thresholds.getMinLeaderGap()
                && lossLeader.getMatchups() >= thresholds.getMinLeaderMatchups()
                && lossGap >= thresholds.getMinLeaderGap();
    }
}
