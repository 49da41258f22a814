package com.outcast.rivalry.service;

import com.outcast.rivalry.config.RivalryProperties;
import com.outcast.rivalry.model.HeadToHeadRecord;
import com.outcast.rivalry.model.OpponentTally;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EarlyTerminationPolicyTest {

    private final EarlyTerminationPolicy policy = new EarlyTerminationPolicy(new RivalryProperties());

    static OpponentTally tally(String id, int wins, int losses) {
        OpponentTally t = new OpponentTally(id, "Team " + id);
        t.merge(new HeadToHeadRecord(id, "Team " + id, wins, losses));
        return t;
    }

    @Test
    void settledLeaders_terminateAfterMinimumBatches() {
        List<OpponentTally> tallies = List.of(tally("a", 8, 1), tally("b", 1, 8), tally("c", 2, 2));

        assertThat(policy.shouldTerminate(1, tallies)).isFalse();
        assertThat(policy.shouldTerminate(2, tallies)).isTrue();
    }

    @Test
    void tooFewOpponents_neverTerminates() {
        assertThat(policy.shouldTerminate(5, List.of(tally("a", 8, 1), tally("b", 1, 8)))).isFalse();
    }

    @Test
    void closeRace_keepsGoing() {
        List<OpponentTally> tallies = List.of(tally("a", 8, 1), tally("c", 7, 1), tally("b", 1, 8));
        assertThat(policy.shouldTerminate(3, tallies)).isFalse();
    }

    @Test
    void thinSample_keepsGoing() {
        List<OpponentTally> tallies = List.of(tally("a", 4, 0), tally("b", 0, 4), tally("c", 1, 1));
        assertThat(policy.shouldTerminate(3, tallies)).isFalse();
    }

    @Test
    void comparators_breakTiesDeterministically() {
        OpponentTally x = tally("x", 5, 3);
        OpponentTally y = tally("y", 5, 2);
        OpponentTally z = tally("z", 5, 2);

        assertThat(List.of(x, z, y).stream().sorted(EarlyTerminationPolicy.BY_WINS))
                .extracting(OpponentTally::getOpponentId)
                .containsExactly("y", "z", "x");
        assertThat(List.of(tally("p", 1, 4), tally("q", 0, 4)).stream().sorted(EarlyTerminationPolicy.BY_LOSSES))
                .extracting(OpponentTally::getOpponentId)
                .containsExactly("q", "p");
    }
}
