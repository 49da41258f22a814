package com.outcast.rivalry.model;

/**
 * Terminal artifact of a run. Either slot may be null when no opponent clears the sample floor.
 */
public record RivalryResult(
        RivalryRecord mostWinsAgainst,
        RivalryRecord mostLossesTo,
        PerformanceMetrics performance
) {
    public static RivalryResult empty(PerformanceMetrics performance) {
        return new RivalryResult(null, null, performance);
    }

    public RivalryResult withPerformance(PerformanceMetrics metrics) {
        return new RivalryResult(mostWinsAgainst, mostLossesTo, metrics);
    }

    public boolean hasRivalries() {
        return mostWinsAgainst != null || mostLossesTo != null;
    }
}
