package com.outcast.rivalry.model;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Diagnostics for one rivalry run. Counters are bumped from fetch workers as well as the
 * aggregation thread, hence the atomics.
 *
 * <p>{@code cacheHits}/{@code cacheMisses} refer to the finished-result cache;
 * {@code apiCallsSaved} counts roster, matchup and name lookups answered from cache.
 */
public class PerformanceMetrics {

    private final AtomicInteger cacheHits = new AtomicInteger();
    private final AtomicInteger cacheMisses = new AtomicInteger();
    private final AtomicInteger apiCallsMade = new AtomicInteger();
    private final AtomicInteger apiCallsSaved = new AtomicInteger();
    private final AtomicInteger leaguesProcessed = new AtomicInteger();
    private final AtomicInteger leaguesSkipped = new AtomicInteger();
    private final AtomicInteger leaguesFailed = new AtomicInteger();
    private final AtomicInteger batchesProcessed = new AtomicInteger();
    private volatile boolean earlyTermination;
    private volatile long durationMs;

    public void recordCacheHit() { cacheHits.incrementAndGet(); }
    public void recordCacheMiss() { cacheMisses.incrementAndGet(); }
    public void addApiCallsMade(int n) { apiCallsMade.addAndGet(n); }
    public void addApiCallsSaved(int n) { apiCallsSaved.addAndGet(n); }
    public void recordLeagueProcessed() { leaguesProcessed.incrementAndGet(); }
    public void addLeaguesSkipped(int n) { leaguesSkipped.addAndGet(n); }
    public void recordLeagueFailed() { leaguesFailed.incrementAndGet(); }
    public void recordBatch() { batchesProcessed.incrementAndGet(); }
    public void markEarlyTermination() { earlyTermination = true; }
    public void setDurationMs(long durationMs) { this.durationMs = durationMs; }

    public int getCacheHits() { return cacheHits.get(); }
    public int getCacheMisses() { return cacheMisses.get(); }
    public int getApiCallsMade() { return apiCallsMade.get(); }
    public int getApiCallsSaved() { return apiCallsSaved.get(); }
    public int getLeaguesProcessed() { return leaguesProcessed.get(); }
    public int getLeaguesSkipped() { return leaguesSkipped.get(); }
    public int getLeaguesFailed() { return leaguesFailed.get(); }
    public int getBatchesProcessed() { return batchesProcessed.get(); }
    public boolean isEarlyTermination() { return earlyTermination; }
    public long getDurationMs() { return durationMs; }

    /** Percentage of upstream lookups served from cache. */
    public double getCacheHitRate() {
        int saved = apiCallsSaved.get();
        int total = saved + apiCallsMade.get();
        return total > 0 ? saved * 100.0 / total : 0.0;
    }

    @Override
    public String toString() {
        return "PerformanceMetrics{cacheHits=" + getCacheHits()
                + ", cacheMisses=" + getCacheMisses()
                + ", apiCallsMade=" + getApiCallsMade()
                + ", apiCallsSaved=" + getApiCallsSaved()
                + ", leaguesProcessed=" + getLeaguesProcessed()
                + ", leaguesSkipped=" + getLeaguesSkipped()
                + ", leaguesFailed=" + getLeaguesFailed()
                + ", batches=" + getBatchesProcessed()
                + ", earlyTermination=" + earlyTermination
                + ", durationMs=" + durationMs + "}";
    }
}
