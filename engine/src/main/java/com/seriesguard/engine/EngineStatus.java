package com.seriesguard.engine;

import com.seriesguard.cache.CacheStatistics;
import java.time.Instant;

/**
 * Point-in-time health figures of a {@link PatternEngine}.
 */
public final class EngineStatus {

    private final Instant startedAt;
    private final int seriesCount;
    private final CacheStatistics cache;
    private final int dispatchPending;
    private final long dispatchDropped;
    private final long acceptedCount;
    private final long rejectedCount;
    private final long rateLimitedCount;
    private final long queryCount;
    private final long detectionFailures;

    EngineStatus(Instant startedAt, int seriesCount, CacheStatistics cache, int dispatchPending,
                 long dispatchDropped, long acceptedCount, long rejectedCount, long rateLimitedCount,
                 long queryCount, long detectionFailures) {
        this.startedAt = startedAt;
        this.seriesCount = seriesCount;
        this.cache = cache;
        this.dispatchPending = dispatchPending;
        this.dispatchDropped = dispatchDropped;
        this.acceptedCount = acceptedCount;
        this.rejectedCount = rejectedCount;
        this.rateLimitedCount = rateLimitedCount;
        this.queryCount = queryCount;
        this.detectionFailures = detectionFailures;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public int getSeriesCount() {
        return seriesCount;
    }

    public CacheStatistics getCache() {
        return cache;
    }

    public int getDispatchPending() {
        return dispatchPending;
    }

    public long getDispatchDropped() {
        return dispatchDropped;
    }

    public long getAcceptedCount() {
        return acceptedCount;
    }

    public long getRejectedCount() {
        return rejectedCount;
    }

    /**
     * Ingestion and query calls denied by admission control.
     */
    public long getRateLimitedCount() {
        return rateLimitedCount;
    }

    public long getQueryCount() {
        return queryCount;
    }

    public long getDetectionFailures() {
        return detectionFailures;
    }

    @Override
    public String toString() {
        return "EngineStatus{" +
                "startedAt=" + startedAt +
                ", seriesCount=" + seriesCount +
                ", cache=" + cache +
                ", dispatchPending=" + dispatchPending +
                ", dispatchDropped=" + dispatchDropped +
                ", accepted=" + acceptedCount +
                ", rejected=" + rejectedCount +
                ", rateLimited=" + rateLimitedCount +
                ", queries=" + queryCount +
                ", detectionFailures=" + detectionFailures +
                '}';
    }
}
