package com.seriesguard.cache;

import com.seriesguard.detector.PatternResult;

/**
 * Cache slot holding one immutable result.
 *
 * <p>The recency marker is the only mutable part; it is a plain tick from the cache's access
 * counter and is never visible outside the cache.
 */
final class CacheEntry {

    private final PatternResult result;
    private final long expiresAtMillis;
    private volatile long recency;

    CacheEntry(PatternResult result, long expiresAtMillis, long recency) {
        this.result = result;
        this.expiresAtMillis = expiresAtMillis;
        this.recency = recency;
    }

    PatternResult result() {
        return result;
    }

    boolean isExpired(long nowMillis) {
        return nowMillis >= expiresAtMillis;
    }

    boolean matches(long windowFingerprint) {
        return result.getWindowFingerprint() == windowFingerprint;
    }

    long recency() {
        return recency;
    }

    void touch(long tick) {
        recency = tick;
    }
}
