package com.seriesguard.cache;

/**
 * Point-in-time counters of a {@link ResultCache}.
 */
public final class CacheStatistics {

    private final int size;
    private final int capacity;
    private final long hits;
    private final long misses;
    private final long evictions;
    private final long expirations;

    public CacheStatistics(int size, int capacity, long hits, long misses, long evictions, long expirations) {
        this.size = size;
        this.capacity = capacity;
        this.hits = hits;
        this.misses = misses;
        this.evictions = evictions;
        this.expirations = expirations;
    }

    public int getSize() {
        return size;
    }

    public int getCapacity() {
        return capacity;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    /** Entries removed to make room once the capacity was exceeded. */
    public long getEvictions() {
        return evictions;
    }

    /** Entries removed because their time to live had passed. */
    public long getExpirations() {
        return expirations;
    }

    public double getHitRatio() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    @Override
    public String toString() {
        return "CacheStatistics{" +
                "size=" + size +
                ", capacity=" + capacity +
                ", hits=" + hits +
                ", misses=" + misses +
                ", evictions=" + evictions +
                ", expirations=" + expirations +
                '}';
    }
}
