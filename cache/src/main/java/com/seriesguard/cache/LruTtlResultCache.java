package com.seriesguard.cache;

import com.seriesguard.detector.PatternResult;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ResultCache} holding at most one entry per series, bounded by a time to live and a
 * capacity.
 * <p>
 * Lookups and writes go straight to a {@link ConcurrentHashMap}. Recency is a tick taken from a
 * shared counter on every hit or write. When a write pushes the cache past its capacity the writer
 * takes the eviction lock, drops expired entries first and then the least recently used ones until
 * the cache fits again. Readers never wait for that lock.
 * </p>
 * <p>
 * Expired entries are removed when a lookup runs into them, during eviction, and through
 * {@link #purgeExpired()}.
 * </p>
 */
public class LruTtlResultCache implements ResultCache {

    private static final Logger log = LoggerFactory.getLogger(LruTtlResultCache.class);

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final ReentrantLock evictionLock = new ReentrantLock();
    private final AtomicLong ticks = new AtomicLong();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();

    private final Duration ttl;
    private final long ttlMillis;
    private final int capacity;
    private final Clock clock;

    public LruTtlResultCache(@Nonnull Duration ttl, int capacity) {
        this(ttl, capacity, Clock.systemUTC());
    }

    /**
     * @param ttl time a result stays valid after it was stored
     * @param capacity maximum number of series held
     * @param clock time source for expiry
     * @throws IllegalArgumentException if ttl or capacity is not positive
     */
    public LruTtlResultCache(@Nonnull Duration ttl, int capacity, @Nonnull Clock clock) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.ttl = ttl;
        this.ttlMillis = ttl.toMillis();
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<PatternResult> get(@Nonnull String seriesKey, long windowFingerprint) {
        Objects.requireNonNull(seriesKey, "seriesKey");
        CacheEntry entry = entries.get(seriesKey);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            if (entries.remove(seriesKey, entry)) {
                expirations.incrementAndGet();
            }
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (!entry.matches(windowFingerprint)) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        entry.touch(ticks.incrementAndGet());
        hits.incrementAndGet();
        return Optional.of(entry.result());
    }

    @Override
    public void put(@Nonnull PatternResult result) {
        Objects.requireNonNull(result, "result");
        long now = clock.millis();
        CacheEntry fresh = new CacheEntry(result, now + ttlMillis, ticks.incrementAndGet());
        entries.compute(result.getSeriesKey(), (key, current) -> {
            if (current != null && !current.isExpired(now) && isNewer(current.result(), result)) {
                log.trace("Ignoring stale result for series '{}' (sequence {})", key, result.getWindowSequence());
                return current;
            }
            return fresh;
        });
        if (entries.size() > capacity) {
            evictOverflow();
        }
    }

    /**
     * Sequences only order results of one window lifetime. A result from an evicted and since
     * recreated window is older than any result of the new window, whatever its sequence.
     */
    private static boolean isNewer(PatternResult current, PatternResult incoming) {
        if (current.getWindowGeneration() != incoming.getWindowGeneration()) {
            return current.getWindowGeneration() > incoming.getWindowGeneration();
        }
        return current.getWindowSequence() > incoming.getWindowSequence();
    }

    @Override
    public void invalidate(@Nonnull String seriesKey) {
        entries.remove(Objects.requireNonNull(seriesKey, "seriesKey"));
    }

    @Override
    public int purgeExpired() {
        long now = clock.millis();
        int removed = 0;
        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            if (e.getValue().isExpired(now) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            expirations.addAndGet(removed);
            log.debug("Purged {} expired results", removed);
        }
        return removed;
    }

    private void evictOverflow() {
        evictionLock.lock();
        try {
            if (entries.size() <= capacity) {
                return;
            }
            purgeExpired();
            while (entries.size() > capacity) {
                String eldestKey = null;
                CacheEntry eldest = null;
                for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
                    if (eldest == null || e.getValue().recency() < eldest.recency()) {
                        eldestKey = e.getKey();
                        eldest = e.getValue();
                    }
                }
                if (eldest == null) {
                    break;
                }
                if (entries.remove(eldestKey, eldest)) {
                    evictions.incrementAndGet();
                    log.trace("Evicted result for series '{}'", eldestKey);
                }
            }
        } finally {
            evictionLock.unlock();
        }
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public CacheStatistics statistics() {
        return new CacheStatistics(entries.size(), capacity, hits.get(), misses.get(),
                evictions.get(), expirations.get());
    }

    public Duration getTtl() {
        return ttl;
    }

    public int getCapacity() {
        return capacity;
    }
}
