package com.seriesguard.window;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe {@link SeriesWindowStore} keeping one independently locked window per series key.
 * <p>
 * Windows live in a {@link ConcurrentHashMap}; there is no lock covering the whole store. Every
 * {@link SeriesWindow} is guarded by its own monitor, held only while the ring buffer and
 * aggregates are updated or while a snapshot is copied. Appends to different keys therefore never
 * contend with each other.
 * </p>
 * <p>
 * Idle eviction retires a window under its monitor before removing it from the map. An append
 * that raced with the eviction and locked the retired instance retries against a fresh window,
 * so no accepted observation is ever applied to an orphaned record.
 * </p>
 *
 * <pre>{@code
 * SeriesWindowStore store = new ConcurrentSeriesWindowStore(120, 24, Duration.ofHours(1));
 * AppendResult result = store.append(new Observation("cpu.load", now, 0.42));
 * if (result.isAccepted()) {
 *     WindowSnapshot snapshot = result.getSnapshot().orElseThrow();
 * }
 * }</pre>
 */
public class ConcurrentSeriesWindowStore implements SeriesWindowStore {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentSeriesWindowStore.class);

    private final int capacity;
    private final int seasonalPeriod;
    private final long idleTimeoutMillis;
    private final Clock clock;

    private final ConcurrentHashMap<String, SeriesWindow> windows = new ConcurrentHashMap<>();
    /** Source of window generations, shared by all keys so a recreated window always ranks higher. */
    private final AtomicLong generations = new AtomicLong();

    /**
     * Creates a store using the system UTC clock.
     *
     * @param capacity number of observations retained per series
     * @param seasonalPeriod seasonal period in samples, {@code 0} to disable seasonal baselines
     * @param idleTimeout how long a window may go without observations before
     *                    {@link #evictIdle()} removes it
     */
    public ConcurrentSeriesWindowStore(int capacity, int seasonalPeriod, @Nonnull Duration idleTimeout) {
        this(capacity, seasonalPeriod, idleTimeout, Clock.systemUTC());
    }

    /**
     * Creates a store with a specific clock, mainly for testing purposes.
     *
     * @param capacity number of observations retained per series
     * @param seasonalPeriod seasonal period in samples, {@code 0} to disable seasonal baselines
     * @param idleTimeout idle period after which a window becomes evictable
     * @param clock clock used to track window activity
     */
    public ConcurrentSeriesWindowStore(int capacity, int seasonalPeriod, @Nonnull Duration idleTimeout,
                                       @Nonnull Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (seasonalPeriod < 0) {
            throw new IllegalArgumentException("seasonalPeriod must not be negative");
        }
        if (idleTimeout == null || idleTimeout.isZero() || idleTimeout.isNegative()) {
            throw new IllegalArgumentException("idleTimeout must be positive");
        }
        this.capacity = capacity;
        this.seasonalPeriod = seasonalPeriod;
        this.idleTimeoutMillis = idleTimeout.toMillis();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public AppendResult append(@Nonnull Observation observation, long snapshotEvery) {
        Objects.requireNonNull(observation, "observation");
        if (snapshotEvery < 0) {
            throw new IllegalArgumentException("snapshotEvery must not be negative");
        }
        String key = observation.getSeriesKey();
        if (!Double.isFinite(observation.getValue())) {
            log.debug("Rejected non-finite value {} for series '{}'", observation.getValue(), key);
            return AppendResult.invalidValue(key);
        }

        while (true) {
            SeriesWindow window = windows.computeIfAbsent(key, this::createWindow);
            synchronized (window) {
                if (window.isRetired()) {
                    continue;
                }
                if (!window.accepts(observation.getTimestamp())) {
                    log.debug("Rejected out-of-order observation for series '{}': {} < {}",
                            key, observation.getTimestamp(), window.lastTimestamp());
                    return AppendResult.outOfOrder(key, window.sequence(), window.size(),
                            window.fingerprint(), window.lastTimestamp());
                }
                window.append(observation.getTimestamp(), observation.getValue(), clock.millis());
                boolean capture = snapshotEvery > 0 && window.sequence() % snapshotEvery == 0;
                return AppendResult.accepted(key, window.sequence(), window.size(), window.fingerprint(),
                        window.lastTimestamp(), capture ? window.snapshot() : null);
            }
        }
    }

    private SeriesWindow createWindow(String key) {
        long generation = generations.incrementAndGet();
        log.debug("Creating window for series '{}' (generation={}, capacity={}, seasonalPeriod={})",
                key, generation, capacity, seasonalPeriod);
        return new SeriesWindow(key, generation, capacity, seasonalPeriod, clock.millis());
    }

    @Override
    public Optional<WindowSnapshot> snapshot(@Nonnull String seriesKey) {
        Objects.requireNonNull(seriesKey, "seriesKey");
        SeriesWindow window = windows.get(seriesKey);
        if (window == null) {
            return Optional.empty();
        }
        synchronized (window) {
            if (window.isRetired()) {
                return Optional.empty();
            }
            return Optional.of(window.snapshot());
        }
    }

    @Override
    public Set<String> evictIdle() {
        long cutoff = clock.millis() - idleTimeoutMillis;
        Set<String> evicted = new HashSet<>();
        for (Map.Entry<String, SeriesWindow> entry : windows.entrySet()) {
            SeriesWindow window = entry.getValue();
            if (window.lastAccessMillis() > cutoff) {
                continue;
            }
            synchronized (window) {
                // re-check under the lock, an append may have landed meanwhile
                if (!window.isRetired() && window.lastAccessMillis() <= cutoff) {
                    window.retire();
                    windows.remove(entry.getKey(), window);
                    evicted.add(entry.getKey());
                }
            }
        }
        if (!evicted.isEmpty()) {
            log.info("Evicted {} idle series windows", evicted.size());
        }
        return evicted;
    }

    @Override
    public boolean remove(@Nonnull String seriesKey) {
        Objects.requireNonNull(seriesKey, "seriesKey");
        SeriesWindow window = windows.get(seriesKey);
        if (window == null) {
            return false;
        }
        synchronized (window) {
            if (window.isRetired()) {
                return false;
            }
            window.retire();
            return windows.remove(seriesKey, window);
        }
    }

    @Override
    public int size() {
        return windows.size();
    }

    @Override
    public Set<String> seriesKeys() {
        return Collections.unmodifiableSet(new HashSet<>(windows.keySet()));
    }

    public int getCapacity() {
        return capacity;
    }

    public int getSeasonalPeriod() {
        return seasonalPeriod;
    }
}
