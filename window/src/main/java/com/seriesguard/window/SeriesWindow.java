package com.seriesguard.window;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.Variance;

/**
 * Fixed-capacity rolling window of one series with incrementally maintained aggregates.
 * <p>
 * The window keeps the most recent {@code capacity} observations in a primitive ring buffer and
 * maintains the following aggregates on every append:
 * </p>
 * <ul>
 *   <li><b>Running mean and variance:</b> Welford's update when a value enters the window and the
 *       inverse update when the oldest value leaves it</li>
 *   <li><b>Resynchronisation:</b> after {@code capacity} evictions the aggregates are recomputed
 *       from the buffer with Apache Commons Math, so rounding error introduced by the inverse
 *       updates stays bounded</li>
 *   <li><b>Seasonal baseline:</b> when a period is configured, the values of the running cycle are
 *       collected per phase and become the baseline once the next cycle starts</li>
 * </ul>
 * <p>
 * <b>Performance Characteristics:</b>
 * </p>
 * <ul>
 *   <li>Append: O(1) amortized (O(capacity) once every {@code capacity} evictions)</li>
 *   <li>Snapshot: O(capacity + period) copy</li>
 * </ul>
 * <p>
 * This class is not thread-safe. {@link ConcurrentSeriesWindowStore} guards every instance with
 * its own monitor.
 * </p>
 */
final class SeriesWindow {

    private final String seriesKey;
    private final int capacity;
    private final int seasonalPeriod;

    private final double[] values;
    private final long[] timestamps;
    private final long generation;
    /** Index of the oldest retained observation. */
    private int head = 0;
    private int size = 0;
    private long sequence = 0;
    private long lastTimestamp = Long.MIN_VALUE;

    private double mean = 0.0;
    /** Sum of squared deviations from the mean (Welford's M2). */
    private double m2 = 0.0;
    private int evictionsSinceResync = 0;

    /** Values of the running cycle indexed by phase; {@code null} without a seasonal period. */
    private final double[] currentCycle;
    /** Values of the last completed cycle; {@code null} until one has completed. */
    private double[] baseline;

    private volatile long lastAccessMillis;
    /** Set once the window has been removed from its store; a retired window accepts nothing. */
    private boolean retired = false;

    SeriesWindow(String seriesKey, long generation, int capacity, int seasonalPeriod, long createdAtMillis) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Window capacity must be positive");
        }
        if (seasonalPeriod < 0) {
            throw new IllegalArgumentException("Seasonal period must not be negative");
        }
        this.seriesKey = seriesKey;
        this.generation = generation;
        this.capacity = capacity;
        this.seasonalPeriod = seasonalPeriod;
        this.values = new double[capacity];
        this.timestamps = new long[capacity];
        this.currentCycle = seasonalPeriod > 0 ? new double[seasonalPeriod] : null;
        this.lastAccessMillis = createdAtMillis;
    }

    /**
     * Checks whether an observation with the given timestamp would be accepted.
     */
    boolean accepts(long timestamp) {
        return sequence == 0 || timestamp >= lastTimestamp;
    }

    /**
     * Appends a value, evicting the oldest one when the buffer is full.
     * <p>
     * The caller must have checked {@link #accepts(long)} first.
     * </p>
     */
    void append(long timestamp, double value, long nowMillis) {
        if (size == capacity) {
            evictOldest();
        }
        int tail = (head + size) % capacity;
        values[tail] = value;
        timestamps[tail] = timestamp;
        size++;

        double delta = value - mean;
        mean += delta / size;
        m2 += delta * (value - mean);

        if (currentCycle != null) {
            int phase = (int) (sequence % seasonalPeriod);
            if (phase == 0 && sequence > 0) {
                // previous cycle is complete
                baseline = currentCycle.clone();
            }
            currentCycle[phase] = value;
        }

        sequence++;
        lastTimestamp = timestamp;
        lastAccessMillis = nowMillis;
    }

    private void evictOldest() {
        double old = values[head];
        head = (head + 1) % capacity;
        size--;

        if (size == 0) {
            mean = 0.0;
            m2 = 0.0;
        } else {
            double previousMean = mean;
            mean = ((size + 1) * previousMean - old) / size;
            m2 -= (old - previousMean) * (old - mean);
            if (m2 < 0.0) {
                m2 = 0.0;
            }
        }

        if (++evictionsSinceResync >= capacity) {
            resync();
        }
    }

    /**
     * Recomputes mean and M2 from the retained values.
     */
    private void resync() {
        evictionsSinceResync = 0;
        if (size == 0) {
            mean = 0.0;
            m2 = 0.0;
            return;
        }
        double[] retained = retainedValues();
        mean = new Mean().evaluate(retained);
        m2 = new Variance(false).evaluate(retained, mean) * size;
    }

    private double[] retainedValues() {
        double[] copy = new double[size];
        for (int i = 0; i < size; i++) {
            copy[i] = values[(head + i) % capacity];
        }
        return copy;
    }

    private long[] retainedTimestamps() {
        long[] copy = new long[size];
        for (int i = 0; i < size; i++) {
            copy[i] = timestamps[(head + i) % capacity];
        }
        return copy;
    }

    WindowSnapshot snapshot() {
        return new WindowSnapshot(
                seriesKey,
                generation,
                retainedTimestamps(),
                retainedValues(),
                sequence,
                mean,
                variance(),
                seasonalPeriod,
                baseline == null ? new double[0] : baseline);
    }

    long fingerprint() {
        if (size == 0) {
            return WindowSnapshot.fingerprint(0L, 0L, 0, sequence);
        }
        long first = timestamps[head];
        long last = timestamps[(head + size - 1) % capacity];
        return WindowSnapshot.fingerprint(first, last, size, sequence);
    }

    double variance() {
        return size == 0 ? 0.0 : m2 / size;
    }

    double mean() {
        return mean;
    }

    int size() {
        return size;
    }

    long sequence() {
        return sequence;
    }

    long lastTimestamp() {
        return lastTimestamp;
    }

    long lastAccessMillis() {
        return lastAccessMillis;
    }

    boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
    }

    String seriesKey() {
        return seriesKey;
    }
}
