package com.seriesguard.window;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable copy of a series window at one point in time.
 *
 * <p>A snapshot never aliases the live ring buffer: the values, timestamps and seasonal baseline
 * are copied when the snapshot is taken, so appends that happen afterwards cannot affect a
 * detection running on it.
 *
 * <p>The aggregates ({@link #getMean()}, {@link #getVariance()}) describe exactly the retained
 * values. Variance is the population variance.
 */
public final class WindowSnapshot {

    private final String seriesKey;
    private final long generation;
    private final long[] timestamps;
    private final double[] values;
    private final long sequence;
    private final double mean;
    private final double variance;
    private final int seasonalPeriod;
    private final double[] seasonalBaseline;
    private final long fingerprint;

    /**
     * Creates a snapshot of a window outside any store, with generation {@code 0}.
     */
    public WindowSnapshot(String seriesKey,
                          long[] timestamps,
                          double[] values,
                          long sequence,
                          double mean,
                          double variance,
                          int seasonalPeriod,
                          double[] seasonalBaseline) {
        this(seriesKey, 0L, timestamps, values, sequence, mean, variance, seasonalPeriod, seasonalBaseline);
    }

    /**
     * Creates a snapshot. The arrays are defensively copied.
     *
     * @param seriesKey the series the window belongs to
     * @param generation identifies the window lifetime; a window recreated after eviction gets a
     *                   higher generation than the one it replaces
     * @param timestamps retained timestamps, oldest first
     * @param values retained values, aligned with {@code timestamps}
     * @param sequence lifetime number of accepted observations
     * @param mean running mean of {@code values}
     * @param variance running population variance of {@code values}
     * @param seasonalPeriod seasonal period in samples, {@code 0} when none is configured
     * @param seasonalBaseline values of the last completed period, empty when none exists yet
     * @throws IllegalArgumentException if the arrays do not line up
     */
    public WindowSnapshot(String seriesKey,
                          long generation,
                          long[] timestamps,
                          double[] values,
                          long sequence,
                          double mean,
                          double variance,
                          int seasonalPeriod,
                          double[] seasonalBaseline) {
        this.seriesKey = Objects.requireNonNull(seriesKey, "seriesKey");
        this.generation = generation;
        Objects.requireNonNull(timestamps, "timestamps");
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(seasonalBaseline, "seasonalBaseline");
        if (timestamps.length != values.length) {
            throw new IllegalArgumentException("timestamps and values must have the same length");
        }
        if (sequence < values.length) {
            throw new IllegalArgumentException("sequence cannot be smaller than the retained count");
        }
        if (seasonalPeriod < 0) {
            throw new IllegalArgumentException("seasonalPeriod must not be negative");
        }
        if (seasonalBaseline.length != 0 && seasonalBaseline.length != seasonalPeriod) {
            throw new IllegalArgumentException("seasonalBaseline must be empty or span one period");
        }
        this.timestamps = Arrays.copyOf(timestamps, timestamps.length);
        this.values = Arrays.copyOf(values, values.length);
        this.sequence = sequence;
        this.mean = mean;
        this.variance = variance;
        this.seasonalPeriod = seasonalPeriod;
        this.seasonalBaseline = Arrays.copyOf(seasonalBaseline, seasonalBaseline.length);
        this.fingerprint = this.values.length == 0
                ? fingerprint(0L, 0L, 0, sequence)
                : fingerprint(this.timestamps[0], this.timestamps[this.timestamps.length - 1],
                        this.values.length, sequence);
    }

    /**
     * Computes the fingerprint of a window state.
     *
     * <p>The hash covers the boundary timestamps, the retained count and the lifetime sequence.
     * The sequence changes on every accepted append, so two appends carrying the same timestamp
     * still produce different fingerprints.
     *
     * @param firstTimestamp timestamp of the oldest retained observation
     * @param lastTimestamp timestamp of the newest retained observation
     * @param count number of retained observations
     * @param sequence lifetime number of accepted observations
     * @return the 64-bit fingerprint
     */
    public static long fingerprint(long firstTimestamp, long lastTimestamp, int count, long sequence) {
        long h = 0x9E3779B97F4A7C15L;
        h = mix(h ^ firstTimestamp);
        h = mix(h ^ lastTimestamp);
        h = mix(h ^ count);
        h = mix(h ^ sequence);
        return h;
    }

    // 64-bit finalizer from MurmurHash3
    private static long mix(long h) {
        h ^= h >>> 33;
        h *= 0xff51afd7ed558ccdL;
        h ^= h >>> 33;
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= h >>> 33;
        return h;
    }

    public String getSeriesKey() {
        return seriesKey;
    }

    /**
     * Lifetime of the window this snapshot was taken from. Sequences only compare within one
     * generation.
     */
    public long getGeneration() {
        return generation;
    }

    public int getCount() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public long getSequence() {
        return sequence;
    }

    public double getMean() {
        return mean;
    }

    public double getVariance() {
        return variance;
    }

    public double getStandardDeviation() {
        return Math.sqrt(variance);
    }

    public long getFingerprint() {
        return fingerprint;
    }

    /**
     * @param index position from the oldest retained observation
     * @return the value at that position
     */
    public double getValue(int index) {
        return values[index];
    }

    public long getTimestamp(int index) {
        return timestamps[index];
    }

    /**
     * @throws IllegalStateException if the snapshot is empty
     */
    public double getLatestValue() {
        if (values.length == 0) {
            throw new IllegalStateException("No data available");
        }
        return values[values.length - 1];
    }

    /**
     * @throws IllegalStateException if the snapshot is empty
     */
    public long getLatestTimestamp() {
        if (timestamps.length == 0) {
            throw new IllegalStateException("No data available");
        }
        return timestamps[timestamps.length - 1];
    }

    /**
     * @throws IllegalStateException if the snapshot is empty
     */
    public long getFirstTimestamp() {
        if (timestamps.length == 0) {
            throw new IllegalStateException("No data available");
        }
        return timestamps[0];
    }

    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }

    public long[] getTimestamps() {
        return Arrays.copyOf(timestamps, timestamps.length);
    }

    public int getSeasonalPeriod() {
        return seasonalPeriod;
    }

    /**
     * Whether a full seasonal period has been observed, so that a same-phase comparison is possible.
     */
    public boolean hasSeasonalBaseline() {
        return seasonalPeriod > 0 && seasonalBaseline.length == seasonalPeriod;
    }

    /**
     * Phase of the latest observation within the seasonal period.
     *
     * @return the phase in {@code [0, period)}, or {@code -1} when no period is configured
     */
    public int getLatestPhase() {
        if (seasonalPeriod == 0 || sequence == 0) {
            return -1;
        }
        return (int) ((sequence - 1) % seasonalPeriod);
    }

    /**
     * Baseline value recorded for a phase during the last completed period.
     *
     * @param phase the phase in {@code [0, period)}
     * @return the baseline value
     * @throws IllegalStateException if no baseline has been established
     */
    public double getSeasonalBaseline(int phase) {
        if (!hasSeasonalBaseline()) {
            throw new IllegalStateException("No seasonal baseline established");
        }
        return seasonalBaseline[phase];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WindowSnapshot that = (WindowSnapshot) o;
        return sequence == that.sequence
                && generation == that.generation
                && fingerprint == that.fingerprint
                && seasonalPeriod == that.seasonalPeriod
                && Double.compare(that.mean, mean) == 0
                && Double.compare(that.variance, variance) == 0
                && seriesKey.equals(that.seriesKey)
                && Arrays.equals(timestamps, that.timestamps)
                && Arrays.equals(values, that.values)
                && Arrays.equals(seasonalBaseline, that.seasonalBaseline);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(seriesKey, sequence, fingerprint);
        result = 31 * result + Arrays.hashCode(values);
        return result;
    }

    @Override
    public String toString() {
        return "WindowSnapshot{" +
                "seriesKey='" + seriesKey + '\'' +
                ", generation=" + generation +
                ", count=" + values.length +
                ", sequence=" + sequence +
                ", mean=" + mean +
                ", variance=" + variance +
                ", fingerprint=" + Long.toHexString(fingerprint) +
                '}';
    }
}
