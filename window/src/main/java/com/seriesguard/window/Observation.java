package com.seriesguard.window;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * A single numeric point of a time series.
 *
 * <p>Instances are immutable. The timestamp is expressed in epoch milliseconds and must be
 * non-decreasing per series for the point to be accepted by a {@link SeriesWindowStore}.
 */
public final class Observation {

    /** Longest series key accepted by the store. */
    public static final int MAX_SERIES_KEY_LENGTH = 256;

    private final String seriesKey;
    private final long timestamp;
    private final double value;

    /**
     * Creates a new observation.
     *
     * @param seriesKey the series this point belongs to
     * @param timestamp the point time in epoch milliseconds
     * @param value the measured value
     * @throws NullPointerException if {@code seriesKey} is {@code null}
     */
    public Observation(@Nonnull String seriesKey, long timestamp, double value) {
        this.seriesKey = Objects.requireNonNull(seriesKey, "seriesKey");
        this.timestamp = timestamp;
        this.value = value;
    }

    public String getSeriesKey() {
        return seriesKey;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    /**
     * Checks whether a series key is usable: not blank and no longer than
     * {@link #MAX_SERIES_KEY_LENGTH} characters.
     *
     * @param seriesKey the key to check, may be {@code null}
     * @return {@code true} if the key can name a series
     */
    public static boolean isValidSeriesKey(String seriesKey) {
        return seriesKey != null && !seriesKey.isBlank() && seriesKey.length() <= MAX_SERIES_KEY_LENGTH;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Observation that = (Observation) o;
        return timestamp == that.timestamp
                && Double.compare(that.value, value) == 0
                && seriesKey.equals(that.seriesKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seriesKey, timestamp, value);
    }

    @Override
    public String toString() {
        return "Observation{" +
                "seriesKey='" + seriesKey + '\'' +
                ", timestamp=" + timestamp +
                ", value=" + value +
                '}';
    }
}
