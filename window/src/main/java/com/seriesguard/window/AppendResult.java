package com.seriesguard.window;

import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Outcome of {@link SeriesWindowStore#append(Observation, boolean)}.
 */
public final class AppendResult {

    public enum Status {
        ACCEPTED,
        /** Timestamp earlier than the last accepted one for the series. */
        OUT_OF_ORDER,
        /** Value is NaN or infinite. */
        INVALID_VALUE
    }

    private final Status status;
    private final String seriesKey;
    private final long sequence;
    private final int count;
    private final long fingerprint;
    private final long lastAcceptedTimestamp;
    private final WindowSnapshot snapshot;

    private AppendResult(Status status, String seriesKey, long sequence, int count, long fingerprint,
                         long lastAcceptedTimestamp, @Nullable WindowSnapshot snapshot) {
        this.status = status;
        this.seriesKey = seriesKey;
        this.sequence = sequence;
        this.count = count;
        this.fingerprint = fingerprint;
        this.lastAcceptedTimestamp = lastAcceptedTimestamp;
        this.snapshot = snapshot;
    }

    static AppendResult accepted(String seriesKey, long sequence, int count, long fingerprint,
                                 long lastAcceptedTimestamp, @Nullable WindowSnapshot snapshot) {
        return new AppendResult(Status.ACCEPTED, seriesKey, sequence, count, fingerprint,
                lastAcceptedTimestamp, snapshot);
    }

    static AppendResult outOfOrder(String seriesKey, long sequence, int count, long fingerprint,
                                   long lastAcceptedTimestamp) {
        return new AppendResult(Status.OUT_OF_ORDER, seriesKey, sequence, count, fingerprint,
                lastAcceptedTimestamp, null);
    }

    static AppendResult invalidValue(String seriesKey) {
        return new AppendResult(Status.INVALID_VALUE, seriesKey, 0L, 0, 0L, Long.MIN_VALUE, null);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }

    public String getSeriesKey() {
        return seriesKey;
    }

    /**
     * Lifetime number of accepted observations of the window after this call.
     */
    public long getSequence() {
        return sequence;
    }

    /**
     * Number of observations retained by the window after this call.
     */
    public int getCount() {
        return count;
    }

    public long getFingerprint() {
        return fingerprint;
    }

    /**
     * Timestamp of the most recent accepted observation, {@link Long#MIN_VALUE} if none.
     */
    public long getLastAcceptedTimestamp() {
        return lastAcceptedTimestamp;
    }

    /**
     * Snapshot of the window right after an accepted append, when one was requested.
     */
    public Optional<WindowSnapshot> getSnapshot() {
        return Optional.ofNullable(snapshot);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AppendResult that = (AppendResult) o;
        return sequence == that.sequence
                && count == that.count
                && fingerprint == that.fingerprint
                && lastAcceptedTimestamp == that.lastAcceptedTimestamp
                && status == that.status
                && Objects.equals(seriesKey, that.seriesKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, seriesKey, sequence, count, fingerprint, lastAcceptedTimestamp);
    }

    @Override
    public String toString() {
        return "AppendResult{" +
                "status=" + status +
                ", seriesKey='" + seriesKey + '\'' +
                ", sequence=" + sequence +
                ", count=" + count +
                '}';
    }
}
