package com.seriesguard.dispatch;

import com.seriesguard.detector.PatternResult;
import java.time.Instant;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * A detection result waiting for delivery, stamped with the time it was queued.
 */
public final class DispatchItem {

    private final PatternResult result;
    private final Instant enqueuedAt;

    public DispatchItem(@Nonnull PatternResult result, @Nonnull Instant enqueuedAt) {
        this.result = Objects.requireNonNull(result, "result");
        this.enqueuedAt = Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    }

    public String getSeriesKey() {
        return result.getSeriesKey();
    }

    public PatternResult getResult() {
        return result;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DispatchItem that = (DispatchItem) o;
        return result.equals(that.result) && enqueuedAt.equals(that.enqueuedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(result, enqueuedAt);
    }

    @Override
    public String toString() {
        return "DispatchItem{" +
                "seriesKey='" + getSeriesKey() + '\'' +
                ", classification=" + result.getClassification() +
                ", enqueuedAt=" + enqueuedAt +
                '}';
    }
}
