package com.seriesguard.detector;

import java.time.Instant;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Immutable outcome of one detection over one window state.
 *
 * <p>The {@link #getWindowFingerprint() fingerprint} identifies the window state the result was
 * computed from; a cached result is only valid while the window still has that fingerprint.
 * The {@link #getWindowSequence() sequence} orders results computed from the same
 * {@link #getWindowGeneration() window generation} so that a result computed from an older window
 * state never replaces a newer one.
 */
public final class PatternResult {

    private final String seriesKey;
    private final long windowGeneration;
    private final long windowFingerprint;
    private final long windowSequence;
    private final double score;
    private final Classification classification;
    private final boolean insufficientData;
    private final Signals signals;
    private final Instant computedAt;

    public PatternResult(@Nonnull String seriesKey,
                         long windowFingerprint,
                         long windowSequence,
                         double score,
                         @Nonnull Classification classification,
                         boolean insufficientData,
                         @Nonnull Signals signals,
                         @Nonnull Instant computedAt) {
        this(seriesKey, 0L, windowFingerprint, windowSequence, score, classification, insufficientData, signals,
                computedAt);
    }

    public PatternResult(@Nonnull String seriesKey,
                         long windowGeneration,
                         long windowFingerprint,
                         long windowSequence,
                         double score,
                         @Nonnull Classification classification,
                         boolean insufficientData,
                         @Nonnull Signals signals,
                         @Nonnull Instant computedAt) {
        this.seriesKey = Objects.requireNonNull(seriesKey, "seriesKey");
        this.windowGeneration = windowGeneration;
        this.windowFingerprint = windowFingerprint;
        this.windowSequence = windowSequence;
        this.score = score;
        this.classification = Objects.requireNonNull(classification, "classification");
        this.insufficientData = insufficientData;
        this.signals = Objects.requireNonNull(signals, "signals");
        this.computedAt = Objects.requireNonNull(computedAt, "computedAt");
        if (insufficientData && classification != Classification.NORMAL) {
            throw new IllegalArgumentException("Insufficient data can only be reported as NORMAL");
        }
    }

    /**
     * Creates the low-confidence result reported for windows below the minimum sample count.
     */
    static PatternResult insufficientData(String seriesKey, long windowGeneration, long windowFingerprint,
                                          long windowSequence, Instant computedAt) {
        return new PatternResult(seriesKey, windowGeneration, windowFingerprint, windowSequence, 0.0,
                Classification.NORMAL, true, Signals.NONE, computedAt);
    }

    public String getSeriesKey() {
        return seriesKey;
    }

    public long getWindowGeneration() {
        return windowGeneration;
    }

    public long getWindowFingerprint() {
        return windowFingerprint;
    }

    public long getWindowSequence() {
        return windowSequence;
    }

    /**
     * Anomaly score: the absolute z-score of the latest value.
     */
    public double getScore() {
        return score;
    }

    public Classification getClassification() {
        return classification;
    }

    /**
     * Whether the window held too few samples for a meaningful detection. Such results are
     * always {@link Classification#NORMAL} with a score of zero.
     */
    public boolean isInsufficientData() {
        return insufficientData;
    }

    public Signals getSignals() {
        return signals;
    }

    public Instant getComputedAt() {
        return computedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PatternResult that = (PatternResult) o;
        return windowGeneration == that.windowGeneration
                && windowFingerprint == that.windowFingerprint
                && windowSequence == that.windowSequence
                && Double.compare(that.score, score) == 0
                && insufficientData == that.insufficientData
                && seriesKey.equals(that.seriesKey)
                && classification == that.classification
                && signals.equals(that.signals)
                && computedAt.equals(that.computedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seriesKey, windowGeneration, windowFingerprint, windowSequence, score, classification,
                insufficientData, signals, computedAt);
    }

    @Override
    public String toString() {
        return "PatternResult{" +
                "seriesKey='" + seriesKey + '\'' +
                ", classification=" + classification +
                ", score=" + score +
                ", insufficientData=" + insufficientData +
                ", windowGeneration=" + windowGeneration +
                ", windowSequence=" + windowSequence +
                ", computedAt=" + computedAt +
                '}';
    }
}
