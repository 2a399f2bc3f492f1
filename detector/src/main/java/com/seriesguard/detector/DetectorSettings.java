package com.seriesguard.detector;

/**
 * Thresholds used by {@link StatisticalPatternDetector}.
 *
 * <p>Instances are immutable and built through {@link #builder()}. Unset values keep their
 * defaults.
 */
public final class DetectorSettings {

    public static final int DEFAULT_MIN_SAMPLES = 5;
    public static final double DEFAULT_Z_THRESHOLD = 3.0;
    public static final int DEFAULT_TREND_HORIZON = 8;
    public static final double DEFAULT_TREND_SLOPE_THRESHOLD = 0.1;
    public static final double DEFAULT_TREND_SIGNIFICANCE = 0.05;
    public static final double DEFAULT_SEASONAL_TOLERANCE = 3.0;

    private final int minSamples;
    private final double zThreshold;
    private final int trendHorizon;
    private final double trendSlopeThreshold;
    private final double trendSignificance;
    private final double seasonalTolerance;

    private DetectorSettings(Builder builder) {
        if (builder.minSamples < 2) {
            throw new IllegalArgumentException("minSamples must be at least 2");
        }
        if (!(builder.zThreshold > 0.0)) {
            throw new IllegalArgumentException("zThreshold must be positive");
        }
        if (builder.trendHorizon < 2) {
            throw new IllegalArgumentException("trendHorizon must be at least 2");
        }
        if (!(builder.trendSlopeThreshold > 0.0)) {
            throw new IllegalArgumentException("trendSlopeThreshold must be positive");
        }
        if (!(builder.trendSignificance > 0.0 && builder.trendSignificance < 1.0)) {
            throw new IllegalArgumentException("trendSignificance must be in (0, 1)");
        }
        if (!(builder.seasonalTolerance > 0.0)) {
            throw new IllegalArgumentException("seasonalTolerance must be positive");
        }
        this.minSamples = builder.minSamples;
        this.zThreshold = builder.zThreshold;
        this.trendHorizon = builder.trendHorizon;
        this.trendSlopeThreshold = builder.trendSlopeThreshold;
        this.trendSignificance = builder.trendSignificance;
        this.seasonalTolerance = builder.seasonalTolerance;
    }

    public static DetectorSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Windows holding fewer observations are reported as insufficient data.
     */
    public int getMinSamples() {
        return minSamples;
    }

    /**
     * Absolute z-score at or above which the latest value is a spike.
     */
    public double getZThreshold() {
        return zThreshold;
    }

    /**
     * Number of points in each of the two linear fits compared for trend shifts.
     */
    public int getTrendHorizon() {
        return trendHorizon;
    }

    /**
     * Minimum slope magnitude, in window standard deviations per sample, for a fit to count as a
     * trend.
     */
    public double getTrendSlopeThreshold() {
        return trendSlopeThreshold;
    }

    /**
     * Largest p-value of the slope t-test at which a fit still counts as a trend. Both fits must
     * pass it, so noise alone rarely produces a trend shift.
     */
    public double getTrendSignificance() {
        return trendSignificance;
    }

    /**
     * Maximum deviation from the same-phase baseline, in window standard deviations, before the
     * latest value breaks seasonality.
     */
    public double getSeasonalTolerance() {
        return seasonalTolerance;
    }

    @Override
    public String toString() {
        return "DetectorSettings{" +
                "minSamples=" + minSamples +
                ", zThreshold=" + zThreshold +
                ", trendHorizon=" + trendHorizon +
                ", trendSlopeThreshold=" + trendSlopeThreshold +
                ", trendSignificance=" + trendSignificance +
                ", seasonalTolerance=" + seasonalTolerance +
                '}';
    }

    public static final class Builder {
        private int minSamples = DEFAULT_MIN_SAMPLES;
        private double zThreshold = DEFAULT_Z_THRESHOLD;
        private int trendHorizon = DEFAULT_TREND_HORIZON;
        private double trendSlopeThreshold = DEFAULT_TREND_SLOPE_THRESHOLD;
        private double trendSignificance = DEFAULT_TREND_SIGNIFICANCE;
        private double seasonalTolerance = DEFAULT_SEASONAL_TOLERANCE;

        private Builder() {
        }

        public Builder minSamples(int minSamples) {
            this.minSamples = minSamples;
            return this;
        }

        public Builder zThreshold(double zThreshold) {
            this.zThreshold = zThreshold;
            return this;
        }

        public Builder trendHorizon(int trendHorizon) {
            this.trendHorizon = trendHorizon;
            return this;
        }

        public Builder trendSlopeThreshold(double trendSlopeThreshold) {
            this.trendSlopeThreshold = trendSlopeThreshold;
            return this;
        }

        public Builder trendSignificance(double trendSignificance) {
            this.trendSignificance = trendSignificance;
            return this;
        }

        public Builder seasonalTolerance(double seasonalTolerance) {
            this.seasonalTolerance = seasonalTolerance;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a threshold is out of range
         */
        public DetectorSettings build() {
            return new DetectorSettings(this);
        }
    }
}
