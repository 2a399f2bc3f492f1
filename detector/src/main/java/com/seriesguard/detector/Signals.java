package com.seriesguard.detector;

import java.util.Objects;

/**
 * Raw measurements behind a classification. Values that could not be computed for a window are
 * {@link Double#NaN}.
 */
public final class Signals {

    static final Signals NONE = new Signals(0.0, Double.NaN, Double.NaN, Double.NaN);

    private final double zScore;
    private final double recentSlope;
    private final double baselineSlope;
    private final double seasonalDeviation;

    /**
     * @param zScore z-score of the latest value against the preceding values of the window
     * @param recentSlope normalised slope of the latest trend horizon
     * @param baselineSlope normalised slope of the horizon before it
     * @param seasonalDeviation deviation from the same-phase seasonal baseline
     */
    public Signals(double zScore, double recentSlope, double baselineSlope, double seasonalDeviation) {
        this.zScore = zScore;
        this.recentSlope = recentSlope;
        this.baselineSlope = baselineSlope;
        this.seasonalDeviation = seasonalDeviation;
    }

    public double getZScore() {
        return zScore;
    }

    public double getRecentSlope() {
        return recentSlope;
    }

    public double getBaselineSlope() {
        return baselineSlope;
    }

    public double getSeasonalDeviation() {
        return seasonalDeviation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Signals signals = (Signals) o;
        return Double.compare(signals.zScore, zScore) == 0
                && Double.compare(signals.recentSlope, recentSlope) == 0
                && Double.compare(signals.baselineSlope, baselineSlope) == 0
                && Double.compare(signals.seasonalDeviation, seasonalDeviation) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(zScore, recentSlope, baselineSlope, seasonalDeviation);
    }

    @Override
    public String toString() {
        return String.format("Signals{z=%.3f, recentSlope=%.3f, baselineSlope=%.3f, seasonalDeviation=%.3f}",
                zScore, recentSlope, baselineSlope, seasonalDeviation);
    }
}
