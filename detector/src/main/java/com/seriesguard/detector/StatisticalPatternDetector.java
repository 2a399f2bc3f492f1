package com.seriesguard.detector;

import com.seriesguard.window.WindowSnapshot;
import java.time.Clock;
import java.util.Objects;
import javax.annotation.Nonnull;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule-based detector working on the aggregates and values carried by a {@link WindowSnapshot}.
 * <p>
 * Three independent checks are evaluated for the latest value of the window:
 * </p>
 * <ol>
 *   <li><b>Spike:</b> the z-score of the latest value against the mean and variance of the values
 *       before it. Those are derived from the snapshot aggregates by removing the latest value,
 *       so a large outlier does not dilute its own score. {@code |z| >= zThreshold} is a spike.</li>
 *   <li><b>Trend shift:</b> an ordinary least squares fit ({@link SimpleRegression}) over the
 *       last {@code trendHorizon} points and another over the {@code trendHorizon} points before
 *       them. Each fit must be significant, its slope t-test p-value at most
 *       {@code trendSignificance}. Slopes are normalised by the window standard deviation.
 *       Opposite signs with both fits significant and both magnitudes at or above
 *       {@code trendSlopeThreshold} is a trend shift.</li>
 *   <li><b>Seasonal break:</b> once a full seasonal period has been observed, the deviation of the
 *       latest value from the value recorded at the same phase of the previous period, in window
 *       standard deviations. A deviation above {@code seasonalTolerance} breaks seasonality.</li>
 * </ol>
 * <p>
 * The winning classification follows {@link Classification#getPriority()}. The score is always the
 * absolute z-score.
 * </p>
 * <p>
 * <b>Numeric edge cases:</b> a window below {@code minSamples} observations is reported as
 * {@link Classification#NORMAL} with score zero and the insufficient-data flag. A zero-variance
 * window yields a z-score of zero. When only the values before the latest one are constant, the
 * score falls back to the variance of the whole window, which is bounded by {@code sqrt(n - 1)}.
 * </p>
 * <p>
 * The detector keeps no mutable state; one instance can serve all series concurrently.
 * </p>
 */
public class StatisticalPatternDetector implements PatternDetector {

    private static final Logger log = LoggerFactory.getLogger(StatisticalPatternDetector.class);

    /** Relative magnitude below which a standard deviation is treated as zero. */
    private static final double ZERO_SCALE = 1e-12;
    /** Share of the window spread the preceding values must hold to be used as the z-score base. */
    private static final double PRIOR_SPREAD_RATIO = 1e-9;

    private final DetectorSettings settings;
    private final Clock clock;

    public StatisticalPatternDetector(@Nonnull DetectorSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public StatisticalPatternDetector(@Nonnull DetectorSettings settings, @Nonnull Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public PatternResult detect(@Nonnull WindowSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (snapshot.getCount() < settings.getMinSamples()) {
            return PatternResult.insufficientData(snapshot.getSeriesKey(), snapshot.getGeneration(),
                    snapshot.getFingerprint(), snapshot.getSequence(), clock.instant());
        }

        double z = zScore(snapshot);
        double[] fits = trendFits(snapshot);
        double seasonalDeviation = seasonalDeviation(snapshot);

        Classification classification = Classification.NORMAL;
        if (Math.abs(z) >= settings.getZThreshold()) {
            classification = classification.strongest(Classification.SPIKE);
        }
        if (isTrendShift(fits)) {
            classification = classification.strongest(Classification.TREND_SHIFT);
        }
        if (seasonalDeviation > settings.getSeasonalTolerance()) {
            classification = classification.strongest(Classification.SEASONAL_BREAK);
        }

        Signals signals = new Signals(z, fits[0], fits[1], seasonalDeviation);
        if (classification.isAnomalous()) {
            log.debug("Series '{}' classified {} ({})", snapshot.getSeriesKey(), classification, signals);
        }
        return new PatternResult(snapshot.getSeriesKey(), snapshot.getGeneration(), snapshot.getFingerprint(),
                snapshot.getSequence(), Math.abs(z), classification, false, signals, clock.instant());
    }

    /**
     * Computes the z-score of the latest value against the values preceding it.
     */
    static double zScore(WindowSnapshot snapshot) {
        int n = snapshot.getCount();
        double latest = snapshot.getLatestValue();
        double mean = snapshot.getMean();
        double variance = snapshot.getVariance();
        if (isZeroScale(Math.sqrt(variance), mean)) {
            return 0.0;
        }

        // remove the latest value from the running aggregates (inverse Welford step)
        double priorMean = (n * mean - latest) / (n - 1);
        double windowM2 = n * variance;
        double priorM2 = windowM2 - (latest - mean) * (latest - priorMean);

        // below this the remainder is cancellation noise, the preceding values were constant
        if (priorM2 > PRIOR_SPREAD_RATIO * windowM2) {
            return (latest - priorMean) / Math.sqrt(priorM2 / (n - 1));
        }
        return (latest - mean) / Math.sqrt(variance);
    }

    /**
     * Fits the two most recent trend horizons.
     *
     * @return {@code [recentSlope, baselineSlope, recentPValue, baselinePValue]}, slopes
     *         {@code NaN} when the window is too short
     */
    double[] trendFits(WindowSnapshot snapshot) {
        int horizon = settings.getTrendHorizon();
        int n = snapshot.getCount();
        if (n < 2 * horizon) {
            return new double[] {Double.NaN, Double.NaN, 1.0, 1.0};
        }
        double std = snapshot.getStandardDeviation();
        if (isZeroScale(std, snapshot.getMean())) {
            return new double[] {0.0, 0.0, 1.0, 1.0};
        }
        SimpleRegression recent = fit(snapshot, n - horizon, horizon);
        SimpleRegression baseline = fit(snapshot, n - 2 * horizon, horizon);
        return new double[] {recent.getSlope() / std, baseline.getSlope() / std,
                significance(recent), significance(baseline)};
    }

    private static SimpleRegression fit(WindowSnapshot snapshot, int from, int length) {
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < length; i++) {
            regression.addData(i, snapshot.getValue(from + i));
        }
        return regression;
    }

    /**
     * p-value of the hypothesis that the slope is zero. A perfect fit has no residual error and
     * is maximally significant.
     */
    private static double significance(SimpleRegression regression) {
        if (regression.getSumSquaredErrors() == 0.0) {
            return regression.getSlope() == 0.0 ? 1.0 : 0.0;
        }
        return regression.getSignificance();
    }

    private boolean isTrendShift(double[] fits) {
        double recentSlope = fits[0];
        double baselineSlope = fits[1];
        if (Double.isNaN(recentSlope) || Double.isNaN(baselineSlope)) {
            return false;
        }
        double threshold = settings.getTrendSlopeThreshold();
        double alpha = settings.getTrendSignificance();
        return Math.signum(recentSlope) != Math.signum(baselineSlope)
                && Math.abs(recentSlope) >= threshold
                && Math.abs(baselineSlope) >= threshold
                && fits[2] <= alpha
                && fits[3] <= alpha;
    }

    /**
     * Measures how far the latest value strays from the same phase of the previous period.
     *
     * @return the deviation in window standard deviations, the absolute deviation when the window
     *         has no spread, or {@code NaN} when no seasonal baseline exists
     */
    static double seasonalDeviation(WindowSnapshot snapshot) {
        if (!snapshot.hasSeasonalBaseline()) {
            return Double.NaN;
        }
        double expected = snapshot.getSeasonalBaseline(snapshot.getLatestPhase());
        double deviation = Math.abs(snapshot.getLatestValue() - expected);
        double std = snapshot.getStandardDeviation();
        if (isZeroScale(std, snapshot.getMean())) {
            return deviation;
        }
        return deviation / std;
    }

    private static boolean isZeroScale(double std, double reference) {
        return std <= ZERO_SCALE * Math.max(1.0, Math.abs(reference));
    }

    public DetectorSettings getSettings() {
        return settings;
    }
}
