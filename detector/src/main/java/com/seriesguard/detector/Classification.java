package com.seriesguard.detector;

/**
 * Pattern classes a detection can produce.
 *
 * <p>When several conditions hold at once the one with the highest {@link #getPriority()} wins:
 * {@code SEASONAL_BREAK > TREND_SHIFT > SPIKE > NORMAL}. Seasonal context overrides local noise.
 */
public enum Classification {
    NORMAL(0),
    SPIKE(1),
    TREND_SHIFT(2),
    SEASONAL_BREAK(3);

    private final int priority;

    Classification(int priority) {
        this.priority = priority;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isAnomalous() {
        return this != NORMAL;
    }

    /**
     * Returns whichever of the two classifications takes precedence.
     *
     * @param other the competing classification
     * @return the classification with the higher priority
     */
    public Classification strongest(Classification other) {
        return other.priority > priority ? other : this;
    }
}
