package com.seriesguard.throttler;

import java.util.Objects;

/**
 * Token bucket parameters: the burst size and the sustained rate.
 */
public final class RateLimit {

    private final int capacity;
    private final double refillPerSecond;

    /**
     * @param capacity maximum number of tokens, also the initial fill
     * @param refillPerSecond tokens added per second of elapsed time
     * @throws IllegalArgumentException if either value is not positive
     */
    public RateLimit(int capacity, double refillPerSecond) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (!(refillPerSecond > 0.0) || Double.isInfinite(refillPerSecond)) {
            throw new IllegalArgumentException("refillPerSecond must be positive and finite");
        }
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
    }

    public int getCapacity() {
        return capacity;
    }

    public double getRefillPerSecond() {
        return refillPerSecond;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RateLimit that = (RateLimit) o;
        return capacity == that.capacity && Double.compare(that.refillPerSecond, refillPerSecond) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(capacity, refillPerSecond);
    }

    @Override
    public String toString() {
        return "RateLimit{capacity=" + capacity + ", refillPerSecond=" + refillPerSecond + '}';
    }
}
