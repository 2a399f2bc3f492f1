package com.seriesguard.throttler;

/**
 * Token bucket refilled lazily from the elapsed time between calls.
 *
 * <p>All methods synchronize on the bucket. Tokens always stay within {@code [0, capacity]}. A
 * clock that moves backwards adds no tokens and does not move the refill mark back, so a later
 * forward step is not counted twice.
 *
 * <p>A bucket is retired under its monitor before it is unlinked from its controller. A retired
 * bucket admits nothing; callers holding a stale reference must look the bucket up again.
 */
final class TokenBucket {

    enum Outcome {
        ADMITTED,
        REJECTED,
        RETIRED
    }

    private final int capacity;
    private final double refillPerMilli;

    private double tokens;
    private long lastRefillMillis;
    private long lastUsedMillis;
    private boolean retired = false;

    TokenBucket(RateLimit limit, long nowMillis) {
        this.capacity = limit.getCapacity();
        this.refillPerMilli = limit.getRefillPerSecond() / 1000.0;
        this.tokens = capacity;
        this.lastRefillMillis = nowMillis;
        this.lastUsedMillis = nowMillis;
    }

    synchronized Outcome tryConsume(long nowMillis) {
        if (retired) {
            return Outcome.RETIRED;
        }
        refill(nowMillis);
        lastUsedMillis = Math.max(lastUsedMillis, nowMillis);
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return Outcome.ADMITTED;
        }
        return Outcome.REJECTED;
    }

    /**
     * Retires the bucket if it has been left alone for at least {@code idleMillis} and is full
     * again, so dropping it changes nothing for its subject.
     *
     * @return whether the bucket is now retired
     */
    synchronized boolean retireIfIdleAndFull(long nowMillis, long idleMillis) {
        if (retired) {
            return true;
        }
        refill(nowMillis);
        if (nowMillis - lastUsedMillis >= idleMillis && tokens >= capacity) {
            retired = true;
        }
        return retired;
    }

    synchronized double availableTokens(long nowMillis) {
        refill(nowMillis);
        return tokens;
    }

    private void refill(long nowMillis) {
        if (nowMillis <= lastRefillMillis) {
            return;
        }
        long elapsed = nowMillis - lastRefillMillis;
        tokens = Math.min(capacity, tokens + elapsed * refillPerMilli);
        lastRefillMillis = nowMillis;
    }
}
