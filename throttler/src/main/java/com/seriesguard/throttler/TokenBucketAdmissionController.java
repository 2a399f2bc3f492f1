package com.seriesguard.throttler;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thread-safe {@link AdmissionController} backed by one token bucket per subject and operation
 * kind.
 *
 * <h2>Algorithm</h2>
 * Each (subject, kind) pair owns a bucket created full on first use. When a request arrives:
 * <ol>
 *   <li>The bucket is topped up with {@code elapsed * refillPerSecond} tokens, capped at the
 *       capacity of the kind's {@link RateLimit}.</li>
 *   <li>If at least one token is left it is consumed and the request is admitted.</li>
 *   <li>Otherwise the request is rejected and the bucket is left unchanged.</li>
 * </ol>
 *
 * <p>Kinds without a configured limit are always admitted. Buckets of different subjects never
 * contend with each other; calls for the same subject serialize on its bucket. Buckets that have
 * refilled completely and stayed idle for {@code idleTimeout} are dropped by {@link #reapIdle()}.
 */
public class TokenBucketAdmissionController implements AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketAdmissionController.class);

    private final Map<OperationKind, RateLimit> limits;
    private final long idleMillis;
    private final Clock clock;
    private final ConcurrentHashMap<BucketKey, TokenBucket> buckets = new ConcurrentHashMap<>();

    /**
     * Creates a controller using the system UTC clock.
     *
     * @param limits the limit of each kind; kinds missing from the map are not limited
     * @param idleTimeout how long a full bucket must stay unused before it is reaped
     */
    public TokenBucketAdmissionController(@Nonnull Map<OperationKind, RateLimit> limits,
                                          @Nonnull Duration idleTimeout) {
        this(limits, idleTimeout, Clock.systemUTC());
    }

    /**
     * Creates a controller with a specific clock, mainly for testing purposes.
     *
     * @param limits the limit of each kind; kinds missing from the map are not limited
     * @param idleTimeout how long a full bucket must stay unused before it is reaped
     * @param clock the clock to use for refilling
     */
    public TokenBucketAdmissionController(@Nonnull Map<OperationKind, RateLimit> limits,
                                          @Nonnull Duration idleTimeout, @Nonnull Clock clock) {
        Objects.requireNonNull(limits, "limits");
        if (idleTimeout == null || idleTimeout.isZero() || idleTimeout.isNegative()) {
            throw new IllegalArgumentException("idleTimeout must be positive");
        }
        EnumMap<OperationKind, RateLimit> copy = new EnumMap<>(OperationKind.class);
        for (Map.Entry<OperationKind, RateLimit> e : limits.entrySet()) {
            copy.put(Objects.requireNonNull(e.getKey(), "kind"), Objects.requireNonNull(e.getValue(), "limit"));
        }
        this.limits = copy;
        this.idleMillis = idleTimeout.toMillis();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates a controller limiting a single kind of operation.
     */
    public static TokenBucketAdmissionController forKind(@Nonnull OperationKind kind, @Nonnull RateLimit limit,
                                                         @Nonnull Duration idleTimeout, @Nonnull Clock clock) {
        EnumMap<OperationKind, RateLimit> limits = new EnumMap<>(OperationKind.class);
        limits.put(Objects.requireNonNull(kind, "kind"), limit);
        return new TokenBucketAdmissionController(limits, idleTimeout, clock);
    }

    @Override
    public boolean allow(@Nonnull String subject, @Nonnull OperationKind kind) {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(kind, "kind");
        RateLimit limit = limits.get(kind);
        if (limit == null) {
            return true;
        }
        long now = clock.millis();
        BucketKey key = new BucketKey(subject, kind);
        while (true) {
            TokenBucket bucket = buckets.computeIfAbsent(key, k -> new TokenBucket(limit, now));
            switch (bucket.tryConsume(now)) {
                case ADMITTED:
                    return true;
                case REJECTED:
                    log.debug("Rejected {} request from '{}'", kind, subject);
                    return false;
                default:
                    // reaped concurrently, unlink it in case the reaper has not yet
                    buckets.remove(key, bucket);
            }
        }
    }

    @Override
    public int reapIdle() {
        long now = clock.millis();
        int reaped = 0;
        for (Map.Entry<BucketKey, TokenBucket> e : buckets.entrySet()) {
            TokenBucket bucket = e.getValue();
            if (bucket.retireIfIdleAndFull(now, idleMillis) && buckets.remove(e.getKey(), bucket)) {
                reaped++;
            }
        }
        if (reaped > 0) {
            log.debug("Reaped {} idle rate limit buckets", reaped);
        }
        return reaped;
    }

    /**
     * Returns the tokens currently available to a subject, or the full capacity if it has no
     * bucket yet.
     *
     * @throws IllegalArgumentException if the kind is not limited
     */
    public double availableTokens(@Nonnull String subject, @Nonnull OperationKind kind) {
        RateLimit limit = limits.get(Objects.requireNonNull(kind, "kind"));
        if (limit == null) {
            throw new IllegalArgumentException("No limit configured for " + kind);
        }
        TokenBucket bucket = buckets.get(new BucketKey(Objects.requireNonNull(subject, "subject"), kind));
        return bucket == null ? limit.getCapacity() : bucket.availableTokens(clock.millis());
    }

    public int bucketCount() {
        return buckets.size();
    }

    private static final class BucketKey {
        private final String subject;
        private final OperationKind kind;

        BucketKey(String subject, OperationKind kind) {
            this.subject = subject;
            this.kind = kind;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BucketKey)) return false;
            BucketKey that = (BucketKey) o;
            return kind == that.kind && subject.equals(that.subject);
        }

        @Override
        public int hashCode() {
            return 31 * subject.hashCode() + kind.hashCode();
        }
    }
}
