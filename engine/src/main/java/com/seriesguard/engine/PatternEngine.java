package com.seriesguard.engine;

import com.seriesguard.cache.LruTtlResultCache;
import com.seriesguard.cache.ResultCache;
import com.seriesguard.detector.PatternDetector;
import com.seriesguard.detector.PatternResult;
import com.seriesguard.detector.StatisticalPatternDetector;
import com.seriesguard.dispatch.DispatchQueue;
import com.seriesguard.dispatch.DropOldestDispatchQueue;
import com.seriesguard.throttler.AdmissionController;
import com.seriesguard.throttler.OperationKind;
import com.seriesguard.throttler.RateLimit;
import com.seriesguard.throttler.TokenBucketAdmissionController;
import com.seriesguard.window.AppendResult;
import com.seriesguard.window.ConcurrentSeriesWindowStore;
import com.seriesguard.window.Observation;
import com.seriesguard.window.SeriesWindowStore;
import com.seriesguard.window.WindowSnapshot;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inbound boundary tying the window store, detector, result cache, admission control and dispatch
 * queue together.
 * <p>
 * <b>Ingestion</b> validates the call, charges the client's ingest budget (and the series budget
 * when one is configured), then appends the observation. Every {@code detectionInterval}-th
 * accepted observation of a series triggers a detection whose result is cached and, when anomalous
 * or when normal results are dispatched too, queued for delivery.
 * </p>
 * <p>
 * <b>Queries</b> charge the client's query budget, then serve the cached result of the series if it
 * was computed from the current window state, or detect on the spot and cache the result.
 * </p>
 * <p>
 * No call throws for any input. Failures are reported through {@link IngestOutcome} and
 * {@link QueryOutcome}; an unexpected detector failure is logged and counted.
 * </p>
 * <p>
 * All methods are thread-safe. Calls for different series only meet in the cache and in the
 * limiters, both of which lock per entry.
 * </p>
 */
public class PatternEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PatternEngine.class);
    private static final long TERMINATION_TIMEOUT_MS = 5_000;

    private final EngineConfig config;
    private final Clock clock;
    private final SeriesWindowStore store;
    private final PatternDetector detector;
    private final ResultCache cache;
    private final AdmissionController clientLimiter;
    private final AdmissionController seriesLimiter;
    private final DispatchQueue dispatchQueue;
    private final Instant startedAt;

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong rateLimited = new AtomicLong();
    private final AtomicLong queries = new AtomicLong();
    private final AtomicLong detectionFailures = new AtomicLong();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile ScheduledExecutorService maintenanceScheduler;

    public PatternEngine(@Nonnull EngineConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Creates an engine with the default components, using the given clock for every time-based
     * decision.
     */
    public PatternEngine(@Nonnull EngineConfig config, @Nonnull Clock clock) {
        this(config, clock,
                new ConcurrentSeriesWindowStore(config.getWindowCapacity(), config.getSeasonalPeriod(),
                        config.getWindowIdleEviction(), clock),
                new StatisticalPatternDetector(config.getDetectorSettings(), clock),
                new LruTtlResultCache(config.getCacheTtl(), config.getCacheCapacity(), clock),
                clientLimiter(config, clock),
                seriesLimiter(config, clock),
                new DropOldestDispatchQueue(config.getDispatchCapacity(), clock));
    }

    PatternEngine(EngineConfig config, Clock clock, SeriesWindowStore store, PatternDetector detector,
                  ResultCache cache, AdmissionController clientLimiter, @Nullable AdmissionController seriesLimiter,
                  DispatchQueue dispatchQueue) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.store = Objects.requireNonNull(store, "store");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.clientLimiter = Objects.requireNonNull(clientLimiter, "clientLimiter");
        this.seriesLimiter = seriesLimiter;
        this.dispatchQueue = Objects.requireNonNull(dispatchQueue, "dispatchQueue");
        this.startedAt = clock.instant();
    }

    private static AdmissionController clientLimiter(EngineConfig config, Clock clock) {
        Map<OperationKind, RateLimit> limits = new EnumMap<>(OperationKind.class);
        limits.put(OperationKind.INGEST, config.getIngestLimit());
        limits.put(OperationKind.QUERY, config.getQueryLimit());
        return new TokenBucketAdmissionController(limits, config.getRateLimitIdleReap(), clock);
    }

    private static AdmissionController seriesLimiter(EngineConfig config, Clock clock) {
        RateLimit limit = config.getSeriesIngestLimit();
        if (limit == null) {
            return null;
        }
        return TokenBucketAdmissionController.forKind(OperationKind.INGEST, limit, config.getRateLimitIdleReap(), clock);
    }

    /**
     * Records one observation.
     *
     * @param clientId the calling client, charged for the ingestion
     * @param seriesKey the series the observation belongs to
     * @param timestamp epoch milliseconds, not before the last accepted timestamp of the series
     * @param value the measured value, must be finite
     * @return the outcome; never {@code null}
     */
    public IngestOutcome ingestObservation(String clientId, String seriesKey, long timestamp, double value) {
        if (!isValidClient(clientId)) {
            return reject(IngestOutcome.RejectReason.INVALID_CLIENT);
        }
        if (!Observation.isValidSeriesKey(seriesKey)) {
            return reject(IngestOutcome.RejectReason.INVALID_SERIES_KEY);
        }
        if (!Double.isFinite(value)) {
            return reject(IngestOutcome.RejectReason.INVALID_VALUE);
        }
        if (!clientLimiter.allow(clientId, OperationKind.INGEST)) {
            rateLimited.incrementAndGet();
            return IngestOutcome.rateLimited();
        }
        if (seriesLimiter != null && !seriesLimiter.allow(seriesKey, OperationKind.INGEST)) {
            rateLimited.incrementAndGet();
            return IngestOutcome.rateLimited();
        }

        AppendResult appended = store.append(new Observation(seriesKey, timestamp, value),
                config.getDetectionInterval());
        switch (appended.getStatus()) {
            case OUT_OF_ORDER:
                return reject(IngestOutcome.RejectReason.OUT_OF_ORDER);
            case INVALID_VALUE:
                return reject(IngestOutcome.RejectReason.INVALID_VALUE);
            default:
                break;
        }
        accepted.incrementAndGet();
        appended.getSnapshot().ifPresent(this::detectAndPublish);
        return IngestOutcome.accepted();
    }

    private void detectAndPublish(WindowSnapshot snapshot) {
        Optional<PatternResult> detected = detect(snapshot);
        if (!detected.isPresent()) {
            return;
        }
        PatternResult result = detected.get();
        cache.put(result);
        if (result.getClassification().isAnomalous() || config.isDispatchNormalResults()) {
            if (!dispatchQueue.enqueue(result)) {
                log.debug("Dispatch queue closed, result for series '{}' not delivered", result.getSeriesKey());
            }
        }
    }

    /**
     * Returns the detection result for the current window of a series.
     *
     * @param clientId the calling client, charged for the query
     * @param seriesKey the series to query
     * @return the outcome; never {@code null}
     */
    public QueryOutcome queryPattern(String clientId, String seriesKey) {
        queries.incrementAndGet();
        if (!isValidClient(clientId) || !Observation.isValidSeriesKey(seriesKey)) {
            return QueryOutcome.notFound();
        }
        if (!clientLimiter.allow(clientId, OperationKind.QUERY)) {
            rateLimited.incrementAndGet();
            return QueryOutcome.rateLimited();
        }
        Optional<WindowSnapshot> snapshot = store.snapshot(seriesKey);
        if (!snapshot.isPresent()) {
            return QueryOutcome.notFound();
        }
        Optional<PatternResult> cached = cache.get(seriesKey, snapshot.get().getFingerprint());
        if (cached.isPresent()) {
            return QueryOutcome.found(cached.get());
        }
        Optional<PatternResult> detected = detect(snapshot.get());
        if (!detected.isPresent()) {
            return QueryOutcome.notFound();
        }
        cache.put(detected.get());
        return QueryOutcome.found(detected.get());
    }

    private Optional<PatternResult> detect(WindowSnapshot snapshot) {
        try {
            return Optional.of(detector.detect(snapshot));
        } catch (RuntimeException e) {
            detectionFailures.incrementAndGet();
            log.error("Detection failed for series '{}' at sequence {}", snapshot.getSeriesKey(),
                    snapshot.getSequence(), e);
            return Optional.empty();
        }
    }

    private IngestOutcome reject(IngestOutcome.RejectReason reason) {
        rejected.incrementAndGet();
        return IngestOutcome.rejected(reason);
    }

    private static boolean isValidClient(String clientId) {
        return clientId != null && !clientId.isBlank();
    }

    /**
     * Evicts idle windows together with their cached results, purges expired cache entries and
     * drops idle rate limit buckets.
     */
    public void runMaintenance() {
        Set<String> evicted = store.evictIdle();
        for (String seriesKey : evicted) {
            cache.invalidate(seriesKey);
        }
        int expired = cache.purgeExpired();
        int reaped = clientLimiter.reapIdle();
        if (seriesLimiter != null) {
            reaped += seriesLimiter.reapIdle();
        }
        log.debug("Maintenance: {} windows evicted, {} results expired, {} buckets reaped",
                evicted.size(), expired, reaped);
    }

    /**
     * Starts running {@link #runMaintenance()} every {@code maintenanceInterval} on a daemon
     * thread. Calling it again has no effect.
     *
     * @throws IllegalStateException if the engine has been closed
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Engine is closed");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "series-guard-maintenance");
            t.setDaemon(true);
            return t;
        });
        long period = config.getMaintenanceInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::maintenanceTick, period, period, TimeUnit.MILLISECONDS);
        maintenanceScheduler = scheduler;
        log.info("Pattern engine started, maintenance every {}", config.getMaintenanceInterval());
    }

    private void maintenanceTick() {
        try {
            runMaintenance();
        } catch (RuntimeException e) {
            log.error("Maintenance run failed", e);
        }
    }

    public EngineStatus status() {
        return new EngineStatus(startedAt, store.size(), cache.statistics(), dispatchQueue.size(),
                dispatchQueue.droppedCount(), accepted.get(), rejected.get(), rateLimited.get(),
                queries.get(), detectionFailures.get());
    }

    /**
     * The queue detection results are published to. Consumers attach here, for instance through a
     * {@link com.seriesguard.dispatch.DeliveryWorker}.
     */
    public DispatchQueue getDispatchQueue() {
        return dispatchQueue;
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * Stops scheduled maintenance and closes the dispatch queue. Ingestion and queries keep working
     * afterwards, but results are no longer queued for delivery.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        ScheduledExecutorService scheduler = maintenanceScheduler;
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(TERMINATION_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        dispatchQueue.close();
        log.info("Pattern engine closed: {}", status());
    }
}
