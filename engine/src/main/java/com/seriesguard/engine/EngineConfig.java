package com.seriesguard.engine;

import com.seriesguard.detector.DetectorSettings;
import com.seriesguard.throttler.RateLimit;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable engine configuration.
 *
 * <p>{@link #load()} reads the classpath resource {@value #RESOURCE} and then applies environment
 * overrides. The environment variable of a key is the key upper-cased, with dots and dashes turned
 * into underscores and prefixed with {@value #ENV_PREFIX}: {@code window.capacity} is overridden by
 * {@code SERIES_GUARD_WINDOW_CAPACITY}. Values that cannot be parsed are logged and replaced by the
 * default. Durations are ISO-8601 ({@code PT5M}) or plain milliseconds.
 */
public final class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public static final String RESOURCE = "series-guard.properties";
    public static final String ENV_PREFIX = "SERIES_GUARD_";

    public static final int DEFAULT_WINDOW_CAPACITY = 256;
    public static final Duration DEFAULT_WINDOW_IDLE_EVICTION = Duration.ofMinutes(30);
    public static final int DEFAULT_SEASONAL_PERIOD = 0;
    public static final int DEFAULT_DETECTION_INTERVAL = 1;
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);
    public static final int DEFAULT_CACHE_CAPACITY = 10_000;
    public static final RateLimit DEFAULT_INGEST_LIMIT = new RateLimit(200, 100.0);
    public static final RateLimit DEFAULT_QUERY_LIMIT = new RateLimit(20, 10.0);
    public static final Duration DEFAULT_RATE_LIMIT_IDLE_REAP = Duration.ofMinutes(10);
    public static final int DEFAULT_DISPATCH_CAPACITY = 1_000;
    public static final Duration DEFAULT_MAINTENANCE_INTERVAL = Duration.ofMinutes(1);

    private final int windowCapacity;
    private final Duration windowIdleEviction;
    private final int seasonalPeriod;
    private final DetectorSettings detectorSettings;
    private final int detectionInterval;
    private final Duration cacheTtl;
    private final int cacheCapacity;
    private final RateLimit ingestLimit;
    private final RateLimit queryLimit;
    private final RateLimit seriesIngestLimit;
    private final Duration rateLimitIdleReap;
    private final int dispatchCapacity;
    private final boolean dispatchNormalResults;
    private final Duration maintenanceInterval;

    private EngineConfig(Builder builder) {
        if (builder.windowCapacity <= 0) {
            throw new IllegalArgumentException("windowCapacity must be positive");
        }
        if (builder.seasonalPeriod < 0) {
            throw new IllegalArgumentException("seasonalPeriod must not be negative");
        }
        if (builder.detectionInterval <= 0) {
            throw new IllegalArgumentException("detectionInterval must be positive");
        }
        if (builder.cacheCapacity <= 0) {
            throw new IllegalArgumentException("cacheCapacity must be positive");
        }
        if (builder.dispatchCapacity <= 0) {
            throw new IllegalArgumentException("dispatchCapacity must be positive");
        }
        this.windowCapacity = builder.windowCapacity;
        this.windowIdleEviction = requirePositive(builder.windowIdleEviction, "windowIdleEviction");
        this.seasonalPeriod = builder.seasonalPeriod;
        this.detectorSettings = Objects.requireNonNull(builder.detectorSettings, "detectorSettings");
        this.detectionInterval = builder.detectionInterval;
        this.cacheTtl = requirePositive(builder.cacheTtl, "cacheTtl");
        this.cacheCapacity = builder.cacheCapacity;
        if (builder.ingestLimit == null || builder.queryLimit == null) {
            throw new IllegalArgumentException("ingestLimit and queryLimit must be set");
        }
        this.ingestLimit = builder.ingestLimit;
        this.queryLimit = builder.queryLimit;
        this.seriesIngestLimit = builder.seriesIngestLimit;
        this.rateLimitIdleReap = requirePositive(builder.rateLimitIdleReap, "rateLimitIdleReap");
        this.dispatchCapacity = builder.dispatchCapacity;
        this.dispatchNormalResults = builder.dispatchNormalResults;
        this.maintenanceInterval = requirePositive(builder.maintenanceInterval, "maintenanceInterval");
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Loads the configuration from {@value #RESOURCE} on the classpath and the process
     * environment. A missing resource is not an error; every key then keeps its default.
     *
     * @throws ConfigurationException if the resource cannot be read or the resulting values are
     *         out of range
     */
    public static EngineConfig load() {
        Properties properties = new Properties();
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = EngineConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.info("No {} on the classpath, using defaults and environment", RESOURCE);
            } else {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + RESOURCE, e);
        }
        return fromSources(properties, System.getenv());
    }

    /**
     * Builds a configuration from explicit sources. Environment entries win over properties.
     *
     * @throws ConfigurationException if a parsed value is out of range
     */
    public static EngineConfig fromSources(@Nonnull Properties properties, @Nonnull Map<String, String> env) {
        Source source = new Source(Objects.requireNonNull(properties, "properties"), Objects.requireNonNull(env, "env"));
        DetectorSettings.Builder detector = DetectorSettings.builder()
                .minSamples(source.getInt("detector.min-samples", DetectorSettings.DEFAULT_MIN_SAMPLES))
                .zThreshold(source.getDouble("detector.z-threshold", DetectorSettings.DEFAULT_Z_THRESHOLD))
                .trendHorizon(source.getInt("detector.trend-horizon", DetectorSettings.DEFAULT_TREND_HORIZON))
                .trendSlopeThreshold(source.getDouble("detector.trend-slope-threshold",
                        DetectorSettings.DEFAULT_TREND_SLOPE_THRESHOLD))
                .trendSignificance(source.getDouble("detector.trend-significance",
                        DetectorSettings.DEFAULT_TREND_SIGNIFICANCE))
                .seasonalTolerance(source.getDouble("detector.seasonal-tolerance",
                        DetectorSettings.DEFAULT_SEASONAL_TOLERANCE));
        try {
            EngineConfig config = builder()
                    .windowCapacity(source.getInt("window.capacity", DEFAULT_WINDOW_CAPACITY))
                    .windowIdleEviction(source.getDuration("window.idle-eviction", DEFAULT_WINDOW_IDLE_EVICTION))
                    .seasonalPeriod(source.getInt("detector.seasonal-period", DEFAULT_SEASONAL_PERIOD))
                    .detectorSettings(detector.build())
                    .detectionInterval(source.getInt("detector.interval", DEFAULT_DETECTION_INTERVAL))
                    .cacheTtl(source.getDuration("cache.ttl", DEFAULT_CACHE_TTL))
                    .cacheCapacity(source.getInt("cache.capacity", DEFAULT_CACHE_CAPACITY))
                    .ingestLimit(source.getRateLimit("ratelimit.ingest", DEFAULT_INGEST_LIMIT))
                    .queryLimit(source.getRateLimit("ratelimit.query", DEFAULT_QUERY_LIMIT))
                    .seriesIngestLimit(source.getRateLimit("ratelimit.series-ingest", null))
                    .rateLimitIdleReap(source.getDuration("ratelimit.idle-reap", DEFAULT_RATE_LIMIT_IDLE_REAP))
                    .dispatchCapacity(source.getInt("dispatch.capacity", DEFAULT_DISPATCH_CAPACITY))
                    .dispatchNormalResults(source.getBoolean("dispatch.include-normal", false))
                    .maintenanceInterval(source.getDuration("maintenance.interval", DEFAULT_MAINTENANCE_INTERVAL))
                    .build();
            log.info("EngineConfig loaded: {}", config);
            return config;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid engine configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Maximum number of observations retained per series.
     */
    public int getWindowCapacity() {
        return windowCapacity;
    }

    /**
     * Windows not appended to for this long are evicted by maintenance.
     */
    public Duration getWindowIdleEviction() {
        return windowIdleEviction;
    }

    /**
     * Number of observations in one seasonal cycle, {@code 0} when series are not seasonal.
     */
    public int getSeasonalPeriod() {
        return seasonalPeriod;
    }

    public DetectorSettings getDetectorSettings() {
        return detectorSettings;
    }

    /**
     * Detection runs on every n-th accepted observation of a series.
     */
    public int getDetectionInterval() {
        return detectionInterval;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public int getCacheCapacity() {
        return cacheCapacity;
    }

    public RateLimit getIngestLimit() {
        return ingestLimit;
    }

    public RateLimit getQueryLimit() {
        return queryLimit;
    }

    /**
     * Limit applied per series key on ingestion, or {@code null} when series are not limited.
     */
    @Nullable
    public RateLimit getSeriesIngestLimit() {
        return seriesIngestLimit;
    }

    public Duration getRateLimitIdleReap() {
        return rateLimitIdleReap;
    }

    public int getDispatchCapacity() {
        return dispatchCapacity;
    }

    /**
     * Whether {@code NORMAL} results are queued for delivery alongside anomalies.
     */
    public boolean isDispatchNormalResults() {
        return dispatchNormalResults;
    }

    public Duration getMaintenanceInterval() {
        return maintenanceInterval;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "windowCapacity=" + windowCapacity +
                ", windowIdleEviction=" + windowIdleEviction +
                ", seasonalPeriod=" + seasonalPeriod +
                ", detectorSettings=" + detectorSettings +
                ", detectionInterval=" + detectionInterval +
                ", cacheTtl=" + cacheTtl +
                ", cacheCapacity=" + cacheCapacity +
                ", ingestLimit=" + ingestLimit +
                ", queryLimit=" + queryLimit +
                ", seriesIngestLimit=" + seriesIngestLimit +
                ", rateLimitIdleReap=" + rateLimitIdleReap +
                ", dispatchCapacity=" + dispatchCapacity +
                ", dispatchNormalResults=" + dispatchNormalResults +
                ", maintenanceInterval=" + maintenanceInterval +
                '}';
    }

    public static final class Builder {
        private int windowCapacity = DEFAULT_WINDOW_CAPACITY;
        private Duration windowIdleEviction = DEFAULT_WINDOW_IDLE_EVICTION;
        private int seasonalPeriod = DEFAULT_SEASONAL_PERIOD;
        private DetectorSettings detectorSettings = DetectorSettings.defaults();
        private int detectionInterval = DEFAULT_DETECTION_INTERVAL;
        private Duration cacheTtl = DEFAULT_CACHE_TTL;
        private int cacheCapacity = DEFAULT_CACHE_CAPACITY;
        private RateLimit ingestLimit = DEFAULT_INGEST_LIMIT;
        private RateLimit queryLimit = DEFAULT_QUERY_LIMIT;
        private RateLimit seriesIngestLimit;
        private Duration rateLimitIdleReap = DEFAULT_RATE_LIMIT_IDLE_REAP;
        private int dispatchCapacity = DEFAULT_DISPATCH_CAPACITY;
        private boolean dispatchNormalResults;
        private Duration maintenanceInterval = DEFAULT_MAINTENANCE_INTERVAL;

        private Builder() {
        }

        public Builder windowCapacity(int windowCapacity) {
            this.windowCapacity = windowCapacity;
            return this;
        }

        public Builder windowIdleEviction(Duration windowIdleEviction) {
            this.windowIdleEviction = windowIdleEviction;
            return this;
        }

        public Builder seasonalPeriod(int seasonalPeriod) {
            this.seasonalPeriod = seasonalPeriod;
            return this;
        }

        public Builder detectorSettings(DetectorSettings detectorSettings) {
            this.detectorSettings = detectorSettings;
            return this;
        }

        public Builder detectionInterval(int detectionInterval) {
            this.detectionInterval = detectionInterval;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder cacheCapacity(int cacheCapacity) {
            this.cacheCapacity = cacheCapacity;
            return this;
        }

        public Builder ingestLimit(RateLimit ingestLimit) {
            this.ingestLimit = ingestLimit;
            return this;
        }

        public Builder queryLimit(RateLimit queryLimit) {
            this.queryLimit = queryLimit;
            return this;
        }

        /**
         * @param seriesIngestLimit per-series limit, or {@code null} to disable it
         */
        public Builder seriesIngestLimit(@Nullable RateLimit seriesIngestLimit) {
            this.seriesIngestLimit = seriesIngestLimit;
            return this;
        }

        public Builder rateLimitIdleReap(Duration rateLimitIdleReap) {
            this.rateLimitIdleReap = rateLimitIdleReap;
            return this;
        }

        public Builder dispatchCapacity(int dispatchCapacity) {
            this.dispatchCapacity = dispatchCapacity;
            return this;
        }

        public Builder dispatchNormalResults(boolean dispatchNormalResults) {
            this.dispatchNormalResults = dispatchNormalResults;
            return this;
        }

        public Builder maintenanceInterval(Duration maintenanceInterval) {
            this.maintenanceInterval = maintenanceInterval;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a value is out of range
         */
        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }

    /**
     * Property lookup with environment overrides and lenient parsing.
     */
    private static final class Source {
        private final Properties properties;
        private final Map<String, String> env;

        Source(Properties properties, Map<String, String> env) {
            this.properties = properties;
            this.env = env;
        }

        static String envName(String key) {
            return ENV_PREFIX + key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
        }

        String raw(String key) {
            String value = env.get(envName(key));
            if (value == null || value.isBlank()) {
                value = properties.getProperty(key);
            }
            return value == null || value.isBlank() ? null : value.trim();
        }

        int getInt(String key, int defaultValue) {
            String value = raw(key);
            if (value != null) {
                try {
                    return Integer.parseInt(value);
                } catch (NumberFormatException e) {
                    log.warn("Invalid integer for {}: {}, using default: {}", key, value, defaultValue);
                }
            }
            return defaultValue;
        }

        double getDouble(String key, double defaultValue) {
            String value = raw(key);
            if (value != null) {
                try {
                    return Double.parseDouble(value);
                } catch (NumberFormatException e) {
                    log.warn("Invalid number for {}: {}, using default: {}", key, value, defaultValue);
                }
            }
            return defaultValue;
        }

        boolean getBoolean(String key, boolean defaultValue) {
            String value = raw(key);
            if (value != null) {
                if ("true".equalsIgnoreCase(value)) {
                    return true;
                }
                if ("false".equalsIgnoreCase(value)) {
                    return false;
                }
                log.warn("Invalid boolean for {}: {}, using default: {}", key, value, defaultValue);
            }
            return defaultValue;
        }

        Duration getDuration(String key, Duration defaultValue) {
            String value = raw(key);
            if (value != null) {
                try {
                    if (value.startsWith("P") || value.startsWith("p")) {
                        return Duration.parse(value);
                    }
                    return Duration.ofMillis(Long.parseLong(value));
                } catch (DateTimeParseException | NumberFormatException e) {
                    log.warn("Invalid duration for {}: {}, using default: {}", key, value, defaultValue);
                }
            }
            return defaultValue;
        }

        /**
         * Reads {@code <prefix>.capacity} and {@code <prefix>.refill-per-second}. A capacity of
         * zero disables the limit.
         */
        RateLimit getRateLimit(String prefix, RateLimit defaultValue) {
            int defaultCapacity = defaultValue == null ? 0 : defaultValue.getCapacity();
            double defaultRefill = defaultValue == null ? 1.0 : defaultValue.getRefillPerSecond();
            int capacity = getInt(prefix + ".capacity", defaultCapacity);
            double refill = getDouble(prefix + ".refill-per-second", defaultRefill);
            if (capacity == 0) {
                return null;
            }
            return new RateLimit(capacity, refill);
        }
    }
}
