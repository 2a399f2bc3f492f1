package com.seriesguard.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.seriesguard.throttler.RateLimit;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EngineConfigTest {

    @Test
    void defaultsAreUsable() {
        EngineConfig config = EngineConfig.defaults();

        assertThat(config.getWindowCapacity()).isEqualTo(EngineConfig.DEFAULT_WINDOW_CAPACITY);
        assertThat(config.getDetectionInterval()).isEqualTo(1);
        assertThat(config.getSeriesIngestLimit()).isNull();
        assertThat(config.isDispatchNormalResults()).isFalse();
        assertThat(config.getDetectorSettings().getZThreshold()).isEqualTo(3.0);
    }

    @Test
    void readsPropertiesWithDurationsInBothForms() {
        Properties properties = new Properties();
        properties.setProperty("window.capacity", "32");
        properties.setProperty("window.idle-eviction", "90000");
        properties.setProperty("cache.ttl", "PT2M");
        properties.setProperty("detector.min-samples", "10");
        properties.setProperty("ratelimit.query.capacity", "5");
        properties.setProperty("ratelimit.query.refill-per-second", "1");

        EngineConfig config = EngineConfig.fromSources(properties, Collections.emptyMap());

        assertThat(config.getWindowCapacity()).isEqualTo(32);
        assertThat(config.getWindowIdleEviction()).isEqualTo(Duration.ofSeconds(90));
        assertThat(config.getCacheTtl()).isEqualTo(Duration.ofMinutes(2));
        assertThat(config.getDetectorSettings().getMinSamples()).isEqualTo(10);
        assertThat(config.getQueryLimit()).isEqualTo(new RateLimit(5, 1.0));
    }

    @Test
    @DisplayName("Environment variables override properties")
    void environmentOverridesProperties() {
        Properties properties = new Properties();
        properties.setProperty("window.capacity", "32");
        Map<String, String> env = new HashMap<>();
        env.put("SERIES_GUARD_WINDOW_CAPACITY", "48");
        env.put("SERIES_GUARD_DISPATCH_INCLUDE_NORMAL", "true");
        env.put("SERIES_GUARD_RATELIMIT_SERIES_INGEST_CAPACITY", "7");

        EngineConfig config = EngineConfig.fromSources(properties, env);

        assertThat(config.getWindowCapacity()).isEqualTo(48);
        assertThat(config.isDispatchNormalResults()).isTrue();
        assertThat(config.getSeriesIngestLimit()).isEqualTo(new RateLimit(7, 1.0));
    }

    @Test
    @DisplayName("Malformed values fall back to their defaults")
    void malformedValuesFallBackToDefaults() {
        Properties properties = new Properties();
        properties.setProperty("window.capacity", "lots");
        properties.setProperty("cache.ttl", "soon");
        properties.setProperty("detector.z-threshold", "high");
        properties.setProperty("dispatch.include-normal", "maybe");

        EngineConfig config = EngineConfig.fromSources(properties, Collections.emptyMap());

        assertThat(config.getWindowCapacity()).isEqualTo(EngineConfig.DEFAULT_WINDOW_CAPACITY);
        assertThat(config.getCacheTtl()).isEqualTo(EngineConfig.DEFAULT_CACHE_TTL);
        assertThat(config.getDetectorSettings().getZThreshold()).isEqualTo(3.0);
        assertThat(config.isDispatchNormalResults()).isFalse();
    }

    @Test
    void outOfRangeValuesAreConfigurationErrors() {
        Properties properties = new Properties();
        properties.setProperty("window.capacity", "-1");

        assertThatThrownBy(() -> EngineConfig.fromSources(properties, Collections.emptyMap()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("windowCapacity")
                .hasCauseInstanceOf(IllegalArgumentException.class);

        Properties badDetector = new Properties();
        badDetector.setProperty("detector.trend-horizon", "1");
        assertThatThrownBy(() -> EngineConfig.fromSources(badDetector, Collections.emptyMap()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("trendHorizon");
    }

    @Test
    void disablingQueryLimitIsRejected() {
        Properties properties = new Properties();
        properties.setProperty("ratelimit.query.capacity", "0");

        assertThatThrownBy(() -> EngineConfig.fromSources(properties, Collections.emptyMap()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void loadReadsClasspathResource() {
        EngineConfig config = EngineConfig.load();

        assertThat(config.getWindowCapacity()).isEqualTo(64);
        assertThat(config.getWindowIdleEviction()).isEqualTo(Duration.ofMinutes(2));
        assertThat(config.getSeasonalPeriod()).isEqualTo(24);
        assertThat(config.getDetectorSettings().getZThreshold()).isEqualTo(2.5);
        assertThat(config.getQueryLimit()).isEqualTo(new RateLimit(5, 1.0));
        assertThat(config.getSeriesIngestLimit()).isEqualTo(new RateLimit(50, 25.0));
        assertThat(config.isDispatchNormalResults()).isTrue();
    }

    @Test
    void builderValidatesDurations() {
        assertThatThrownBy(() -> EngineConfig.builder().cacheTtl(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cacheTtl");
        assertThatThrownBy(() -> EngineConfig.builder().maintenanceInterval(null).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maintenanceInterval");
    }
}
