package com.arco.gateway.config;

import com.arco.gateway.ratelimit.ApiRegistration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GatewayConfig Tests")
class GatewayConfigTest {

    private static Properties props(String... keyValues) {
        Properties props = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            props.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return props;
    }

    @Test
    @DisplayName("Should apply documented defaults")
    void defaults() {
        GatewayConfig config = GatewayConfig.forTest(new Properties());

        assertThat(config.getMaxRetries()).isEqualTo(3);
        assertThat(config.getBaseRetryDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.isCacheEnabled()).isTrue();
        assertThat(config.getCacheTtl()).isEqualTo(Duration.ofHours(24));
        assertThat(config.getCacheBackend()).isEqualTo(GatewayConfig.CacheBackend.FILE);
        assertThat(config.getCacheDirectory()).isEqualTo(Path.of("cache"));
        assertThat(config.getBoundedCacheMaxSize()).isEqualTo(1000);
        assertThat(config.getBackoffMultiplier()).isEqualTo(1.5);
        assertThat(config.getMaxBackoffMultiplier()).isEqualTo(8.0);
        assertThat(config.getSuccessStreakThreshold()).isEqualTo(5);
        assertThat(config.getAccelerationFactor()).isEqualTo(0.8);
        assertThat(config.isAutoRegisterDefaults()).isFalse();
        assertThat(config.getUserAgent()).isEqualTo("ARCO-APIService/1.0");
        assertThat(config.isCircuitBreakerEnabled()).isFalse();
        assertThat(config.getServerPort()).isEqualTo(8080);
        assertThat(config.getApiRegistrations()).isEmpty();
    }

    @Test
    @DisplayName("Should fall back to the default on an unparseable number")
    void invalidNumberFallsBack() {
        GatewayConfig config = GatewayConfig.forTest(props("GATEWAY_MAX_RETRIES", "three"));
        assertThat(config.getMaxRetries()).isEqualTo(3);
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Should list every violated constraint")
        void listsAllViolations() {
            assertThatThrownBy(() -> GatewayConfig.forTest(props(
                    "GATEWAY_MAX_RETRIES", "0",
                    "GATEWAY_ACCELERATION_FACTOR", "1.5",
                    "GATEWAY_CACHE_TTL_SECONDS", "-1")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("maxRetries")
                .hasMessageContaining("accelerationFactor")
                .hasMessageContaining("cacheTtlSeconds");
        }

        @Test
        @DisplayName("Max backoff multiplier cannot be below the base multiplier")
        void backoffOrdering() {
            assertThatThrownBy(() -> GatewayConfig.forTest(props(
                    "GATEWAY_BACKOFF_MULTIPLIER", "3.0",
                    "GATEWAY_MAX_BACKOFF_MULTIPLIER", "2.0")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("maxBackoffMultiplier");
        }

        @Test
        @DisplayName("Should reject an unknown cache backend")
        void unknownBackend() {
            assertThatThrownBy(() -> GatewayConfig.forTest(props("GATEWAY_CACHE_BACKEND", "redis")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("redis");
        }

        @Test
        @DisplayName("Backend name is case-insensitive")
        void backendCaseInsensitive() {
            GatewayConfig config = GatewayConfig.forTest(props("GATEWAY_CACHE_BACKEND", "sqlite"));
            assertThat(config.getCacheBackend()).isEqualTo(GatewayConfig.CacheBackend.SQLITE);
        }
    }

    @Nested
    @DisplayName("API registrations")
    class RegistrationTests {

        @Test
        @DisplayName("Should parse name:callsPerSecond:maxConcurrent entries")
        void parsesEntries() {
            GatewayConfig config = GatewayConfig.forTest(props(
                "GATEWAY_APIS", "places:2:1, search:0.5:3,"));

            assertThat(config.getApiRegistrations()).containsExactly(
                new ApiRegistration("places", 2.0, 1),
                new ApiRegistration("search", 0.5, 3));
        }

        @Test
        @DisplayName("Should reject malformed entries")
        void rejectsMalformed() {
            assertThatThrownBy(() -> GatewayConfig.forTest(props("GATEWAY_APIS", "places:2")))
                .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> GatewayConfig.forTest(props("GATEWAY_APIS", "places:fast:1")))
                .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> GatewayConfig.forTest(props("GATEWAY_APIS", "places:0:1")))
                .isInstanceOf(ConfigurationException.class);
        }
    }
}
