package com.arco.gateway.config;

import com.arco.gateway.ratelimit.ApiRegistration;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

/**
 * Gateway configuration: retry budget, cache settings, adaptive pacing constants,
 * transport timeouts and the APIs registered at start-up.
 *
 * Sources, lowest precedence first: built-in defaults, {@code gateway.properties} on the
 * classpath, {@code gateway.properties} in the working directory, environment variables.
 * Instances are immutable; {@link #forTest(Properties)} skips files and environment.
 */
public final class GatewayConfig {
    private static final Logger logger = LoggerFactory.getLogger(GatewayConfig.class);
    private static final String CONFIG_FILE = "gateway.properties";

    public enum CacheBackend {
        FILE, SQLITE
    }

    private final Properties properties;
    private final boolean readEnvironment;

    @Min(value = 1, message = "maxRetries must be at least 1")
    private final int maxRetries;

    @Min(value = 0, message = "baseRetryDelayMs cannot be negative")
    private final long baseRetryDelayMs;

    private final boolean cacheEnabled;

    @Positive(message = "cacheTtlSeconds must be positive")
    private final long cacheTtlSeconds;

    @NotNull(message = "cacheBackend is required")
    private final CacheBackend cacheBackend;

    @NotBlank(message = "cacheDirectory is required")
    private final String cacheDirectory;

    @NotBlank(message = "cacheDbPath is required")
    private final String cacheDbPath;

    @Positive(message = "boundedCacheMaxSize must be positive")
    private final int boundedCacheMaxSize;

    @DecimalMin(value = "1.0", message = "backoffMultiplier must be >= 1.0")
    private final double backoffMultiplier;

    @DecimalMin(value = "1.0", message = "maxBackoffMultiplier must be >= 1.0")
    private final double maxBackoffMultiplier;

    @Min(value = 0, message = "successStreakThreshold cannot be negative")
    private final int successStreakThreshold;

    @DecimalMin(value = "0.0", inclusive = false, message = "accelerationFactor must be > 0")
    @DecimalMax(value = "1.0", message = "accelerationFactor must be <= 1.0")
    private final double accelerationFactor;

    private final boolean autoRegisterDefaults;

    @DecimalMin(value = "0.0", inclusive = false, message = "defaultCallsPerSecond must be > 0")
    private final double defaultCallsPerSecond;

    @Positive(message = "defaultMaxConcurrent must be positive")
    private final int defaultMaxConcurrent;

    @Positive(message = "connectTimeoutMs must be positive")
    private final long connectTimeoutMs;

    @Positive(message = "requestTimeoutMs must be positive")
    private final long requestTimeoutMs;

    @NotBlank(message = "userAgent is required")
    private final String userAgent;

    @Positive(message = "workerThreads must be positive")
    private final int workerThreads;

    private final boolean circuitBreakerEnabled;

    @DecimalMin(value = "1.0", message = "circuitBreakerFailureRate must be >= 1")
    @DecimalMax(value = "100.0", message = "circuitBreakerFailureRate must be <= 100")
    private final float circuitBreakerFailureRate;

    @Positive(message = "circuitBreakerWaitSeconds must be positive")
    private final long circuitBreakerWaitSeconds;

    @Min(value = 0, message = "serverPort cannot be negative")
    @Max(value = 65535, message = "serverPort must be <= 65535")
    private final int serverPort;

    private final List<ApiRegistration> apiRegistrations;

    private GatewayConfig(Properties props, boolean readEnvironment) {
        this.properties = props;
        this.readEnvironment = readEnvironment;

        this.maxRetries = parseInt("GATEWAY_MAX_RETRIES", 3);
        this.baseRetryDelayMs = parseLong("GATEWAY_BASE_RETRY_DELAY_MS", 1000);

        this.cacheEnabled = parseBoolean("GATEWAY_CACHE_ENABLED", true);
        this.cacheTtlSeconds = parseLong("GATEWAY_CACHE_TTL_SECONDS", 86_400);
        this.cacheBackend = parseBackend(getProperty("GATEWAY_CACHE_BACKEND", "FILE"));
        this.cacheDirectory = getProperty("GATEWAY_CACHE_DIR", "cache");
        this.cacheDbPath = getProperty("GATEWAY_CACHE_DB_PATH", "cache/response-cache.db");
        this.boundedCacheMaxSize = parseInt("GATEWAY_BOUNDED_CACHE_MAX_SIZE", 1000);

        // Adaptive pacing
        this.backoffMultiplier = parseDouble("GATEWAY_BACKOFF_MULTIPLIER", 1.5);
        this.maxBackoffMultiplier = parseDouble("GATEWAY_MAX_BACKOFF_MULTIPLIER", 8.0);
        this.successStreakThreshold = parseInt("GATEWAY_SUCCESS_STREAK_THRESHOLD", 5);
        this.accelerationFactor = parseDouble("GATEWAY_ACCELERATION_FACTOR", 0.8);

        this.autoRegisterDefaults = parseBoolean("GATEWAY_AUTO_REGISTER_DEFAULTS", false);
        this.defaultCallsPerSecond = parseDouble("GATEWAY_DEFAULT_CALLS_PER_SECOND", 1.0);
        this.defaultMaxConcurrent = parseInt("GATEWAY_DEFAULT_MAX_CONCURRENT", 5);

        // Transport
        this.connectTimeoutMs = parseLong("GATEWAY_CONNECT_TIMEOUT_MS", 10_000);
        this.requestTimeoutMs = parseLong("GATEWAY_REQUEST_TIMEOUT_MS", 30_000);
        this.userAgent = getProperty("GATEWAY_USER_AGENT", "ARCO-APIService/1.0");
        this.workerThreads = parseInt("GATEWAY_WORKER_THREADS", 20);

        this.circuitBreakerEnabled = parseBoolean("GATEWAY_CIRCUIT_BREAKER_ENABLED", false);
        this.circuitBreakerFailureRate = (float) parseDouble("GATEWAY_CIRCUIT_BREAKER_FAILURE_RATE", 50.0);
        this.circuitBreakerWaitSeconds = parseLong("GATEWAY_CIRCUIT_BREAKER_WAIT_SECONDS", 30);

        this.serverPort = parseInt("GATEWAY_SERVER_PORT", 8080);
        this.apiRegistrations = parseRegistrations(getProperty("GATEWAY_APIS", ""));
    }

    /**
     * Load configuration from defaults, property files and the environment, then validate it.
     */
    public static GatewayConfig load() {
        Properties props = new Properties();

        try (InputStream is = GatewayConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded {} from classpath", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.warn("Failed to load {} from classpath: {}", CONFIG_FILE, e.getMessage());
        }

        // Working directory overrides classpath (production deployments)
        Path configPath = Path.of(CONFIG_FILE);
        if (Files.exists(configPath)) {
            try (InputStream is = Files.newInputStream(configPath)) {
                props.load(is);
                logger.info("Loaded config from: {}", configPath.toAbsolutePath());
            } catch (IOException e) {
                logger.warn("Failed to load {} from filesystem: {}", CONFIG_FILE, e.getMessage());
            }
        }

        var config = new GatewayConfig(props, true);
        config.validate();
        logger.info("Gateway configuration loaded: maxRetries={}, cache={} ({}), ttl={}s, {} APIs",
            config.maxRetries, config.cacheEnabled ? "enabled" : "disabled", config.cacheBackend,
            config.cacheTtlSeconds, config.apiRegistrations.size());
        return config;
    }

    /**
     * Create a validated instance from explicit properties only.
     */
    public static GatewayConfig forTest(Properties testProps) {
        var config = new GatewayConfig(testProps, false);
        config.validate();
        return config;
    }

    /**
     * Validate using Bean Validation.
     *
     * @throws ConfigurationException listing every violated constraint
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            Validator validator = factory.getValidator();
            validator.validate(this).stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .forEach(errors::add);
        }
        if (maxBackoffMultiplier < backoffMultiplier) {
            errors.add("maxBackoffMultiplier: must be >= backoffMultiplier");
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                "Configuration validation failed: " + String.join(", ", errors));
        }
    }

    // ========== Getters ==========

    /** Total attempts allowed per logical query (the first call included). */
    public int getMaxRetries() {
        return maxRetries;
    }

    /** Delay before the second attempt; doubled for every further attempt. */
    public Duration getBaseRetryDelay() {
        return Duration.ofMillis(baseRetryDelayMs);
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public Duration getCacheTtl() {
        return Duration.ofSeconds(cacheTtlSeconds);
    }

    public CacheBackend getCacheBackend() {
        return cacheBackend;
    }

    public Path getCacheDirectory() {
        return Path.of(cacheDirectory);
    }

    public Path getCacheDbPath() {
        return Path.of(cacheDbPath);
    }

    public int getBoundedCacheMaxSize() {
        return boundedCacheMaxSize;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public double getMaxBackoffMultiplier() {
        return maxBackoffMultiplier;
    }

    public int getSuccessStreakThreshold() {
        return successStreakThreshold;
    }

    public double getAccelerationFactor() {
        return accelerationFactor;
    }

    public boolean isAutoRegisterDefaults() {
        return autoRegisterDefaults;
    }

    public double getDefaultCallsPerSecond() {
        return defaultCallsPerSecond;
    }

    public int getDefaultMaxConcurrent() {
        return defaultMaxConcurrent;
    }

    public Duration getConnectTimeout() {
        return Duration.ofMillis(connectTimeoutMs);
    }

    public Duration getRequestTimeout() {
        return Duration.ofMillis(requestTimeoutMs);
    }

    public String getUserAgent() {
        return userAgent;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public boolean isCircuitBreakerEnabled() {
        return circuitBreakerEnabled;
    }

    public float getCircuitBreakerFailureRate() {
        return circuitBreakerFailureRate;
    }

    public Duration getCircuitBreakerWait() {
        return Duration.ofSeconds(circuitBreakerWaitSeconds);
    }

    public int getServerPort() {
        return serverPort;
    }

    /** APIs declared in {@code GATEWAY_APIS}, registered when the gateway starts. */
    public List<ApiRegistration> getApiRegistrations() {
        return apiRegistrations;
    }

    // ========== Parsing ==========

    private String getProperty(String key, String defaultValue) {
        return Optional.ofNullable(readEnvironment ? System.getenv(key) : null)
                .or(() -> Optional.ofNullable(properties.getProperty(key)))
                .map(String::trim)
                .orElse(defaultValue);
    }

    private int parseInt(String key, int defaultValue) {
        String value = getProperty(key, null);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private long parseLong(String key, long defaultValue) {
        String value = getProperty(key, null);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private double parseDouble(String key, double defaultValue) {
        String value = getProperty(key, null);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private boolean parseBoolean(String key, boolean defaultValue) {
        String value = getProperty(key, null);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value);
    }

    private static CacheBackend parseBackend(String value) {
        try {
            return CacheBackend.valueOf(value.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown GATEWAY_CACHE_BACKEND '" + value
                + "' (expected FILE or SQLITE)", e);
        }
    }

    /**
     * Parse {@code name:callsPerSecond:maxConcurrent} entries separated by commas.
     */
    private static List<ApiRegistration> parseRegistrations(String value) {
        List<ApiRegistration> registrations = new ArrayList<>();
        if (value == null || value.isBlank()) {
            return List.of();
        }
        for (String entry : value.split(",")) {
            if (entry.isBlank()) {
                continue;
            }
            String[] parts = entry.trim().split(":");
            if (parts.length != 3) {
                throw new ConfigurationException("Invalid GATEWAY_APIS entry '" + entry.trim()
                    + "' (expected name:callsPerSecond:maxConcurrent)");
            }
            try {
                registrations.add(new ApiRegistration(parts[0].trim(),
                    Double.parseDouble(parts[1].trim()), Integer.parseInt(parts[2].trim())));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid number in GATEWAY_APIS entry '"
                    + entry.trim() + "'", e);
            }
        }
        return List.copyOf(registrations);
    }
}
