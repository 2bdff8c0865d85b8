package com.arco.gateway;

import com.arco.gateway.cache.BoundedCache;
import com.arco.gateway.cache.CacheEntry;
import com.arco.gateway.cache.CacheStore;
import com.arco.gateway.cache.FileCacheStore;
import com.arco.gateway.cache.Fingerprint;
import com.arco.gateway.cache.PersistentResponseCache;
import com.arco.gateway.cache.SqliteCacheStore;
import com.arco.gateway.config.ConfigurationException;
import com.arco.gateway.config.GatewayConfig;
import com.arco.gateway.metrics.PerformanceMonitor;
import com.arco.gateway.ratelimit.RateLimiter;
import com.arco.gateway.ratelimit.RateLimiterSnapshot;
import com.arco.gateway.transport.HttpTransport;
import com.arco.gateway.transport.OkHttpTransport;
import com.arco.gateway.transport.TransportRequest;
import com.arco.gateway.transport.TransportResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single entry point for calls to named third-party APIs.
 *
 * A query is answered from cache when possible (in-memory tier first, then the persistent
 * cache); otherwise it waits for a rate-limiter permit, calls the upstream, and retries with
 * exponential backoff on 429s, other non-2xx responses, timeouts and transport failures.
 * Every outcome is returned as a {@link GatewayResult}; {@link #query} never throws.
 *
 * One instance is built at start-up and closed at shutdown; it owns the worker pool, the
 * transport and the cache store.
 */
public class ApiGateway implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ApiGateway.class);
    private static final int MAX_DETAIL_LENGTH = 200;

    private final GatewayConfig config;
    private final HttpTransport transport;
    private final RateLimiter rateLimiter;
    private final PersistentResponseCache responseCache;
    private final BoundedCache<String, CacheEntry> memoryCache;
    private final PerformanceMonitor monitor;
    private final CircuitBreakerRegistry circuitBreakers;
    private final IntervalFunction retryInterval;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock;
    private final ExecutorService workers;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param cacheStore durable store for responses; may be null when caching is disabled
     */
    public ApiGateway(GatewayConfig config, HttpTransport transport, CacheStore cacheStore,
                      MeterRegistry meterRegistry, Clock clock) {
        this.config = config;
        this.transport = transport;
        this.clock = clock;
        this.rateLimiter = new RateLimiter(config);
        this.monitor = new PerformanceMonitor(meterRegistry, clock);
        this.memoryCache = new BoundedCache<>(config.getBoundedCacheMaxSize());
        this.responseCache = config.isCacheEnabled() && cacheStore != null
            ? new PersistentResponseCache(cacheStore, config.getCacheTtl(), clock)
            : null;

        long baseDelayMs = config.getBaseRetryDelay().toMillis();
        this.retryInterval = baseDelayMs > 0 ? IntervalFunction.ofExponentialBackoff(baseDelayMs, 2.0) : null;

        this.circuitBreakers = config.isCircuitBreakerEnabled()
            ? CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .failureRateThreshold(config.getCircuitBreakerFailureRate())
                .waitDurationInOpenState(config.getCircuitBreakerWait())
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .permittedNumberOfCallsInHalfOpenState(3)
                .build())
            : null;

        config.getApiRegistrations().forEach(rateLimiter::register);

        AtomicInteger threadCount = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.getWorkerThreads(), r -> {
            Thread t = new Thread(r, "gateway-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        logger.info("ApiGateway initialized - maxRetries={}, cache={}, circuitBreaker={}, workers={}",
            config.getMaxRetries(), responseCache != null ? "enabled" : "disabled",
            circuitBreakers != null ? "enabled" : "disabled", config.getWorkerThreads());
    }

    /**
     * Build a gateway with the OkHttp transport, the configured cache back end and a
     * {@link SimpleMeterRegistry}.
     */
    public static ApiGateway create(GatewayConfig config) {
        return create(config, new SimpleMeterRegistry());
    }

    public static ApiGateway create(GatewayConfig config, MeterRegistry meterRegistry) {
        CacheStore store = null;
        if (config.isCacheEnabled()) {
            store = switch (config.getCacheBackend()) {
                case SQLITE -> new SqliteCacheStore(config.getCacheDbPath());
                case FILE -> new FileCacheStore(config.getCacheDirectory());
            };
        }
        return create(config, new OkHttpTransport(config), store, meterRegistry);
    }

    /**
     * Build a gateway over already opened resources, closing them if construction fails.
     */
    static ApiGateway create(GatewayConfig config, HttpTransport transport, CacheStore store,
                             MeterRegistry meterRegistry) {
        try {
            return new ApiGateway(config, transport, store, meterRegistry, Clock.systemUTC());
        } catch (RuntimeException e) {
            closeAfterFailedStart(transport, e);
            if (store != null) {
                closeAfterFailedStart(store, e);
            }
            throw e;
        }
    }

    private static void closeAfterFailedStart(Closeable resource, RuntimeException failure) {
        try {
            resource.close();
        } catch (IOException | RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    /**
     * Register limits for an API.
     *
     * @throws ConfigurationException if the name is already registered or a limit is invalid
     */
    public void registerApi(String name, double callsPerSecond, int maxConcurrent) {
        rateLimiter.register(name, callsPerSecond, maxConcurrent);
    }

    public GatewayResult query(String apiName, String target, Map<String, ?> params) {
        return query(GatewayRequest.get(apiName, target, params));
    }

    public GatewayResult query(String apiName, String target, Map<String, ?> params,
                               HttpMethod method, boolean useCache) {
        return query(GatewayRequest.builder(apiName, target)
            .params(params)
            .method(method)
            .useCache(useCache)
            .build());
    }

    /**
     * Run one logical query: cache lookup, then rate-limited calls with retry.
     */
    public GatewayResult query(GatewayRequest request) {
        long startNanos = System.nanoTime();

        if (request == null) {
            return reject(null, "Request is required", startNanos);
        }
        String apiName = request.apiName();
        if (closed.get()) {
            return reject(apiName, "Gateway is closed", startNanos);
        }
        if (request.target() == null || request.target().isBlank()) {
            return reject(apiName, "Target URL is required", startNanos);
        }
        if (!rateLimiter.isRegistered(apiName) && !config.isAutoRegisterDefaults()) {
            return reject(apiName, "API '" + apiName + "' is not registered", startNanos);
        }
        try {
            transport.checkRequest(new TransportRequest(
                request.method(), request.target(), request.params(), request.headers()));
        } catch (ConfigurationException e) {
            return reject(apiName, e.getMessage(), startNanos);
        }

        String fingerprint = null;
        if (isCacheable(request)) {
            try {
                fingerprint = Fingerprint.of(request.target(), request.params());
            } catch (IllegalArgumentException e) {
                return reject(apiName, e.getMessage(), startNanos);
            }
            JsonNode cached = lookupCache(fingerprint);
            if (cached != null) {
                monitor.recordCacheHit(apiName);
                logger.debug("Cache hit for {} {}", apiName, request.target());
                return GatewayResult.cached(cached, elapsed(startNanos));
            }
        }

        GatewayResult result;
        try {
            result = execute(request, fingerprint, startNanos);
        } catch (ConfigurationException e) {
            result = GatewayResult.failure(ErrorKind.CONFIGURATION, GatewayResult.NO_STATUS,
                e.getMessage(), elapsed(startNanos), 0);
        }
        monitor.recordCall(apiName, result);
        return result;
    }

    /**
     * Run {@link #query(GatewayRequest)} on the worker pool. Cancelling the future with
     * interruption releases any held slot and completes the query as {@code CANCELLED}.
     */
    public Future<GatewayResult> submit(GatewayRequest request) {
        try {
            return workers.submit(() -> query(request));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(GatewayResult.failure(ErrorKind.CONFIGURATION,
                GatewayResult.NO_STATUS, "Gateway is closed", Duration.ZERO, 0));
        }
    }

    /**
     * Run every request concurrently on the worker pool.
     *
     * @return results in request order
     */
    public List<GatewayResult> queryAll(List<GatewayRequest> requests) {
        List<Future<GatewayResult>> futures = new ArrayList<>(requests.size());
        for (GatewayRequest request : requests) {
            futures.add(submit(request));
        }

        List<GatewayResult> results = new ArrayList<>(requests.size());
        boolean interrupted = false;
        for (Future<GatewayResult> future : futures) {
            if (interrupted) {
                future.cancel(true);
                results.add(cancelled("Batch interrupted"));
                continue;
            }
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                interrupted = true;
                future.cancel(true);
                results.add(cancelled("Batch interrupted"));
            } catch (ExecutionException e) {
                logger.error("Query task failed unexpectedly", e.getCause());
                results.add(GatewayResult.failure(ErrorKind.TRANSPORT, GatewayResult.NO_STATUS,
                    String.valueOf(e.getCause()), Duration.ZERO, 0));
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return results;
    }

    public GatewayStats getStats() {
        return new GatewayStats(
            monitor.getSummary(),
            responseCache != null ? responseCache.getStats() : null,
            memoryCache.getStats(),
            apiSnapshots(),
            closed.get());
    }

    public List<RateLimiterSnapshot> apiSnapshots() {
        return rateLimiter.registrations().stream()
            .map(registration -> rateLimiter.snapshot(registration.name()))
            .toList();
    }

    /**
     * Remove expired entries from both cache tiers.
     *
     * @return number of persistent entries removed
     */
    public int purgeExpiredCache() {
        for (String key : memoryCache.keys()) {
            memoryCache.remove(key)
                .filter(entry -> !entry.isExpired(clock.instant(), config.getCacheTtl()))
                .ifPresent(entry -> memoryCache.set(key, entry));
        }
        return responseCache != null ? responseCache.purgeExpired() : 0;
    }

    public void resetMonitor() {
        monitor.reset();
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public PerformanceMonitor getMonitor() {
        return monitor;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stop the worker pool, then close the transport and the cache store. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Gateway workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            transport.close();
        } catch (IOException e) {
            logger.warn("Error closing transport: {}", e.getMessage());
        }
        if (responseCache != null) {
            responseCache.close();
        }
        memoryCache.clear();
        logger.info("ApiGateway closed");
    }

    // ========== Query pipeline ==========

    private GatewayResult execute(GatewayRequest request, String fingerprint, long startNanos) {
        String apiName = request.apiName();
        CircuitBreaker circuitBreaker = circuitBreakers != null ? circuitBreakers.circuitBreaker(apiName) : null;
        TransportRequest transportRequest = new TransportRequest(
            request.method(), request.target(), request.params(), request.headers());

        int maxAttempts = config.getMaxRetries();
        int attempts = 0;
        Attempt last = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (circuitBreaker != null && !circuitBreaker.tryAcquirePermission()) {
                logger.warn("Circuit breaker for {} is {} - call not permitted", apiName, circuitBreaker.getState());
                return GatewayResult.failure(ErrorKind.CIRCUIT_OPEN,
                    last != null ? last.status() : GatewayResult.NO_STATUS,
                    "Circuit breaker open for " + apiName, elapsed(startNanos), attempts);
            }

            RateLimiter.Permit permit;
            try {
                permit = rateLimiter.acquire(apiName);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                releasePermission(circuitBreaker);
                return cancelled(startNanos, attempts);
            } catch (ConfigurationException e) {
                releasePermission(circuitBreaker);
                throw e;
            }

            // The outcome is recorded before the slot is freed so the next grant sees it
            try (permit) {
                attempts++;
                last = call(apiName, circuitBreaker, transportRequest);
            }

            if (last.succeeded()) {
                return complete(request, fingerprint, last.response(), startNanos, attempts);
            }
            if (last.kind() == ErrorKind.CANCELLED) {
                return cancelled(startNanos, attempts);
            }
            if (!last.kind().isRetryable()) {
                logger.warn("Query to {} {} failed without retry: {}", apiName, request.target(), last.detail());
                return GatewayResult.failure(last.kind(), last.status(), last.detail(), elapsed(startNanos), attempts);
            }
            if (!sleepBeforeRetry(apiName, attempt, maxAttempts, last.kind())) {
                return cancelled(startNanos, attempts);
            }
        }

        if (last == null) {
            return GatewayResult.failure(ErrorKind.CONFIGURATION, GatewayResult.NO_STATUS,
                "No attempt made", elapsed(startNanos), 0);
        }
        logger.atWarn()
            .addKeyValue("api", apiName)
            .addKeyValue("attempts", attempts)
            .addKeyValue("errorKind", last.kind())
            .log("Query to {} failed after {} attempts: {}", request.target(), attempts, last.detail());
        return GatewayResult.failure(last.kind(), last.status(), last.detail(), elapsed(startNanos), attempts);
    }

    /**
     * One transport call, classified and recorded on the limiter and circuit breaker.
     * Runs while the caller holds the permit.
     */
    private Attempt call(String apiName, CircuitBreaker circuitBreaker, TransportRequest transportRequest) {
        long callStart = System.nanoTime();
        try {
            TransportResponse response = transport.execute(transportRequest);
            if (response.isSuccessful()) {
                rateLimiter.recordSuccess(apiName);
                if (circuitBreaker != null) {
                    circuitBreaker.onSuccess(System.nanoTime() - callStart, TimeUnit.NANOSECONDS);
                }
                return Attempt.succeeded(response);
            }
            ErrorKind kind = response.isRateLimited() ? ErrorKind.RATE_LIMITED : ErrorKind.UPSTREAM;
            String detail = "HTTP " + response.status() + ": " + abbreviate(response.body());
            recordFailure(apiName, circuitBreaker, callStart, new IOException(detail));
            return Attempt.failed(kind, response.status(), detail);
        } catch (IOException e) {
            if (Thread.currentThread().isInterrupted()) {
                releasePermission(circuitBreaker);
                return Attempt.failed(ErrorKind.CANCELLED, GatewayResult.NO_STATUS, "Query cancelled");
            }
            ErrorKind kind = e instanceof InterruptedIOException ? ErrorKind.TIMEOUT : ErrorKind.TRANSPORT;
            recordFailure(apiName, circuitBreaker, callStart, e);
            return Attempt.failed(kind, GatewayResult.NO_STATUS, e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (ConfigurationException e) {
            // malformed request: the upstream was never reached, so the API's pacing is untouched
            releasePermission(circuitBreaker);
            return Attempt.failed(ErrorKind.CONFIGURATION, GatewayResult.NO_STATUS, e.getMessage());
        } catch (RuntimeException e) {
            recordFailure(apiName, circuitBreaker, callStart, e);
            return Attempt.failed(ErrorKind.TRANSPORT, GatewayResult.NO_STATUS,
                e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private GatewayResult complete(GatewayRequest request, String fingerprint, TransportResponse response,
                                   long startNanos, int attempts) {
        JsonNode payload;
        try {
            payload = request.processor().process(parsePayload(response.body()));
        } catch (RuntimeException e) {
            logger.warn("Response processing failed for {} {}: {}", request.apiName(), request.target(), e.getMessage());
            return GatewayResult.failure(ErrorKind.PROCESSING, response.status(),
                "Response processing failed: " + e.getMessage(), elapsed(startNanos), attempts);
        }
        if (payload == null) {
            return GatewayResult.failure(ErrorKind.PROCESSING, response.status(),
                "Response processor returned no payload", elapsed(startNanos), attempts);
        }

        if (fingerprint != null) {
            memoryCache.set(fingerprint, new CacheEntry(fingerprint, payload, clock.instant()));
            if (responseCache != null) {
                responseCache.set(fingerprint, payload);
            }
        }
        return GatewayResult.success(payload, response.status(), elapsed(startNanos), attempts);
    }

    private JsonNode parsePayload(String body) {
        if (body == null || body.isBlank()) {
            return TextNode.valueOf(body == null ? "" : body);
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node == null || node.isMissingNode() ? TextNode.valueOf(body) : node;
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(body);
        }
    }

    private JsonNode lookupCache(String fingerprint) {
        var memoryHit = memoryCache.get(fingerprint);
        if (memoryHit.isPresent()) {
            if (!memoryHit.get().isExpired(clock.instant(), config.getCacheTtl())) {
                return memoryHit.get().payload();
            }
            memoryCache.remove(fingerprint);
        }
        if (responseCache == null) {
            return null;
        }
        return responseCache.getEntry(fingerprint)
            .map(entry -> {
                memoryCache.set(fingerprint, entry);
                return entry.payload();
            })
            .orElse(null);
    }

    private boolean isCacheable(GatewayRequest request) {
        return config.isCacheEnabled() && request.useCache() && request.method().isCacheable();
    }

    private void recordFailure(String apiName, CircuitBreaker circuitBreaker, long callStart, Throwable error) {
        rateLimiter.recordError(apiName);
        if (circuitBreaker != null) {
            circuitBreaker.onError(System.nanoTime() - callStart, TimeUnit.NANOSECONDS, error);
        }
    }

    private static void releasePermission(CircuitBreaker circuitBreaker) {
        if (circuitBreaker != null) {
            circuitBreaker.releasePermission();
        }
    }

    /**
     * Back off before the next attempt; no wait follows the final attempt.
     *
     * @return false if interrupted while waiting
     */
    private boolean sleepBeforeRetry(String apiName, int attempt, int maxAttempts, ErrorKind kind) {
        if (attempt >= maxAttempts - 1 || retryInterval == null) {
            return true;
        }
        long delayMs = retryInterval.apply(attempt + 1);
        logger.info("{} attempt {}/{} failed ({}), retrying in {}ms", apiName, attempt + 1, maxAttempts, kind, delayMs);
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private GatewayResult reject(String apiName, String detail, long startNanos) {
        logger.warn("Query rejected for {}: {}", apiName, detail);
        GatewayResult result = GatewayResult.failure(ErrorKind.CONFIGURATION, GatewayResult.NO_STATUS,
            detail, elapsed(startNanos), 0);
        monitor.recordCall(apiName, result);
        return result;
    }

    private GatewayResult cancelled(long startNanos, int attempts) {
        logger.debug("Query cancelled after {} attempts", attempts);
        return GatewayResult.failure(ErrorKind.CANCELLED, GatewayResult.NO_STATUS,
            "Query cancelled", elapsed(startNanos), attempts);
    }

    private static GatewayResult cancelled(String detail) {
        return GatewayResult.failure(ErrorKind.CANCELLED, GatewayResult.NO_STATUS, detail, Duration.ZERO, 0);
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_DETAIL_LENGTH ? body : body.substring(0, MAX_DETAIL_LENGTH) + "...";
    }

    private record Attempt(TransportResponse response, ErrorKind kind, int status, String detail) {

        static Attempt succeeded(TransportResponse response) {
            return new Attempt(response, null, response.status(), null);
        }

        static Attempt failed(ErrorKind kind, int status, String detail) {
            return new Attempt(null, kind, status, detail);
        }

        boolean succeeded() {
            return kind == null;
        }
    }
}
