package com.arco.gateway.ratelimit;

import com.arco.gateway.config.ConfigurationException;
import com.arco.gateway.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Adaptive rate limiter keyed by API name.
 *
 * Each registered API gets a pacing interval of {@code 1 / callsPerSecond} and a pool of
 * {@code maxConcurrent} slots. The interval stretches exponentially with consecutive errors
 * (capped at {@code maxBackoffMultiplier}) and shrinks by {@code accelerationFactor} once the
 * success streak passes the configured threshold.
 *
 * Thread-safety: per-API counters are guarded by a {@link java.util.concurrent.locks.ReentrantLock}
 * that is never held while a caller waits. Slots are a non-fair semaphore, so waiting callers are
 * admitted in best-effort order.
 *
 * Registering a name twice fails with {@link ConfigurationException}.
 */
public class RateLimiter {
    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    private final Map<String, RateLimiterState> states = new ConcurrentHashMap<>();

    private final double backoffMultiplier;
    private final double maxBackoffMultiplier;
    private final int successStreakThreshold;
    private final double accelerationFactor;
    private final boolean autoRegisterDefaults;
    private final double defaultCallsPerSecond;
    private final int defaultMaxConcurrent;

    public RateLimiter(GatewayConfig config) {
        this.backoffMultiplier = config.getBackoffMultiplier();
        this.maxBackoffMultiplier = config.getMaxBackoffMultiplier();
        this.successStreakThreshold = config.getSuccessStreakThreshold();
        this.accelerationFactor = config.getAccelerationFactor();
        this.autoRegisterDefaults = config.isAutoRegisterDefaults();
        this.defaultCallsPerSecond = config.getDefaultCallsPerSecond();
        this.defaultMaxConcurrent = config.getDefaultMaxConcurrent();
        logger.info("RateLimiter initialized: backoff={}x (max {}x), acceleration={} after {} successes, autoRegister={}",
            backoffMultiplier, maxBackoffMultiplier, accelerationFactor, successStreakThreshold,
            autoRegisterDefaults);
    }

    /**
     * Register limits for a named API.
     *
     * @throws ConfigurationException if the name is already registered or a limit is invalid
     */
    public void register(String name, double callsPerSecond, int maxConcurrent) {
        register(new ApiRegistration(name, callsPerSecond, maxConcurrent));
    }

    public void register(ApiRegistration registration) {
        var existing = states.putIfAbsent(registration.name(), new RateLimiterState(registration));
        if (existing != null) {
            throw new ConfigurationException("API '" + registration.name() + "' is already registered");
        }
        logger.info("API registered: {} ({} calls/s, max {} concurrent)",
            registration.name(), registration.callsPerSecond(), registration.maxConcurrent());
    }

    public boolean isRegistered(String name) {
        return name != null && states.containsKey(name);
    }

    /**
     * Wait for a concurrency slot and for the pacing interval to elapse, then grant a permit.
     * The returned permit must be closed on every exit path; try-with-resources is the normal use.
     *
     * @throws ConfigurationException if {@code name} is unknown and auto-registration is off
     * @throws InterruptedException if interrupted while waiting; no slot is held afterwards
     */
    public Permit acquire(String name) throws InterruptedException {
        RateLimiterState state = stateFor(name);

        state.slots.acquire();
        state.inFlight.incrementAndGet();
        try {
            long grantAt;
            long previousGrant;
            boolean previouslyGranted;
            state.lock.lock();
            try {
                long now = System.nanoTime();
                long interval = intervalNanos(state);
                previousGrant = state.lastGrantNanos;
                previouslyGranted = state.granted;
                grantAt = state.granted ? Math.max(now, state.lastGrantNanos + interval) : now;
                state.lastGrantNanos = grantAt;
                state.granted = true;
            } finally {
                state.lock.unlock();
            }

            long waitNanos = grantAt - System.nanoTime();
            if (waitNanos > 0) {
                try {
                    TimeUnit.NANOSECONDS.sleep(waitNanos);
                } catch (InterruptedException e) {
                    cancelReservation(state, grantAt, previousGrant, previouslyGranted);
                    throw e;
                }
            }
            return new Permit(this, name);
        } catch (InterruptedException | RuntimeException e) {
            release(name);
            throw e;
        }
    }

    // Hand an unused grant time back, unless a later caller has already reserved after it
    private static void cancelReservation(RateLimiterState state, long grantAt,
                                          long previousGrant, boolean previouslyGranted) {
        state.lock.lock();
        try {
            if (state.lastGrantNanos == grantAt) {
                state.lastGrantNanos = previousGrant;
                state.granted = previouslyGranted;
            }
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Free one concurrency slot for {@code name}. Extra releases are ignored.
     */
    public void release(String name) {
        RateLimiterState state = states.get(name);
        if (state == null) {
            logger.warn("release() for unregistered API '{}' ignored", name);
            return;
        }
        int previous = state.inFlight.getAndUpdate(n -> n > 0 ? n - 1 : 0);
        if (previous == 0) {
            logger.warn("release() without a matching acquire() for API '{}' ignored", name);
            return;
        }
        state.slots.release();
    }

    /**
     * Record a successful call: clears the error count and extends the success streak.
     */
    public void recordSuccess(String name) {
        RateLimiterState state = requireState(name);
        state.lock.lock();
        try {
            state.consecutiveErrors = 0;
            state.successStreak++;
            if (state.successStreak == successStreakThreshold + 1) {
                logger.debug("{}: success streak {} - accelerating pace", name, state.successStreak);
            }
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Record a failed call (429, non-2xx, timeout or transport error): breaks the success
     * streak and increases the backoff exponent.
     */
    public void recordError(String name) {
        RateLimiterState state = requireState(name);
        state.lock.lock();
        try {
            state.successStreak = 0;
            state.consecutiveErrors++;
            logger.debug("{}: {} consecutive errors, interval now {}ms", name,
                state.consecutiveErrors, TimeUnit.NANOSECONDS.toMillis(intervalNanos(state)));
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * The interval the next grant for {@code name} would be spaced by.
     */
    public Duration currentInterval(String name) {
        RateLimiterState state = requireState(name);
        state.lock.lock();
        try {
            return Duration.ofNanos(intervalNanos(state));
        } finally {
            state.lock.unlock();
        }
    }

    public RateLimiterSnapshot snapshot(String name) {
        RateLimiterState state = requireState(name);
        state.lock.lock();
        try {
            var registration = state.registration;
            return new RateLimiterSnapshot(
                registration.name(),
                registration.callsPerSecond(),
                registration.maxConcurrent(),
                state.inFlight.get(),
                state.consecutiveErrors,
                state.successStreak,
                Duration.ofNanos(intervalNanos(state)));
        } finally {
            state.lock.unlock();
        }
    }

    public List<ApiRegistration> registrations() {
        return states.values().stream()
            .map(s -> s.registration)
            .sorted(Comparator.comparing(ApiRegistration::name))
            .toList();
    }

    // Caller must hold state.lock
    private long intervalNanos(RateLimiterState state) {
        double interval = 1_000_000_000d / state.registration.callsPerSecond();
        if (state.consecutiveErrors > 0) {
            interval *= Math.min(Math.pow(backoffMultiplier, state.consecutiveErrors), maxBackoffMultiplier);
        } else if (state.successStreak > successStreakThreshold) {
            interval *= accelerationFactor;
        }
        return Math.round(interval);
    }

    private RateLimiterState stateFor(String name) {
        RateLimiterState state = name == null ? null : states.get(name);
        if (state != null) {
            return state;
        }
        if (!autoRegisterDefaults || name == null) {
            throw new ConfigurationException("API '" + name + "' is not registered");
        }
        return states.computeIfAbsent(name, n -> {
            logger.warn("API {} not registered - auto-registering with defaults ({} calls/s, max {} concurrent)",
                n, defaultCallsPerSecond, defaultMaxConcurrent);
            return new RateLimiterState(new ApiRegistration(n, defaultCallsPerSecond, defaultMaxConcurrent));
        });
    }

    private RateLimiterState requireState(String name) {
        RateLimiterState state = name == null ? null : states.get(name);
        if (state == null) {
            throw new ConfigurationException("API '" + name + "' is not registered");
        }
        return state;
    }

    /**
     * A granted concurrency slot. Closing it releases the slot exactly once.
     */
    public static final class Permit implements AutoCloseable {
        private final RateLimiter limiter;
        private final String name;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit(RateLimiter limiter, String name) {
            this.limiter = limiter;
            this.name = name;
        }

        public String apiName() {
            return name;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                limiter.release(name);
            }
        }
    }
}
