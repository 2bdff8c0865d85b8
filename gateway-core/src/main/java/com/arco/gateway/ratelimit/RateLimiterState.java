package com.arco.gateway.ratelimit;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable pacing state for one registered API. Counters and the last grant time are only
 * read or written while {@link #lock} is held; the lock is never held while waiting.
 */
final class RateLimiterState {

    final ApiRegistration registration;
    final ReentrantLock lock = new ReentrantLock();

    // Non-fair: waiting callers proceed in best-effort order, not FIFO
    final Semaphore slots;
    final AtomicInteger inFlight = new AtomicInteger();

    long lastGrantNanos;
    boolean granted;
    int consecutiveErrors;
    int successStreak;

    RateLimiterState(ApiRegistration registration) {
        this.registration = registration;
        this.slots = new Semaphore(registration.maxConcurrent());
    }
}
