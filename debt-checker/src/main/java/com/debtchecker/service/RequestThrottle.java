package com.debtchecker.service;

import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caps outbound traffic to the debt API on two independent axes:
 *  - concurrency: a fair semaphore, at most {@code maxConcurrent} requests in flight
 *  - rate: a resilience4j {@link RateLimiter}, at most N requests per refresh period
 *
 * Both waits park the calling thread. The permit covers one request only, callers
 * release it before any backoff sleep.
 */
@Slf4j
public class RequestThrottle {

    private final int maxConcurrent;
    private final Semaphore concurrency;
    private final RateLimiter rateLimiter;

    public RequestThrottle(int maxConcurrent, RateLimiter rateLimiter) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1, got " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
        this.concurrency = new Semaphore(maxConcurrent, true);
        this.rateLimiter = rateLimiter;
    }

    public Permit acquire() throws InterruptedException {
        concurrency.acquire();
        try {
            // acquirePermission() returns false on timeout or interrupt; only the latter ends the wait
            while (!rateLimiter.acquirePermission()) {
                if (Thread.interrupted()) {
                    throw new InterruptedException("Interrupted waiting for rate limiter " + rateLimiter.getName());
                }
                log.debug("Rate limiter {} wait timed out, waiting again", rateLimiter.getName());
            }
        } catch (InterruptedException | RuntimeException e) {
            concurrency.release();
            throw e;
        }
        return new Permit(this);
    }

    public void release(Permit permit) {
        if (permit.owner != this) {
            throw new IllegalArgumentException("Permit was not issued by this throttle");
        }
        if (permit.released.compareAndSet(false, true)) {
            concurrency.release();
        }
    }

    public int inFlight() {
        return maxConcurrent - concurrency.availablePermits();
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    /** Handle for one in-flight request. Releasing it twice is a no-op. */
    public static final class Permit implements AutoCloseable {

        private final RequestThrottle owner;
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit(RequestThrottle owner) {
            this.owner = owner;
        }

        public boolean isReleased() {
            return released.get();
        }

        @Override
        public void close() {
            owner.release(this);
        }
    }
}
