package com.newsdesk.curation.util;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One admitted call. {@link #reconcile(long)} corrects the reservation with the usage the provider
 * reported; {@link #close()} frees the concurrency slot. Closing twice is harmless.
 */
public final class RatePermit implements AutoCloseable {
    private final TokenBucketRateLimiter limiter;
    private final TokenBucketRateLimiter.Reservation reservation;
    private final long estimatedTokens;
    private final long acquiredAtNanos;
    private final AtomicBoolean reconciled = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    RatePermit(TokenBucketRateLimiter limiter, TokenBucketRateLimiter.Reservation reservation,
               long estimatedTokens, long acquiredAtNanos) {
        this.limiter = limiter;
        this.reservation = reservation;
        this.estimatedTokens = estimatedTokens;
        this.acquiredAtNanos = acquiredAtNanos;
    }

    public long estimatedTokens() {
        return estimatedTokens;
    }

    /** {@link System#nanoTime()} at which the limiter admitted this call. */
    public long acquiredAtNanos() {
        return acquiredAtNanos;
    }

    /** Applies once; later calls are ignored. Non-positive usage (provider did not report) is skipped. */
    public void reconcile(long actualTokens) {
        if (actualTokens <= 0) return;
        if (reconciled.compareAndSet(false, true)) {
            limiter.reconcile(reservation, actualTokens);
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            limiter.release();
        }
    }
}
