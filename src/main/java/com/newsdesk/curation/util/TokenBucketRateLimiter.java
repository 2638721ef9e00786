package com.newsdesk.curation.util;

import com.newsdesk.curation.config.LlmProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared throughput gate in front of every language-model call (completions and embeddings).
 *
 * <p>A call is admitted only when all of the following hold:
 * <ul>
 *   <li>fewer than {@code maxConcurrent} permits are open,</li>
 *   <li>the token bucket covers the estimated cost (continuous refill at
 *       {@code tokensPerWindow / window}, capped at the burst capacity),</li>
 *   <li>tokens reserved during the trailing window plus this cost stay within {@code tokensPerWindow},</li>
 *   <li>no provider back-off is in effect (set after an HTTP 429).</li>
 * </ul>
 * The bucket smooths bursts; the ledger makes the per-window budget a hard cap over any rolling window,
 * which a bucket alone does not guarantee once its capacity is refilled.
 *
 * <p>All state sits behind one lock. Callers block in {@link #acquire(long)}, so it must be invoked from a
 * thread that may block (Reactor's {@code boundedElastic}, never an event loop).
 */
@Component
public class TokenBucketRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private final long tokensPerWindow;
    private final long capacity;
    private final long windowNanos;
    private final int maxConcurrent;
    private final double refillPerNano;

    private double balance;
    private long lastRefillNanos;
    private int inFlight;
    private long backoffUntilNanos;
    private final Deque<Reservation> ledger = new ArrayDeque<>();
    private long ledgerTokens;

    @Autowired
    public TokenBucketRateLimiter(LlmProperties props) {
        this(props.getTokensPerMinute(), props.effectiveBurstTokens(), props.getWindowMs(), props.getMaxConcurrent());
    }

    public TokenBucketRateLimiter(long tokensPerWindow, long burstTokens, long windowMillis, int maxConcurrent) {
        if (tokensPerWindow <= 0) throw new IllegalArgumentException("tokensPerWindow must be positive");
        if (windowMillis <= 0) throw new IllegalArgumentException("windowMillis must be positive");
        if (maxConcurrent <= 0) throw new IllegalArgumentException("maxConcurrent must be positive");
        this.tokensPerWindow = tokensPerWindow;
        this.capacity = Math.max(1L, Math.min(burstTokens > 0 ? burstTokens : tokensPerWindow, tokensPerWindow));
        this.windowNanos = TimeUnit.MILLISECONDS.toNanos(windowMillis);
        this.maxConcurrent = maxConcurrent;
        this.refillPerNano = (double) tokensPerWindow / (double) windowNanos;
        this.balance = capacity;
        this.lastRefillNanos = System.nanoTime();
        log.info("Rate limiter: {} tokens per {} ms, burst={}, maxConcurrent={}",
                tokensPerWindow, windowMillis, capacity, maxConcurrent);
    }

    /**
     * Block until a call costing {@code estimatedTokens} may start, then reserve it.
     * Costs above what can ever be admitted are clamped to that maximum.
     *
     * @return an open permit; close it when the call finishes, reconcile it when usage is known
     */
    public RatePermit acquire(long estimatedTokens) throws InterruptedException {
        long cost = Math.max(1L, estimatedTokens);
        if (cost > capacity) {
            log.warn("Estimated cost {} exceeds limiter capacity {}; clamping", cost, capacity);
            cost = capacity;
        }
        lock.lockInterruptibly();
        try {
            while (true) {
                long now = System.nanoTime();
                refill(now);
                evictExpired(now);

                long waitNanos;
                if (now < backoffUntilNanos) {
                    waitNanos = backoffUntilNanos - now;
                } else if (inFlight >= maxConcurrent) {
                    waitNanos = -1L;
                } else {
                    long tokenWait = balance >= cost ? 0L : (long) Math.ceil((cost - balance) / refillPerNano);
                    long windowWait = windowWaitNanos(now, cost);
                    if (tokenWait == 0L && windowWait == 0L) {
                        return admit(now, cost);
                    }
                    waitNanos = Math.max(1L, Math.max(tokenWait, windowWait));
                }

                if (waitNanos < 0) {
                    changed.await();
                } else {
                    changed.awaitNanos(waitNanos);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pause every admission until {@code retryAfter} has elapsed. Called when the provider answers 429.
     */
    public void onRateLimited(Duration retryAfter) {
        long pauseNanos = Math.max(0L, retryAfter != null ? retryAfter.toNanos() : 0L);
        lock.lock();
        try {
            long until = System.nanoTime() + pauseNanos;
            if (until - backoffUntilNanos > 0) {
                backoffUntilNanos = until;
            }
            log.warn("Provider rate limit hit; pausing admissions for {} ms", TimeUnit.NANOSECONDS.toMillis(pauseNanos));
        } finally {
            lock.unlock();
        }
    }

    public RateBudgetSnapshot snapshot() {
        lock.lock();
        try {
            long now = System.nanoTime();
            refill(now);
            evictExpired(now);
            long backoffMs = now < backoffUntilNanos ? TimeUnit.NANOSECONDS.toMillis(backoffUntilNanos - now) : 0L;
            return new RateBudgetSnapshot((long) Math.floor(balance), capacity, ledgerTokens, tokensPerWindow,
                    inFlight, maxConcurrent, backoffMs);
        } finally {
            lock.unlock();
        }
    }

    /** Approximate tokens from text length (~4 chars per token). */
    public static long estimateTokens(String text) {
        if (text == null || text.isEmpty()) return 0L;
        return Math.max(1L, Math.round(text.length() / 4.0));
    }

    void reconcile(Reservation reservation, long actualTokens) {
        long delta = Math.max(0L, actualTokens) - reservation.tokens;
        if (delta == 0L) return;
        lock.lock();
        try {
            balance = Math.min(capacity, balance - delta);
            if (!reservation.expired) {
                reservation.tokens += delta;
                ledgerTokens += delta;
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void release() {
        lock.lock();
        try {
            inFlight = Math.max(0, inFlight - 1);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private RatePermit admit(long now, long cost) {
        balance -= cost;
        inFlight++;
        Reservation r = new Reservation(now, cost);
        ledger.addLast(r);
        ledgerTokens += cost;
        return new RatePermit(this, r, cost, now);
    }

    private void refill(long now) {
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            balance = Math.min(capacity, balance + elapsed * refillPerNano);
            lastRefillNanos = now;
        }
    }

    private void evictExpired(long now) {
        while (!ledger.isEmpty() && now - ledger.peekFirst().atNanos >= windowNanos) {
            Reservation r = ledger.removeFirst();
            r.expired = true;
            ledgerTokens -= r.tokens;
        }
    }

    private long windowWaitNanos(long now, long cost) {
        long excess = ledgerTokens + cost - tokensPerWindow;
        if (excess <= 0) return 0L;
        long freed = 0L;
        for (Reservation r : ledger) {
            freed += r.tokens;
            if (freed >= excess) {
                return Math.max(1L, r.atNanos + windowNanos - now);
            }
        }
        // Reconciled usage above the budget; wait a full window for it to drain.
        return windowNanos;
    }

    static final class Reservation {
        final long atNanos;
        long tokens;
        boolean expired;

        Reservation(long atNanos, long tokens) {
            this.atNanos = atNanos;
            this.tokens = tokens;
        }
    }

    public record RateBudgetSnapshot(long balance, long capacity, long windowTokens, long tokensPerWindow,
                                     int inFlight, int maxConcurrent, long backoffRemainingMs) {
    }
}
