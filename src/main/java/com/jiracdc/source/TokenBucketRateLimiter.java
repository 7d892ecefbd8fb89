package com.jiracdc.source;

import com.jiracdc.core.engine.CancellationSignal;
import com.jiracdc.core.engine.OperationCancelledException;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Blocking token bucket guarding outbound Jira requests.
 *
 * <p>The bucket starts full with {@code burst} tokens and refills continuously at
 * {@code ratePerSecond}. Refill is computed lazily from {@link System#nanoTime()} on each
 * acquisition. A caller that finds the bucket empty sleeps until the next token is due,
 * waking early if its {@link CancellationSignal} fires.
 */
public class TokenBucketRateLimiter {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final double ratePerSecond;
    private final double burst;
    private final LongSupplier nanoClock;

    private double tokens;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(double ratePerSecond, int burst) {
        this(ratePerSecond, burst, System::nanoTime);
    }

    TokenBucketRateLimiter(double ratePerSecond, int burst, LongSupplier nanoClock) {
        if (ratePerSecond <= 0) {
            throw new IllegalArgumentException("ratePerSecond must be positive: " + ratePerSecond);
        }
        if (burst < 1) {
            throw new IllegalArgumentException("burst must be at least 1: " + burst);
        }
        this.ratePerSecond = ratePerSecond;
        this.burst = burst;
        this.nanoClock = nanoClock;
        this.tokens = burst;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    /**
     * Takes one token, blocking until one is available.
     *
     * @param signal cancellation signal of the calling operation
     * @return how long the caller waited
     * @throws OperationCancelledException if the signal fires before a token is obtained
     */
    public Duration acquire(CancellationSignal signal) {
        long waitedNanos = 0;
        while (true) {
            signal.throwIfCancelled();
            long waitNanos = tryReserve();
            if (waitNanos == 0) {
                return Duration.ofNanos(waitedNanos);
            }
            if (signal.await(Duration.ofNanos(waitNanos))) {
                throw new OperationCancelledException("Cancelled while waiting for rate limit token");
            }
            waitedNanos += waitNanos;
        }
    }

    /**
     * Takes a token if one is available.
     *
     * @return 0 when a token was taken, otherwise nanoseconds until the next token is due
     */
    synchronized long tryReserve() {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return 0;
        }
        double missing = 1.0 - tokens;
        return Math.max(1, (long) Math.ceil(missing * NANOS_PER_SECOND / ratePerSecond));
    }

    /** Current token count, for diagnostics. */
    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(burst, tokens + elapsed * ratePerSecond / NANOS_PER_SECOND);
        lastRefillNanos = now;
    }
}
