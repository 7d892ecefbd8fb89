package com.jiracdc.source;

import com.jiracdc.core.engine.CancellationSignal;
import com.jiracdc.core.engine.OperationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff for {@link TransientApiException}s.
 * Authentication, not-found and other client errors propagate immediately.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double backoffFactor;
    private final boolean jitter;

    public RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay,
                       double backoffFactor, boolean jitter) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.backoffFactor = backoffFactor;
        this.jitter = jitter;
    }

    public static RetryPolicy from(JiraProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxAttempts(),
                Duration.ofMillis(retry.getInitialDelayMs()),
                Duration.ofMillis(retry.getMaxDelayMs()),
                retry.getBackoffFactor(),
                retry.isJitter());
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0, false);
    }

    /**
     * Runs {@code call}, retrying transient failures.
     *
     * @param description used in log output, e.g. "GET /rest/api/2/search"
     * @throws TransientApiException when every attempt failed transiently
     * @throws OperationCancelledException if cancelled while backing off
     */
    public <T> T execute(String description, CancellationSignal signal, Supplier<T> call) {
        int attempt = 1;
        while (true) {
            try {
                return call.get();
            } catch (TransientApiException e) {
                if (attempt >= maxAttempts) {
                    log.warn("{} failed after {} attempt(s): {}", description, attempt, e.getMessage());
                    throw e;
                }
                Duration delay = delayFor(attempt, e);
                log.info("{} failed transiently (attempt {}/{}), retrying in {}ms: {}",
                        description, attempt, maxAttempts, delay.toMillis(), e.getMessage());
                if (signal.await(delay)) {
                    throw new OperationCancelledException("Cancelled while backing off: " + description);
                }
                attempt++;
            }
        }
    }

    /**
     * Delay before the retry following {@code attempt} (1-based). A Retry-After hint from the
     * server is honored when it exceeds the computed backoff.
     */
    Duration delayFor(int attempt, TransientApiException error) {
        double millis = initialDelay.toMillis() * Math.pow(backoffFactor, attempt - 1);
        millis = Math.min(millis, maxDelay.toMillis());
        if (jitter && millis > 0) {
            // +/- 10%
            millis += millis * 0.1 * (ThreadLocalRandom.current().nextDouble() * 2 - 1);
        }
        Duration backoff = Duration.ofMillis(Math.max(0, (long) millis));
        Duration retryAfter = error.getRetryAfter();
        if (retryAfter != null && retryAfter.compareTo(backoff) > 0) {
            return retryAfter;
        }
        return backoff;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
