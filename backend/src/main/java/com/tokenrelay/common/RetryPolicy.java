package com.tokenrelay.common;

import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Exponential backoff with ±jitter for transient upstream failures (connect errors, timeouts).
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (baseDelayMs < 0 || maxAttempts < 0) {
            throw new IllegalArgumentException("baseDelayMs and maxAttempts must not be negative");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds before the retry following the given zero-based attempt.
     * Formula: baseDelay * 2^attempt, then ±jitter.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(exponential);
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Reactor retry spec: failures matching {@code retryable} are retried up to {@link #getMaxAttempts()} times
     * with {@link #delayMs(int)} between attempts; anything else, or the last failure, propagates unchanged.
     */
    public Retry toRetry(Predicate<Throwable> retryable) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            if (!retryable.test(failure) || signal.totalRetries() >= maxAttempts) {
                return Mono.error(failure);
            }
            return Mono.delay(Duration.ofMillis(delayMs((int) signal.totalRetries())));
        }));
    }

    /**
     * Default: 250ms base, ±20% jitter, 2 retries.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(250L, 0.2, 2);
    }
}
