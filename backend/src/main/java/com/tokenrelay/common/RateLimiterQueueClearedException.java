package com.tokenrelay.common;

/**
 * Thrown to callers whose request was still queued when the limiter queue was cleared or the limiter shut down.
 */
public class RateLimiterQueueClearedException extends RuntimeException {

    public RateLimiterQueueClearedException(String limiterName) {
        super("Rate limiter queue cleared: " + limiterName);
    }
}
