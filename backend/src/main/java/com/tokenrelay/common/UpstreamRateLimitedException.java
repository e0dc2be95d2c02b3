package com.tokenrelay.common;

import java.time.Duration;
import java.util.Optional;

/**
 * Upstream answered HTTP 429. Not retried immediately; carries a retry hint when one is known.
 */
public class UpstreamRateLimitedException extends UpstreamException {

    private final Duration retryAfter;

    public UpstreamRateLimitedException(Upstream upstream, String message, Duration retryAfter) {
        super(upstream, message);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    /**
     * Copy with the given hint, used when the upstream sent no Retry-After header of its own.
     */
    public UpstreamRateLimitedException withRetryAfter(Duration hint) {
        UpstreamRateLimitedException copy = new UpstreamRateLimitedException(getUpstream(), getMessage(), hint);
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
