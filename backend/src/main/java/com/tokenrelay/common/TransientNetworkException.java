package com.tokenrelay.common;

/**
 * Connection refused, reset or timed out. Retried with backoff by {@link RetryPolicy} before it surfaces.
 */
public class TransientNetworkException extends UpstreamException {

    public TransientNetworkException(Upstream upstream, String message, Throwable cause) {
        super(upstream, message, cause);
    }
}
