package com.tokenrelay.common;

/**
 * Base class for failures talking to an upstream (quote API or RPC node).
 */
public class UpstreamException extends RuntimeException {

    private final Upstream upstream;

    public UpstreamException(Upstream upstream, String message) {
        super(message);
        this.upstream = upstream;
    }

    public UpstreamException(Upstream upstream, String message, Throwable cause) {
        super(message, cause);
        this.upstream = upstream;
    }

    public Upstream getUpstream() {
        return upstream;
    }
}
