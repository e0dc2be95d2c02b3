package com.tokenrelay.common;

/**
 * Upstream answered 4xx/5xx (other than 429). Passed through to the caller with status and payload, never retried.
 */
public class UpstreamRejectedException extends UpstreamException {

    private final int status;
    private final String responseBody;

    public UpstreamRejectedException(Upstream upstream, int status, String responseBody) {
        super(upstream, upstream.id() + " responded with HTTP " + status);
        this.status = status;
        this.responseBody = responseBody != null ? responseBody : "";
    }

    public int getStatus() {
        return status;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
