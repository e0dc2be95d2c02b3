package com.tokenrelay.upstream;

/**
 * Proxy request names an endpoint outside the {@link UpstreamEndpoint} whitelist.
 */
public class UnknownUpstreamEndpointException extends RuntimeException {

    public UnknownUpstreamEndpointException(String identifier) {
        super("Unknown endpoint: " + identifier);
    }
}
