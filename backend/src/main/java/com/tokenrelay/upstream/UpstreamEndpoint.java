package com.tokenrelay.upstream;

import java.util.Arrays;

/**
 * Whitelist of quote API paths reachable through the proxy. Clients name an endpoint by its identifier
 * (e.g. {@code swap/v1/quote}); anything else is rejected, so the proxy never builds arbitrary upstream URLs.
 */
public enum UpstreamEndpoint {

    PRICE("price/v3", false),
    QUOTE("swap/v1/quote", true),
    SWAP("swap/v1/swap", true),
    SWAP_INSTRUCTIONS("swap/v1/swap-instructions", true),
    TOKEN_SEARCH("tokens/v2/search", false),
    TOKEN_TAG("tokens/v2/tag", false),
    ULTRA_ORDER("ultra/v1/order", true),
    ULTRA_EXECUTE("ultra/v1/execute", true);

    private final String identifier;
    private final boolean requiresApiKey;

    UpstreamEndpoint(String identifier, boolean requiresApiKey) {
        this.identifier = identifier;
        this.requiresApiKey = requiresApiKey;
    }

    public String identifier() {
        return identifier;
    }

    public String path() {
        return "/" + identifier;
    }

    public boolean requiresApiKey() {
        return requiresApiKey;
    }

    /**
     * Accepts the identifier with or without a leading slash.
     *
     * @throws UnknownUpstreamEndpointException when not whitelisted
     */
    public static UpstreamEndpoint fromIdentifier(String identifier) {
        String normalized = identifier == null ? "" : identifier.trim();
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        String candidate = normalized;
        return Arrays.stream(values())
                .filter(e -> e.identifier.equals(candidate))
                .findFirst()
                .orElseThrow(() -> new UnknownUpstreamEndpointException(identifier));
    }
}
