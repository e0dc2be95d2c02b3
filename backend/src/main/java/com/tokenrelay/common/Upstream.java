package com.tokenrelay.common;

/**
 * Rate-limited upstream services fronted by the relay. Each one gets its own token bucket and cache namespace.
 */
public enum Upstream {

    QUOTE_API("quote-api"),
    RPC_NODE("rpc-node");

    private final String id;

    Upstream(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
