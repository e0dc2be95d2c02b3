package com.tokenrelay.rpc;

/**
 * Thrown when an RPC call fails (HTTP, JSON-RPC error, or every failover attempt used up).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
