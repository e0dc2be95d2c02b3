package com.tokenrelay.rpc;

/**
 * Relay request names a method outside {@link RpcMethod} or carries unusable params.
 */
public class UnsupportedRpcMethodException extends RuntimeException {

    public UnsupportedRpcMethodException(String message) {
        super(message);
    }
}
