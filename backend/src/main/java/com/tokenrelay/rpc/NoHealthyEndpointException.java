package com.tokenrelay.rpc;

/**
 * Every RPC endpoint is unhealthy and the recovery pass did not bring any back. Fatal for the current call.
 */
public class NoHealthyEndpointException extends RpcException {

    public NoHealthyEndpointException(String message) {
        super(message);
    }
}
