package com.tokenrelay.broadcast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tokenrelay.upstream.PricePoint;

import java.util.Map;

/**
 * Stream payload. {@code clientCount} is only sent with the connected message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BroadcastMessage(String type, Map<String, PricePoint> data, Integer clientCount, long timestamp) {

    public static final String CONNECTED = "connected";
    public static final String PRICE_UPDATE = "price-update";
}
