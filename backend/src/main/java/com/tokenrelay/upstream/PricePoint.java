package com.tokenrelay.upstream;

import java.math.BigDecimal;

/**
 * USD price of one token at {@code timestamp} (epoch millis).
 */
public record PricePoint(BigDecimal price, long timestamp) {
}
