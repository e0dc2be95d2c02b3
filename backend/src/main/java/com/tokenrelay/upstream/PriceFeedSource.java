package com.tokenrelay.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.tokenrelay.cache.CoalescingCacheManager;
import com.tokenrelay.common.Upstream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Current USD prices for a set of token ids from the quote API price endpoint, cached and coalesced per id set.
 */
@Slf4j
public class PriceFeedSource {

    private final QuoteApiClient client;
    private final CoalescingCacheManager cacheManager;
    private final Duration priceTtl;
    private final Clock clock;

    public PriceFeedSource(QuoteApiClient client, CoalescingCacheManager cacheManager, Duration priceTtl, Clock clock) {
        this.client = client;
        this.cacheManager = cacheManager;
        this.priceTtl = priceTtl;
        this.clock = clock;
    }

    /**
     * Prices keyed by token id; ids the upstream does not price are absent. Empty when nothing was priced.
     */
    public Mono<Map<String, PricePoint>> fetchPrices(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return Mono.empty();
        }
        String joined = String.join(",", new TreeSet<>(ids));
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("ids", joined);
        return cacheManager.get(Upstream.QUOTE_API, "price:" + joined,
                () -> client.get(UpstreamEndpoint.PRICE, params).flatMap(root -> Mono.justOrEmpty(parse(root))),
                priceTtl);
    }

    /**
     * Accepts both {@code {data: {id: {price}}}} and the flat {@code {id: {usdPrice}}} shape.
     */
    Map<String, PricePoint> parse(JsonNode root) {
        JsonNode data = root.has("data") && root.get("data").isObject() ? root.get("data") : root;
        long now = clock.millis();
        Map<String, PricePoint> prices = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            BigDecimal price = price(field.getValue());
            if (price != null) {
                prices.put(field.getKey(), new PricePoint(price, now));
            } else {
                log.debug("No price for {}", field.getKey());
            }
        }
        return prices.isEmpty() ? null : Collections.unmodifiableMap(prices);
    }

    private static BigDecimal price(JsonNode info) {
        if (info == null || !info.isObject()) {
            return null;
        }
        JsonNode node = info.has("usdPrice") ? info.get("usdPrice") : info.get("price");
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
