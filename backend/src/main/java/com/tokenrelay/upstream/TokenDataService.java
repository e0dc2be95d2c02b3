package com.tokenrelay.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.tokenrelay.cache.CoalescingCacheManager;
import com.tokenrelay.cache.config.CacheProperties;
import com.tokenrelay.common.Upstream;
import com.tokenrelay.common.UpstreamRejectedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Cached token data from the data API: pool info, price chart, holders, recent transactions. Payloads are
 * relayed as-is; a 404 from the upstream yields empty and is not cached.
 */
@Slf4j
@RequiredArgsConstructor
public class TokenDataService {

    public static final String DEFAULT_INTERVAL = "15_MINUTE";
    public static final String DEFAULT_CHART_TYPE = "price";
    public static final int DEFAULT_TX_LIMIT = 10;
    static final int CHART_CANDLES = 96;
    static final Duration CHART_WINDOW = Duration.ofHours(24);

    private final QuoteApiClient client;
    private final CoalescingCacheManager cacheManager;
    private final CacheProperties.Ttl ttl;
    private final Clock clock;

    /**
     * First pool of the mint; empty when the mint has none.
     */
    public Mono<JsonNode> tokenInfo(String mint) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("assetIds", mint);
        return cached("token-info:" + mint, ttl.getTokenInfo(), () -> client.getData("/v1/pools", params)
                .flatMap(root -> {
                    JsonNode pools = root.path("pools");
                    return pools.isArray() && !pools.isEmpty() ? Mono.just(pools.get(0)) : Mono.empty();
                }));
    }

    /**
     * Last 24h of candles ending now.
     */
    public Mono<JsonNode> chart(String mint, String interval, String type) {
        String key = "chart:" + mint + ":" + interval + ":" + type;
        return cached(key, ttl.getChart(), () -> {
            long now = clock.millis();
            MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
            params.add("interval", interval);
            params.add("baseAsset", mint);
            params.add("from", Long.toString(now - CHART_WINDOW.toMillis()));
            params.add("to", Long.toString(now));
            params.add("type", type);
            params.add("candles", Integer.toString(CHART_CANDLES));
            return client.getData("/v2/charts/" + mint, params);
        });
    }

    public Mono<JsonNode> holders(String mint) {
        return cached("holders:" + mint, ttl.getHolders(), () -> client.getData("/v1/holders/" + mint, null));
    }

    public Mono<JsonNode> transactions(String mint, int limit) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("limit", Integer.toString(limit));
        return cached("txs:" + mint + ":" + limit, ttl.getTransactions(),
                () -> client.getData("/v1/txs/" + mint, params));
    }

    private Mono<JsonNode> cached(String key, Duration entryTtl, Supplier<Mono<JsonNode>> fetcher) {
        return cacheManager.get(Upstream.QUOTE_API, key, () -> fetcher.get()
                .onErrorResume(UpstreamRejectedException.class, e -> {
                    if (e.getStatus() == HttpStatus.NOT_FOUND.value()) {
                        log.debug("No data for {}", key);
                        return Mono.empty();
                    }
                    return Mono.error(e);
                }), entryTtl);
    }
}
