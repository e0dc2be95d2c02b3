package com.tokenrelay.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tokenrelay.cache.CoalescingCacheManager;
import com.tokenrelay.common.RequestFingerprint;
import com.tokenrelay.common.Upstream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.TreeMap;

/**
 * Proxy to whitelisted quote API endpoints. GETs are cached briefly (swap quotes a little longer) and coalesced;
 * POSTs are deduplicated by body fingerprint and throttled, never cached.
 */
@Slf4j
@RequiredArgsConstructor
public class QuoteProxyService {

    public static final String ENDPOINT_PARAM = "endpoint";

    private final QuoteApiClient client;
    private final CoalescingCacheManager cacheManager;
    private final Duration proxyTtl;
    private final Duration quoteTtl;

    /**
     * @param queryParams client query parameters; {@code endpoint} is dropped before forwarding
     */
    public Mono<ProxyResult> get(UpstreamEndpoint endpoint, MultiValueMap<String, String> queryParams) {
        MultiValueMap<String, String> forwarded = new LinkedMultiValueMap<>();
        if (queryParams != null) {
            queryParams.forEach((name, values) -> {
                if (!ENDPOINT_PARAM.equals(name)) {
                    forwarded.put(name, values);
                }
            });
        }
        String key = RequestFingerprint.of("GET " + endpoint.identifier(), new TreeMap<>(forwarded));
        return cacheManager.<JsonNode>getIfFresh(Upstream.QUOTE_API, key)
                .map(body -> {
                    log.debug("Proxy cache hit for {}", key);
                    return Mono.just(new ProxyResult(body, true));
                })
                .orElseGet(() -> {
                    // over the ceiling the cache manager serves the last known body without fetching
                    boolean servedFromCache = cacheManager.isOverRequestCeiling(Upstream.QUOTE_API, key);
                    return cacheManager.get(Upstream.QUOTE_API, key,
                                    () -> client.get(endpoint, forwarded), ttlFor(endpoint))
                            .map(body -> new ProxyResult(body, servedFromCache));
                });
    }

    private Duration ttlFor(UpstreamEndpoint endpoint) {
        return endpoint == UpstreamEndpoint.QUOTE ? quoteTtl : proxyTtl;
    }

    /**
     * @param body client body; its {@code endpoint} field is removed before forwarding
     */
    public Mono<JsonNode> post(UpstreamEndpoint endpoint, JsonNode body) {
        JsonNode forwarded = body;
        if (body instanceof ObjectNode object && object.has(ENDPOINT_PARAM)) {
            ObjectNode copy = object.deepCopy();
            copy.remove(ENDPOINT_PARAM);
            forwarded = copy;
        }
        JsonNode payload = forwarded;
        String key = RequestFingerprint.of("POST " + endpoint.identifier(), payload);
        return cacheManager.executeUncached(Upstream.QUOTE_API, key, () -> client.post(endpoint, payload));
    }
}
