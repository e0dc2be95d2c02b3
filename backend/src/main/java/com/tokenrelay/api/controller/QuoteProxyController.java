package com.tokenrelay.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.tokenrelay.api.dto.ErrorBody;
import com.tokenrelay.common.Upstream;
import com.tokenrelay.common.UpstreamRateLimitedException;
import com.tokenrelay.upstream.QuoteProxyService;
import com.tokenrelay.upstream.UpstreamEndpoint;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * GET/POST /api/jupiter. Proxies whitelisted quote API endpoints named by the {@code endpoint} parameter.
 */
@RestController
@RequestMapping("/api/jupiter")
@RequiredArgsConstructor
public class QuoteProxyController {

    static final String CACHE_HEADER = "X-Cache";
    static final String PROXY_CACHE_CONTROL = "public, s-maxage=1, stale-while-revalidate=59";

    private final QuoteProxyService proxyService;

    @GetMapping
    public Mono<ResponseEntity<?>> get(@RequestParam MultiValueMap<String, String> params) {
        String endpoint = params.getFirst(QuoteProxyService.ENDPOINT_PARAM);
        if (!StringUtils.hasText(endpoint)) {
            return Mono.just(endpointRequired());
        }
        UpstreamEndpoint target = UpstreamEndpoint.fromIdentifier(endpoint);
        return proxyService.get(target, params)
                .switchIfEmpty(Mono.error(() -> ceilingReached(target)))
                .<ResponseEntity<?>>map(result -> ResponseEntity.ok()
                        .header(CACHE_HEADER, result.cacheHit() ? "HIT" : "MISS")
                        .header(HttpHeaders.CACHE_CONTROL, PROXY_CACHE_CONTROL)
                        .body(result.body()));
    }

    @PostMapping
    public Mono<ResponseEntity<?>> post(@RequestBody JsonNode body) {
        String endpoint = body != null && body.path(QuoteProxyService.ENDPOINT_PARAM).isTextual()
                ? body.get(QuoteProxyService.ENDPOINT_PARAM).asText()
                : null;
        if (!StringUtils.hasText(endpoint)) {
            return Mono.just(endpointRequired());
        }
        UpstreamEndpoint target = UpstreamEndpoint.fromIdentifier(endpoint);
        return proxyService.post(target, body)
                .<ResponseEntity<?>>map(ResponseEntity::ok);
    }

    private static ResponseEntity<?> endpointRequired() {
        return ResponseEntity.badRequest().body(ErrorBody.of("ENDPOINT_REQUIRED", "endpoint is required"));
    }

    private static UpstreamRateLimitedException ceilingReached(UpstreamEndpoint target) {
        return new UpstreamRateLimitedException(Upstream.QUOTE_API,
                "Request ceiling reached for " + target.identifier(), Duration.ofSeconds(1));
    }
}
