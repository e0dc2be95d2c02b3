package com.tokenrelay.api.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenrelay.common.Upstream;
import com.tokenrelay.common.UpstreamRejectedException;
import com.tokenrelay.upstream.ProxyResult;
import com.tokenrelay.upstream.QuoteProxyService;
import com.tokenrelay.upstream.UpstreamEndpoint;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = QuoteProxyController.class)
class QuoteProxyControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    QuoteProxyService proxyService;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void get_missingEndpoint_returns400() {
        webTestClient.get().uri("/api/jupiter?query=bonk")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("ENDPOINT_REQUIRED");
        verifyNoInteractions(proxyService);
    }

    @Test
    void get_endpointOffWhitelist_returns400() {
        webTestClient.get().uri("/api/jupiter?endpoint=admin/v1/keys")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("UNKNOWN_ENDPOINT");
        verifyNoInteractions(proxyService);
    }

    @Test
    void get_setsCacheHeaders() {
        when(proxyService.get(eq(UpstreamEndpoint.QUOTE), any()))
                .thenReturn(Mono.just(new ProxyResult(mapper.createObjectNode().put("outAmount", "42"), true)));

        webTestClient.get().uri("/api/jupiter?endpoint=swap/v1/quote&amount=1000")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals(QuoteProxyController.CACHE_HEADER, "HIT")
                .expectHeader().valueEquals(HttpHeaders.CACHE_CONTROL, QuoteProxyController.PROXY_CACHE_CONTROL)
                .expectBody()
                .jsonPath("$.outAmount").isEqualTo("42");
    }

    @Test
    void get_requestCeilingReached_returns429WithRetryAfter() {
        when(proxyService.get(eq(UpstreamEndpoint.PRICE), any())).thenReturn(Mono.empty());

        webTestClient.get().uri("/api/jupiter?endpoint=price/v3&ids=abc")
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectHeader().valueEquals(HttpHeaders.RETRY_AFTER, "1")
                .expectBody()
                .jsonPath("$.error").isEqualTo("RATE_LIMITED");
    }

    @Test
    void get_upstreamRejection_mirrorsStatusAndBody() {
        when(proxyService.get(eq(UpstreamEndpoint.QUOTE), any())).thenReturn(Mono.error(
                new UpstreamRejectedException(Upstream.QUOTE_API, 422, "{\"error\":\"Could not find any route\"}")));

        webTestClient.get().uri("/api/jupiter?endpoint=swap/v1/quote")
                .exchange()
                .expectStatus().isEqualTo(422)
                .expectBody()
                .jsonPath("$.error").isEqualTo("UPSTREAM_ERROR")
                .jsonPath("$.details.error").isEqualTo("Could not find any route");
    }

    @Test
    void post_forwardsToService() {
        when(proxyService.post(eq(UpstreamEndpoint.SWAP), any()))
                .thenReturn(Mono.just(mapper.createObjectNode().put("swapTransaction", "AQAB")));

        webTestClient.post().uri("/api/jupiter")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"endpoint\":\"swap/v1/swap\",\"userPublicKey\":\"k\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.swapTransaction").isEqualTo("AQAB");
    }

    @Test
    void post_missingEndpoint_returns400() {
        webTestClient.post().uri("/api/jupiter")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"userPublicKey\":\"k\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("ENDPOINT_REQUIRED");
    }
}
