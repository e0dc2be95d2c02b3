package com.tokenrelay.api.controller;

import com.fasterxml.jackson.databind.node.LongNode;
import com.tokenrelay.rpc.NoHealthyEndpointException;
import com.tokenrelay.rpc.RpcException;
import com.tokenrelay.rpc.RpcRelayService;
import com.tokenrelay.rpc.UnsupportedRpcMethodException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = RpcRelayController.class)
class RpcRelayControllerTest {

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    RpcRelayService rpcRelayService;

    private WebTestClient.ResponseSpec post(String body) {
        return webTestClient.post().uri("/api/rpc")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    @Test
    void relay_returnsResult() {
        when(rpcRelayService.relay(eq("getSlot"), any())).thenReturn(Mono.just(LongNode.valueOf(287654321L)));

        post("{\"method\":\"getSlot\"}")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.result").isEqualTo(287654321);
    }

    @Test
    void relay_missingMethod_returns400() {
        post("{\"params\":{}}")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("METHOD_REQUIRED");
    }

    @Test
    void relay_unsupportedMethod_returns400() {
        when(rpcRelayService.relay(eq("sendTransaction"), any()))
                .thenThrow(new UnsupportedRpcMethodException("Unsupported method: sendTransaction"));

        post("{\"method\":\"sendTransaction\"}")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("UNSUPPORTED_METHOD");
    }

    @Test
    void relay_noHealthyEndpoint_returns503() {
        when(rpcRelayService.relay(eq("getSlot"), any()))
                .thenReturn(Mono.error(new NoHealthyEndpointException("No healthy RPC endpoint available")));

        post("{\"method\":\"getSlot\"}")
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("NO_HEALTHY_ENDPOINT");
    }

    @Test
    void relay_allAttemptsFailed_returns502() {
        when(rpcRelayService.relay(eq("getSlot"), any()))
                .thenReturn(Mono.error(new RpcException("All RPC attempts failed (3): timeout")));

        post("{\"method\":\"getSlot\"}")
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("RPC_ERROR");
    }

    @Test
    void relay_requestCeilingReached_returns429() {
        when(rpcRelayService.relay(eq("getSlot"), any())).thenReturn(Mono.empty());

        post("{\"method\":\"getSlot\"}")
                .expectStatus().isEqualTo(429)
                .expectHeader().valueEquals("Retry-After", "1");
    }
}
