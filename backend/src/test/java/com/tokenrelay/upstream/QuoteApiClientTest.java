package com.tokenrelay.upstream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenrelay.common.RetryPolicy;
import com.tokenrelay.common.TransientNetworkException;
import com.tokenrelay.common.UpstreamRateLimitedException;
import com.tokenrelay.common.UpstreamRejectedException;
import com.tokenrelay.upstream.config.QuoteApiProperties;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class QuoteApiClientTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    private QuoteApiClient client(QuoteApiProperties properties, ExchangeFunction exchange) {
        ExchangeFunction recording = request -> {
            requests.add(request);
            return exchange.exchange(request);
        };
        return new QuoteApiClient(WebClient.builder().exchangeFunction(recording), properties,
                new RetryPolicy(0, 0, 2));
    }

    private static ExchangeFunction respond(HttpStatus status, String body) {
        return request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(body)
                .build());
    }

    private static QuoteApiProperties withKey(String key) {
        QuoteApiProperties properties = new QuoteApiProperties();
        properties.setApiKey(key);
        return properties;
    }

    @Test
    void get_withApiKey_usesAuthenticatedBaseUrlAndHeader() {
        QuoteApiClient client = client(withKey("secret"), respond(HttpStatus.OK, "{\"outAmount\":\"42\"}"));
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("inputMint", "So11111111111111111111111111111111111111112");
        params.add("amount", "1000");

        StepVerifier.create(client.get(UpstreamEndpoint.QUOTE, params))
                .expectNextMatches(node -> "42".equals(node.path("outAmount").asText()))
                .verifyComplete();

        ClientRequest request = requests.get(0);
        assertThat(request.url().toString())
                .startsWith("https://api.jup.ag/swap/v1/quote?")
                .contains("amount=1000");
        assertThat(request.headers().getFirst(QuoteApiClient.API_KEY_HEADER)).isEqualTo("secret");
    }

    @Test
    void get_withoutApiKey_usesPublicBaseUrl() {
        QuoteApiClient client = client(new QuoteApiProperties(), respond(HttpStatus.OK, "{}"));

        StepVerifier.create(client.get(UpstreamEndpoint.PRICE, null)).expectNextCount(1).verifyComplete();

        assertThat(requests.get(0).url().toString()).isEqualTo("https://lite-api.jup.ag/price/v3");
        assertThat(requests.get(0).headers().containsKey(QuoteApiClient.API_KEY_HEADER)).isFalse();
    }

    @Test
    void getData_usesDataBaseUrl() {
        QuoteApiClient client = client(withKey("secret"), respond(HttpStatus.OK, "{\"pools\":[]}"));

        StepVerifier.create(client.getData("/v1/holders/abc", null)).expectNextCount(1).verifyComplete();

        assertThat(requests.get(0).url()).isEqualTo(URI.create("https://datapi.jup.ag/v1/holders/abc"));
    }

    @Test
    void status429_mapsToRateLimitedWithRetryAfter() {
        QuoteApiClient client = client(withKey("secret"), request -> Mono.just(ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, "3")
                .build()));

        StepVerifier.create(client.get(UpstreamEndpoint.QUOTE, null))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(UpstreamRateLimitedException.class);
                    assertThat(((UpstreamRateLimitedException) e).getRetryAfter()).contains(Duration.ofSeconds(3));
                })
                .verify();
        assertThat(requests).hasSize(1);
    }

    @Test
    void errorStatus_mapsToRejectedWithBody_andIsNotRetried() {
        QuoteApiClient client = client(withKey("secret"), respond(HttpStatus.BAD_REQUEST, "{\"error\":\"bad amount\"}"));

        StepVerifier.create(client.post(UpstreamEndpoint.SWAP, new ObjectMapper().createObjectNode()))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(UpstreamRejectedException.class);
                    UpstreamRejectedException rejected = (UpstreamRejectedException) e;
                    assertThat(rejected.getStatus()).isEqualTo(400);
                    assertThat(rejected.getResponseBody()).contains("bad amount");
                })
                .verify();
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.POST);
    }

    @Test
    void connectionFailure_retriedThenTransient() {
        AtomicInteger attempts = new AtomicInteger();
        QuoteApiClient client = client(withKey("secret"), request -> {
            attempts.incrementAndGet();
            return Mono.error(new WebClientRequestException(new ConnectException("refused"), HttpMethod.GET,
                    request.url(), new HttpHeaders()));
        });

        StepVerifier.create(client.get(UpstreamEndpoint.TOKEN_SEARCH, null))
                .expectError(TransientNetworkException.class)
                .verify(Duration.ofSeconds(5));
        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    void connectionFailure_thenSuccess_recovers() {
        AtomicInteger attempts = new AtomicInteger();
        QuoteApiClient client = client(withKey("secret"), request -> attempts.incrementAndGet() == 1
                ? Mono.error(new WebClientRequestException(new ConnectException("refused"), HttpMethod.GET,
                        request.url(), new HttpHeaders()))
                : respond(HttpStatus.OK, "{\"ok\":true}").exchange(request));

        StepVerifier.create(client.get(UpstreamEndpoint.TOKEN_TAG, null))
                .expectNextCount(1)
                .verifyComplete();
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void parseRetryAfter_acceptsDeltaSecondsOnly() {
        assertThat(QuoteApiClient.parseRetryAfter("5")).isEqualTo(Duration.ofSeconds(5));
        assertThat(QuoteApiClient.parseRetryAfter(" 0 ")).isEqualTo(Duration.ZERO);
        assertThat(QuoteApiClient.parseRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT")).isNull();
        assertThat(QuoteApiClient.parseRetryAfter("-1")).isNull();
        assertThat(QuoteApiClient.parseRetryAfter(null)).isNull();
    }
}
