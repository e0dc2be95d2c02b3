package com.tokenrelay.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenrelay.support.MutableClock;
import com.tokenrelay.support.TestCacheManagers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PriceFeedSourceTest {

    private static final String SOL = "So11111111111111111111111111111111111111112";
    private static final String USDC = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";

    private final ObjectMapper mapper = new ObjectMapper();
    private MutableClock clock;
    private QuoteApiClient client;
    private PriceFeedSource source;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        client = mock(QuoteApiClient.class);
        source = new PriceFeedSource(client, TestCacheManagers.create(clock), Duration.ofSeconds(5), clock);
    }

    private JsonNode json(String raw) throws Exception {
        return mapper.readTree(raw);
    }

    @Test
    @SuppressWarnings("unchecked")
    void fetchPrices_parsesFlatShape_andSortsIds() throws Exception {
        when(client.get(eq(UpstreamEndpoint.PRICE), any())).thenReturn(Mono.just(json(
                "{\"" + SOL + "\":{\"usdPrice\":142.5},\"" + USDC + "\":{\"usdPrice\":\"0.9999\"}}")));

        StepVerifier.create(source.fetchPrices(List.of(SOL, USDC)))
                .assertNext(prices -> {
                    assertThat(prices.get(SOL).price()).isEqualByComparingTo(new BigDecimal("142.5"));
                    assertThat(prices.get(USDC).price()).isEqualByComparingTo(new BigDecimal("0.9999"));
                    assertThat(prices.get(SOL).timestamp()).isEqualTo(clock.millis());
                })
                .verifyComplete();

        ArgumentCaptor<MultiValueMap<String, String>> params = ArgumentCaptor.forClass(MultiValueMap.class);
        verify(client).get(eq(UpstreamEndpoint.PRICE), params.capture());
        assertThat(params.getValue().getFirst("ids")).isEqualTo(USDC + "," + SOL);
    }

    @Test
    void fetchPrices_sameIdSetInAnyOrder_sharesCacheEntry() throws Exception {
        when(client.get(eq(UpstreamEndpoint.PRICE), any())).thenReturn(Mono.just(json(
                "{\"data\":{\"" + SOL + "\":{\"price\":\"150\"}}}")));

        source.fetchPrices(List.of(SOL, USDC)).block();
        source.fetchPrices(List.of(USDC, SOL)).block();

        verify(client, times(1)).get(eq(UpstreamEndpoint.PRICE), any());
    }

    @Test
    void fetchPrices_nothingPriced_isEmpty() throws Exception {
        when(client.get(eq(UpstreamEndpoint.PRICE), any())).thenReturn(Mono.just(json(
                "{\"" + SOL + "\":null,\"" + USDC + "\":{\"usdPrice\":\"n/a\"}}")));

        StepVerifier.create(source.fetchPrices(List.of(SOL, USDC))).verifyComplete();
    }

    @Test
    void fetchPrices_noIds_noCall() {
        StepVerifier.create(source.fetchPrices(List.of())).verifyComplete();
        verify(client, times(0)).get(any(), any());
    }
}
