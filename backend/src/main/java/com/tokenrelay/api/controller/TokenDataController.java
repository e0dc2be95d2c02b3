package com.tokenrelay.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.tokenrelay.api.dto.ErrorBody;
import com.tokenrelay.common.SolanaAddress;
import com.tokenrelay.upstream.TokenDataService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cached token data: pool info, chart, holders, recent transactions.
 */
@RestController
@RequestMapping("/api/tokens")
@RequiredArgsConstructor
public class TokenDataController {

    private static final Pattern INTERVAL = Pattern.compile("^[0-9]{1,3}_[A-Z]{3,6}$");
    private static final Set<String> CHART_TYPES = Set.of("price", "mcap");
    private static final int MAX_TX_LIMIT = 100;

    private final TokenDataService tokenDataService;

    @GetMapping("/{mint}")
    public Mono<ResponseEntity<?>> tokenInfo(@PathVariable String mint) {
        if (!SolanaAddress.isValid(mint)) {
            return Mono.just(invalidMint());
        }
        return orNotFound(tokenDataService.tokenInfo(mint), mint);
    }

    @GetMapping("/{mint}/chart")
    public Mono<ResponseEntity<?>> chart(
            @PathVariable String mint,
            @RequestParam(required = false, defaultValue = TokenDataService.DEFAULT_INTERVAL) String interval,
            @RequestParam(required = false, defaultValue = TokenDataService.DEFAULT_CHART_TYPE) String type
    ) {
        if (!SolanaAddress.isValid(mint)) {
            return Mono.just(invalidMint());
        }
        if (!INTERVAL.matcher(interval).matches() || !CHART_TYPES.contains(type)) {
            return Mono.just(ResponseEntity.badRequest()
                    .body(ErrorBody.of("INVALID_REQUEST", "interval must look like 15_MINUTE and type be price or mcap")));
        }
        return orNotFound(tokenDataService.chart(mint, interval, type), mint);
    }

    @GetMapping("/{mint}/holders")
    public Mono<ResponseEntity<?>> holders(@PathVariable String mint) {
        if (!SolanaAddress.isValid(mint)) {
            return Mono.just(invalidMint());
        }
        return orNotFound(tokenDataService.holders(mint), mint);
    }

    @GetMapping("/{mint}/transactions")
    public Mono<ResponseEntity<?>> transactions(
            @PathVariable String mint,
            @RequestParam(required = false) Integer limit
    ) {
        if (!SolanaAddress.isValid(mint)) {
            return Mono.just(invalidMint());
        }
        int effective = limit == null ? TokenDataService.DEFAULT_TX_LIMIT : limit;
        if (effective < 1 || effective > MAX_TX_LIMIT) {
            return Mono.just(ResponseEntity.badRequest()
                    .body(ErrorBody.of("INVALID_REQUEST", "limit must be between 1 and " + MAX_TX_LIMIT)));
        }
        return orNotFound(tokenDataService.transactions(mint, effective), mint);
    }

    private static Mono<ResponseEntity<?>> orNotFound(Mono<JsonNode> data, String mint) {
        return data.<ResponseEntity<?>>map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorBody.of("NOT_FOUND", "No data for " + mint)));
    }

    private static ResponseEntity<?> invalidMint() {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_MINT", "Invalid Solana mint address"));
    }
}
