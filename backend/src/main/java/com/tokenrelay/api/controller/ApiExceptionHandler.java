package com.tokenrelay.api.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenrelay.api.dto.ErrorBody;
import com.tokenrelay.common.RateLimiterQueueClearedException;
import com.tokenrelay.common.TransientNetworkException;
import com.tokenrelay.common.UpstreamRateLimitedException;
import com.tokenrelay.common.UpstreamRejectedException;
import com.tokenrelay.rpc.NoHealthyEndpointException;
import com.tokenrelay.rpc.RpcException;
import com.tokenrelay.rpc.UnsupportedRpcMethodException;
import com.tokenrelay.upstream.UnknownUpstreamEndpointException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps request validation failures and the upstream error taxonomy to ErrorBody (error, details, timestamp).
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class ApiExceptionHandler {

    private final ObjectMapper objectMapper;

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String details = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + " is required")
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, details));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getReason()));
    }

    @ExceptionHandler(UnknownUpstreamEndpointException.class)
    public ResponseEntity<ErrorBody> handleUnknownEndpoint(UnknownUpstreamEndpointException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("UNKNOWN_ENDPOINT", ex.getMessage()));
    }

    @ExceptionHandler(UnsupportedRpcMethodException.class)
    public ResponseEntity<ErrorBody> handleUnsupportedMethod(UnsupportedRpcMethodException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("UNSUPPORTED_METHOD", ex.getMessage()));
    }

    @ExceptionHandler(UpstreamRateLimitedException.class)
    public ResponseEntity<ErrorBody> handleRateLimited(UpstreamRateLimitedException ex) {
        long seconds = retryAfterSeconds(ex.getRetryAfter().orElse(Duration.ZERO));
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, Long.toString(seconds))
                .body(ErrorBody.of("RATE_LIMITED", ex.getMessage()));
    }

    @ExceptionHandler(UpstreamRejectedException.class)
    public ResponseEntity<ErrorBody> handleRejected(UpstreamRejectedException ex) {
        return ResponseEntity.status(ex.getStatus())
                .body(ErrorBody.of("UPSTREAM_ERROR", upstreamDetails(ex)));
    }

    @ExceptionHandler(TransientNetworkException.class)
    public ResponseEntity<ErrorBody> handleTransient(TransientNetworkException ex) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorBody.of("UPSTREAM_UNAVAILABLE", ex.getMessage()));
    }

    @ExceptionHandler(NoHealthyEndpointException.class)
    public ResponseEntity<ErrorBody> handleNoHealthyEndpoint(NoHealthyEndpointException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("NO_HEALTHY_ENDPOINT", ex.getMessage()));
    }

    @ExceptionHandler(RpcException.class)
    public ResponseEntity<ErrorBody> handleRpc(RpcException ex) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorBody.of("RPC_ERROR", ex.getMessage()));
    }

    @ExceptionHandler(RateLimiterQueueClearedException.class)
    public ResponseEntity<ErrorBody> handleQueueCleared(RateLimiterQueueClearedException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("REQUEST_DROPPED", ex.getMessage()));
    }

    /**
     * Whole seconds, rounded up, never below one.
     */
    static long retryAfterSeconds(Duration retryAfter) {
        long millis = Math.max(0, retryAfter.toMillis());
        return Math.max(1, (millis + 999) / 1000);
    }

    private Object upstreamDetails(UpstreamRejectedException ex) {
        String body = ex.getResponseBody();
        if (body.isBlank()) {
            return ex.getMessage();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Upstream error body is not JSON: {}", e.getOriginalMessage());
            return body;
        }
    }
}
