package com.tokenrelay.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/rpc body. {@code params} shape depends on the method ({@code {address}} or {@code {addresses}}).
 */
public record RpcRelayRequest(@NotBlank(message = "METHOD_REQUIRED") String method, JsonNode params) {
}
