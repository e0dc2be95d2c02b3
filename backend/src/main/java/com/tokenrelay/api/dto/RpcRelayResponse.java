package com.tokenrelay.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

public record RpcRelayResponse(JsonNode result) {
}
