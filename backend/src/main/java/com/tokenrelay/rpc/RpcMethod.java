package com.tokenrelay.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.tokenrelay.common.SolanaAddress;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Closed set of RPC methods the relay forwards. Each maps relay params ({@code {address}} or
 * {@code {addresses: [...]}}) to the node's positional JSON-RPC params.
 */
public enum RpcMethod {

    GET_BALANCE("getBalance", "getBalance"),
    GET_ACCOUNT_INFO("getAccountInfo", "getAccountInfo"),
    GET_MULTIPLE_ACCOUNTS_INFO("getMultipleAccountsInfo", "getMultipleAccounts"),
    GET_SLOT("getSlot", "getSlot"),
    GET_TOKEN_ACCOUNT_BALANCE("getTokenAccountBalance", "getTokenAccountBalance");

    public static final int MAX_ACCOUNTS = 100;

    private static final Map<String, Object> CONFIRMED = Map.of("commitment", "confirmed");
    private static final Map<String, Object> ACCOUNT_CONFIG = Map.of("commitment", "confirmed", "encoding", "base64");

    private final String relayName;
    private final String nodeMethod;

    RpcMethod(String relayName, String nodeMethod) {
        this.relayName = relayName;
        this.nodeMethod = nodeMethod;
    }

    public String relayName() {
        return relayName;
    }

    public String nodeMethod() {
        return nodeMethod;
    }

    /**
     * @throws UnsupportedRpcMethodException for unknown names
     */
    public static RpcMethod fromRelayName(String name) {
        return Arrays.stream(values())
                .filter(m -> m.relayName.equals(name))
                .findFirst()
                .orElseThrow(() -> new UnsupportedRpcMethodException("Unsupported method: " + name));
    }

    /**
     * Positional node params for the relay params.
     *
     * @throws UnsupportedRpcMethodException when required params are missing or malformed
     */
    public List<Object> nodeParams(JsonNode params) {
        return switch (this) {
            case GET_BALANCE, GET_TOKEN_ACCOUNT_BALANCE -> List.of(address(params), CONFIRMED);
            case GET_ACCOUNT_INFO -> List.of(address(params), ACCOUNT_CONFIG);
            case GET_MULTIPLE_ACCOUNTS_INFO -> List.of(addresses(params), ACCOUNT_CONFIG);
            case GET_SLOT -> List.of(CONFIRMED);
        };
    }

    private String address(JsonNode params) {
        JsonNode node = params == null ? null : params.get("address");
        if (node == null || !node.isTextual()) {
            throw new UnsupportedRpcMethodException(relayName + " requires params.address");
        }
        return validAddress(node.asText());
    }

    private List<String> addresses(JsonNode params) {
        JsonNode node = params == null ? null : params.get("addresses");
        if (node == null || !node.isArray() || node.isEmpty()) {
            throw new UnsupportedRpcMethodException(relayName + " requires a non-empty params.addresses array");
        }
        if (node.size() > MAX_ACCOUNTS) {
            throw new UnsupportedRpcMethodException(relayName + " accepts at most " + MAX_ACCOUNTS + " addresses");
        }
        List<String> addresses = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new UnsupportedRpcMethodException(relayName + " addresses must be strings");
            }
            addresses.add(validAddress(item.asText()));
        }
        return List.copyOf(addresses);
    }

    private String validAddress(String address) {
        if (!SolanaAddress.isValid(address)) {
            throw new UnsupportedRpcMethodException(relayName + ": invalid Solana address " + address);
        }
        return address;
    }
}
