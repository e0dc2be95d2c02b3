package com.tokenrelay.rpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RpcMethodTest {

    private static final String WALLET = "9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM";
    private static final String MINT = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void fromRelayName_knownMethods() {
        assertThat(RpcMethod.fromRelayName("getBalance")).isEqualTo(RpcMethod.GET_BALANCE);
        assertThat(RpcMethod.fromRelayName("getMultipleAccountsInfo").nodeMethod()).isEqualTo("getMultipleAccounts");
    }

    @Test
    void fromRelayName_unknownMethod_rejected() {
        assertThatThrownBy(() -> RpcMethod.fromRelayName("sendTransaction"))
                .isInstanceOf(UnsupportedRpcMethodException.class)
                .hasMessageContaining("sendTransaction");
        assertThatThrownBy(() -> RpcMethod.fromRelayName(null))
                .isInstanceOf(UnsupportedRpcMethodException.class);
    }

    @Test
    void getBalance_positionalAddressWithCommitment() {
        ObjectNode params = mapper.createObjectNode().put("address", WALLET);

        List<Object> nodeParams = RpcMethod.GET_BALANCE.nodeParams(params);

        assertThat(nodeParams).hasSize(2);
        assertThat(nodeParams.get(0)).isEqualTo(WALLET);
        assertThat(nodeParams.get(1)).isEqualTo(Map.of("commitment", "confirmed"));
    }

    @Test
    void getAccountInfo_requestsBase64() {
        List<Object> nodeParams = RpcMethod.GET_ACCOUNT_INFO.nodeParams(mapper.createObjectNode().put("address", MINT));
        assertThat(nodeParams.get(1)).asInstanceOf(org.assertj.core.api.InstanceOfAssertFactories.MAP)
                .containsEntry("encoding", "base64");
    }

    @Test
    void getMultipleAccountsInfo_mapsAddressList() {
        ObjectNode params = mapper.createObjectNode();
        params.putArray("addresses").add(WALLET).add(MINT);

        List<Object> nodeParams = RpcMethod.GET_MULTIPLE_ACCOUNTS_INFO.nodeParams(params);

        assertThat(nodeParams.get(0)).isEqualTo(List.of(WALLET, MINT));
    }

    @Test
    void getMultipleAccountsInfo_rejectsEmptyAndOversizedLists() {
        ObjectNode empty = mapper.createObjectNode();
        empty.putArray("addresses");
        assertThatThrownBy(() -> RpcMethod.GET_MULTIPLE_ACCOUNTS_INFO.nodeParams(empty))
                .isInstanceOf(UnsupportedRpcMethodException.class);

        ObjectNode tooMany = mapper.createObjectNode();
        ArrayNode addresses = tooMany.putArray("addresses");
        for (int i = 0; i <= RpcMethod.MAX_ACCOUNTS; i++) {
            addresses.add(WALLET);
        }
        assertThatThrownBy(() -> RpcMethod.GET_MULTIPLE_ACCOUNTS_INFO.nodeParams(tooMany))
                .isInstanceOf(UnsupportedRpcMethodException.class)
                .hasMessageContaining("at most 100");
    }

    @Test
    void getSlot_needsNoParams() {
        assertThat(RpcMethod.GET_SLOT.nodeParams(null)).containsExactly(Map.of("commitment", "confirmed"));
    }

    @Test
    void missingOrInvalidAddress_rejected() {
        assertThatThrownBy(() -> RpcMethod.GET_TOKEN_ACCOUNT_BALANCE.nodeParams(mapper.createObjectNode()))
                .isInstanceOf(UnsupportedRpcMethodException.class)
                .hasMessageContaining("params.address");
        assertThatThrownBy(() -> RpcMethod.GET_BALANCE.nodeParams(mapper.createObjectNode().put("address", "0xabc")))
                .isInstanceOf(UnsupportedRpcMethodException.class)
                .hasMessageContaining("invalid Solana address");
    }
}
