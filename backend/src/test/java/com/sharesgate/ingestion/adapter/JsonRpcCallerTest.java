package com.sharesgate.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonRpcCallerTest {

    @Test
    void call_success_returnsResultNode() {
        FakeJsonRpcClient client = new FakeJsonRpcClient().result("eth_blockNumber", "\"0x10\"");

        JsonNode result = client.caller(1).call("eth_blockNumber", List.of());

        assertThat(result.asText()).isEqualTo("0x10");
    }

    @Test
    void call_transientFailure_retriesOnNextEndpoint() {
        FakeJsonRpcClient client = new FakeJsonRpcClient()
                .failure("eth_blockNumber", new RpcException("connection reset"))
                .result("eth_blockNumber", "\"0x11\"");

        JsonNode result = client.caller(3, "https://a.rpc", "https://b.rpc").call("eth_blockNumber", List.of());

        assertThat(result.asText()).isEqualTo("0x11");
        assertThat(client.calls()).extracting(FakeJsonRpcClient.Call::endpoint)
                .containsExactly("https://a.rpc", "https://b.rpc");
    }

    @Test
    void call_jsonRpcError_throwsAfterAllAttempts() {
        FakeJsonRpcClient client = new FakeJsonRpcClient()
                .raw("eth_getLogs", """
                        {"jsonrpc":"2.0","id":1,"error":{"code":-32000,"message":"header not found"}}
                        """);

        assertThatThrownBy(() -> client.caller(2).call("eth_getLogs", List.of()))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("failed after 2 attempt(s)")
                .hasMessageContaining("header not found");
        assertThat(client.calls()).hasSize(2);
    }

    @Test
    void call_providerResultCap_throwsTooLargeWithoutRetry() {
        FakeJsonRpcClient client = new FakeJsonRpcClient()
                .raw("eth_getLogs", """
                        {"jsonrpc":"2.0","id":1,"error":{"code":-32005,"message":"query returned more than 10000 results"}}
                        """);

        assertThatThrownBy(() -> client.caller(3).call("eth_getLogs", List.of()))
                .isInstanceOf(ResponseTooLargeException.class)
                .hasMessageContaining("more than 10000 results");
        assertThat(client.calls()).hasSize(1);
    }

    @Test
    void call_bufferLimitExceeded_isNotRetried() {
        FakeJsonRpcClient client = new FakeJsonRpcClient()
                .failure("eth_getLogs", new ResponseTooLargeException("eth_getLogs exceeded 262144 bytes"))
                .result("eth_getLogs", "[]");

        assertThatThrownBy(() -> client.caller(3).call("eth_getLogs", List.of()))
                .isInstanceOf(ResponseTooLargeException.class);
        assertThat(client.calls()).hasSize(1);
    }

    @Test
    void isQueryTooLarge_matchesKnownProviderWording() {
        assertThat(JsonRpcCaller.isQueryTooLarge("query returned more than 10000 results")).isTrue();
        assertThat(JsonRpcCaller.isQueryTooLarge("Log response size exceeded. You can make eth_getLogs requests with up to a 2K block range")).isTrue();
        assertThat(JsonRpcCaller.isQueryTooLarge("block range is too wide")).isTrue();
        assertThat(JsonRpcCaller.isQueryTooLarge("header not found")).isFalse();
        assertThat(JsonRpcCaller.isQueryTooLarge("execution reverted")).isFalse();
    }

    @Test
    void call_malformedBody_throwsRpcException() {
        FakeJsonRpcClient client = new FakeJsonRpcClient().raw("eth_blockNumber", "<html>bad gateway</html>");

        assertThatThrownBy(() -> client.caller(1).call("eth_blockNumber", List.of()))
                .isInstanceOf(RpcException.class);
    }

    @Test
    void call_missingResult_throwsRpcException() {
        FakeJsonRpcClient client = new FakeJsonRpcClient().raw("eth_blockNumber", "{\"jsonrpc\":\"2.0\",\"id\":1}");

        assertThatThrownBy(() -> client.caller(1).call("eth_blockNumber", List.of()))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("no result");
    }

    @Test
    void constructor_noEndpoints_failsFast() {
        FakeJsonRpcClient client = new FakeJsonRpcClient();
        assertThatThrownBy(() -> new JsonRpcCaller("x", client, List.of(), null, null, null, null))
                .isInstanceOf(IllegalStateException.class);
    }
}
