// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.factom.core.error.DeserializationException;
import io.factom.core.error.RpcException;
import io.factom.core.error.TransportException;
import io.factom.core.model.Ack;
import io.factom.core.model.CommitEntry;
import io.factom.core.model.Entry;
import io.factom.core.model.MultipleBalances;
import io.factom.core.model.PendingEntry;
import io.factom.core.model.PendingTransaction;
import io.factom.core.model.Receipt;
import io.factom.rpc.internal.RpcInvoker;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DefaultFactomdClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final FactomConfig CONFIG = FactomConfig.defaults();
    private static final String FACTOMD = "http://localhost:8089/v2";
    private static final String ENTRY_HASH = "cc03cb3558b6b1acd24c5439fadee6523dd2811af82affb60f056df3374b39ae";

    @Mock
    private FactomProvider provider;

    private FactomdClient client;

    @BeforeEach
    void setUp() {
        client = new DefaultFactomdClient(new RpcInvoker(CONFIG, provider, new JsonRpcCodec()));
    }

    private void respond(String json) {
        when(provider.send(eq(FACTOMD), any(byte[].class))).thenReturn(json.getBytes(StandardCharsets.UTF_8));
    }

    private JsonNode sentRequest() throws IOException {
        final ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(provider).send(eq(FACTOMD), body.capture());
        return MAPPER.readTree(body.getValue());
    }

    @Test
    void entryDecodesResult() throws Exception {
        respond("""
                {"jsonrpc":"2.0","id":0,"result":{"chainid":"df3ade9e","content":"48656c6c6f",
                 "extids":["466163746f6d"]}}
                """);

        final ApiResponse<Entry> response = client.entry(ENTRY_HASH);

        assertTrue(response.success());
        assertEquals("48656c6c6f", response.result().content());
        final JsonNode request = sentRequest();
        assertEquals("entry", request.get("method").asText());
        assertEquals(ENTRY_HASH, request.get("params").get("hash").asText());
        assertEquals(0, request.get("id").asInt());
    }

    @Test
    void repeatedCommitIsFailureNotException() {
        respond("{\"jsonrpc\":\"2.0\",\"id\":0,\"error\":{\"code\":-1,\"message\":\"repeated commit\"}}");

        final ApiResponse<CommitEntry> response = client.commitEntry("00016227");

        assertFalse(response.success());
        assertEquals(-1, response.error().code());
        assertEquals("repeated commit", response.error().message());
        assertTrue(response.error().toException().isRepeatedCommit());
        assertThrows(RpcException.class, response::orElseThrow);
    }

    @Test
    void ackOmitsAbsentFullTransaction() throws Exception {
        respond("{\"jsonrpc\":\"2.0\",\"id\":0,\"result\":{\"txid\":\"f1d9\",\"status\":\"DBlockConfirmed\"}}");

        final ApiResponse<Ack> response = client.ack("f1d9", "f", null);

        assertEquals("DBlockConfirmed", response.result().status());
        final JsonNode params = sentRequest().get("params");
        assertEquals("f1d9", params.get("hash").asText());
        assertEquals("f", params.get("chainid").asText());
        assertFalse(params.has("fulltransaction"));
    }

    @Test
    void receiptSendsIncludeRawEntryOnlyWhenGiven() throws Exception {
        respond("{\"jsonrpc\":\"2.0\",\"id\":0,\"result\":{\"receipt\":{\"entry\":{\"entryhash\":\"cc03\"}}}}");

        final ApiResponse<Receipt> response = client.receipt(ENTRY_HASH, Boolean.TRUE);

        assertEquals("cc03", response.result().receipt().entry().entryhash());
        assertTrue(sentRequest().get("params").get("includerawentry").asBoolean());
    }

    @Test
    void noArgMethodsSendEmptyParams() throws Exception {
        respond("{\"jsonrpc\":\"2.0\",\"id\":0,\"result\":[]}");

        final ApiResponse<List<PendingEntry>> response = client.pendingEntries();

        assertTrue(response.result().isEmpty());
        final JsonNode request = sentRequest();
        assertEquals("pending-entries", request.get("method").asText());
        assertTrue(request.get("params").isObject());
        assertEquals(0, request.get("params").size());
    }

    @Test
    void pendingTransactionsDecodeAsList() throws Exception {
        respond("""
                {"jsonrpc":"2.0","id":0,"result":[{"transactionid":"b7a6","status":"AckStatus",
                 "inputs":[{"amount":1000,"address":"ab","useraddress":"FA2j"}],
                 "outputs":[],"ecoutputs":[],"fees":12000}]}
                """);

        final ApiResponse<List<PendingTransaction>> response = client.pendingTransactions("FA2j");

        assertEquals(1, response.result().size());
        assertEquals(12000L, response.result().get(0).fees());
        assertEquals("FA2j", sentRequest().get("params").get("address").asText());
    }

    @Test
    void multipleBalancesSendAddressList() throws Exception {
        respond("""
                {"jsonrpc":"2.0","id":0,"result":{"currentheight":10,"lastsavedheight":9,
                 "balances":[{"ack":1,"saved":1,"err":""}]}}
                """);

        final ApiResponse<MultipleBalances> response = client.multipleFactoidBalances(List.of("FA1", "FA2"));

        assertEquals(10L, response.result().currentheight());
        final JsonNode addresses = sentRequest().get("params").get("addresses");
        assertTrue(addresses.isArray());
        assertEquals("FA2", addresses.get(1).asText());
    }

    @Test
    void transportFailureIsRethrownWithoutDecoding() {
        final TransportException failure = new TransportException(FACTOMD, "Connection refused", null);
        when(provider.send(eq(FACTOMD), any(byte[].class))).thenThrow(failure);

        final TransportException ex = assertThrows(TransportException.class, () -> client.heights());
        assertSame(failure, ex);
    }

    @Test
    void malformedEnvelopeIsDeserializationException() {
        respond("<html>Bad Gateway</html>");

        final DeserializationException ex =
                assertThrows(DeserializationException.class, () -> client.heights());
        assertEquals("<html>Bad Gateway</html>", ex.body());
    }
}
