// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.core.type.TypeReference;
import io.factom.core.error.DeserializationException;
import io.factom.core.error.SerializationException;
import io.factom.core.error.TransportException;
import io.factom.core.model.Heights;
import io.factom.core.model.PendingEntry;
import io.factom.rpc.internal.RpcInvoker;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FactomAsyncClientTest {

    private static final String FACTOMD = "http://localhost:8089/v2";

    @Mock
    private FactomProvider provider;

    private FactomAsyncClient client;

    @BeforeEach
    void setUp() {
        client = new FactomAsyncClient(new RpcInvoker(FactomConfig.defaults(), provider, new JsonRpcCodec()));
    }

    private void respondAsync(String json) {
        when(provider.sendAsync(eq(FACTOMD), any(byte[].class)))
                .thenReturn(CompletableFuture.completedFuture(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void completesWithTypedResult() throws Exception {
        respondAsync("""
                {"jsonrpc":"2.0","id":0,"result":{"directoryblockheight":1,"leaderheight":2,
                 "entryblockheight":1,"entryheight":1}}
                """);

        final ApiResponse<Heights> response = client
                .callAsync(Daemon.FACTOMD, "heights", RpcParams.empty(), Heights.class)
                .get(5, TimeUnit.SECONDS);

        assertEquals(2L, response.result().leaderheight());
    }

    @Test
    void completesWithGenericResult() throws Exception {
        respondAsync("{\"jsonrpc\":\"2.0\",\"id\":0,\"result\":[{\"entryhash\":\"ab\",\"status\":\"AckStatus\"}]}");

        final ApiResponse<List<PendingEntry>> response = client
                .callAsync(Daemon.FACTOMD, "pending-entries", RpcParams.empty(),
                        new TypeReference<List<PendingEntry>>() {})
                .get(5, TimeUnit.SECONDS);

        assertEquals("ab", response.result().get(0).entryhash());
    }

    @Test
    void cancellingFutureCancelsExchange() {
        final CompletableFuture<byte[]> exchange = new CompletableFuture<>();
        when(provider.sendAsync(eq(FACTOMD), any(byte[].class))).thenReturn(exchange);

        final CompletableFuture<ApiResponse<Heights>> future =
                client.callAsync(Daemon.FACTOMD, "heights", RpcParams.empty(), Heights.class);
        future.cancel(true);

        assertTrue(exchange.isCancelled());
    }

    @Test
    void daemonErrorCompletesNormally() throws Exception {
        respondAsync("{\"jsonrpc\":\"2.0\",\"id\":0,\"error\":{\"code\":-32008,\"message\":\"Object not found\"}}");

        final ApiResponse<Heights> response = client
                .callAsync(Daemon.FACTOMD, "entry", RpcParams.of("hash", "ab"), Heights.class)
                .get(5, TimeUnit.SECONDS);

        assertTrue(response.isError());
        assertTrue(response.error().toException().isNotFound());
    }

    @Test
    void transportFailureCompletesExceptionally() {
        final TransportException failure = new TransportException(FACTOMD, "Connection refused", null);
        when(provider.sendAsync(eq(FACTOMD), any(byte[].class))).thenReturn(CompletableFuture.failedFuture(failure));

        final ExecutionException ex = assertThrows(ExecutionException.class, () -> client
                .callAsync(Daemon.FACTOMD, "heights", RpcParams.empty(), Heights.class)
                .get(5, TimeUnit.SECONDS));
        assertEquals(failure, ex.getCause());
    }

    @Test
    void malformedBodyCompletesExceptionally() {
        respondAsync("not json");

        final ExecutionException ex = assertThrows(ExecutionException.class, () -> client
                .callAsync(Daemon.FACTOMD, "heights", RpcParams.empty(), Heights.class)
                .get(5, TimeUnit.SECONDS));
        assertInstanceOf(DeserializationException.class, ex.getCause());
    }

    @Test
    void serializationFailureNeverReachesProvider() {
        final CompletableFuture<ApiResponse<Heights>> future =
                client.callAsync(Daemon.FACTOMD, "entry", RpcParams.of("hash", new Object()), Heights.class);

        final ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(SerializationException.class, ex.getCause());
        verify(provider, never()).sendAsync(anyString(), any(byte[].class));
    }
}
