// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.factom.core.error.TransportException;
import io.factom.core.model.Heights;
import io.factom.core.model.WalletHeight;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FactomTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer factomd;
    private HttpServer walletd;

    @BeforeEach
    void setUp() throws IOException {
        factomd = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        walletd = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        factomd.createContext("/v2", exchange -> respond(exchange, """
                {"jsonrpc":"2.0","id":0,"result":{"directoryblockheight":72498,"leaderheight":72498,
                 "entryblockheight":72498,"entryheight":72498}}
                """));
        walletd.createContext("/v2", exchange -> respond(exchange,
                "{\"jsonrpc\":\"2.0\",\"id\":0,\"result\":{\"height\":72497}}"));
        factomd.start();
        walletd.start();
    }

    @AfterEach
    void tearDown() {
        factomd.stop(0);
        walletd.stop(0);
    }

    private Factom connect() {
        return Factom.builder()
                .factomdUrl("http://127.0.0.1:" + factomd.getAddress().getPort() + "/v2")
                .walletdUrl("http://127.0.0.1:" + walletd.getAddress().getPort() + "/v2")
                .build();
    }

    @Test
    void eachClientTalksToItsOwnDaemon() {
        try (Factom factom = connect()) {
            final Heights heights = factom.factomd().heights().orElseThrow();
            final WalletHeight height = factom.walletd().getHeight().orElseThrow();

            assertEquals(72498L, heights.leaderheight());
            assertEquals(72497L, height.height());
        }
    }

    @Test
    void genericCallDecodesRequestedType() {
        try (Factom factom = connect()) {
            final ApiResponse<Map<String, Long>> response = factom.call(
                    Daemon.WALLETD, "get-height", RpcParams.empty(), new TypeReference<Map<String, Long>>() {});

            assertEquals(72497L, response.result().get("height"));
        }
    }

    @Test
    void httpsHostDerivesBothUrls() {
        final Factom factom = Factom.fromHttpsHost("node.example.com");

        assertEquals("https://node.example.com:8089/v2", factom.config().factomdUrl());
        assertEquals("https://node.example.com:8088/v2", factom.config().walletdUrl());
    }

    @Test
    void createTargetsLocalhost() {
        assertEquals(FactomConfig.defaults(), Factom.create().config());
    }

    @Test
    void urlOverrideKeepsOtherDerivedUrl() {
        final Factom factom = Factom.builder()
                .host("node.example.com")
                .factomdUrl("https://api.factomd.net/v2")
                .build();

        assertEquals("https://api.factomd.net/v2", factom.config().factomdUrl());
        assertEquals("http://node.example.com:8088/v2", factom.config().walletdUrl());
    }

    @Test
    void explicitConfigWins() {
        final FactomConfig config = FactomConfig.of("http://a:1/v2", "http://b:2/v2");

        assertEquals(config, Factom.builder().host("ignored").config(config).build().config());
    }

    @Test
    void unreachableWalletDaemonIsTransportFailure() throws IOException {
        final int closedPort;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            closedPort = socket.getLocalPort();
        }
        final String walletUrl = "http://127.0.0.1:" + closedPort + "/v2";

        try (Factom factom = Factom.builder()
                .factomdUrl("http://127.0.0.1:" + factomd.getAddress().getPort() + "/v2")
                .walletdUrl(walletUrl)
                .build()) {
            final TransportException ex = assertThrows(TransportException.class, () -> factom.walletd().getHeight());

            assertEquals(walletUrl, ex.endpoint());
            assertEquals(72498L, factom.factomd().heights().orElseThrow().leaderheight());
        }
    }

    @Test
    void malformedUrlFailsOnFirstCall() {
        final Factom factom = Factom.builder().config(FactomConfig.of("not a url", "not a url")).build();

        final TransportException ex = assertThrows(TransportException.class, () -> factom.factomd().heights());
        assertTrue(ex.getMessage().contains("not a url"));
    }

    @Test
    void pendingEntriesThroughGenericCall() {
        factomd.removeContext("/v2");
        factomd.createContext("/v2", exchange -> respond(exchange, "{\"jsonrpc\":\"2.0\",\"id\":0,\"result\":[]}"));

        try (Factom factom = connect()) {
            final ApiResponse<List<Object>> response = factom.call(
                    Daemon.FACTOMD, "pending-entries", RpcParams.empty(), new TypeReference<List<Object>>() {});

            assertTrue(response.result().isEmpty());
        }
    }

    @Test
    void echoedParamsComeBackUnchanged() {
        walletd.removeContext("/v2");
        walletd.createContext("/v2", exchange -> {
            final JsonNode request = MAPPER.readTree(exchange.getRequestBody());
            final ObjectNode reply = MAPPER.createObjectNode();
            reply.put("jsonrpc", "2.0");
            reply.put("id", 0);
            reply.set("result", request.get("params"));
            respond(exchange, MAPPER.writeValueAsString(reply));
        });
        final Map<String, Object> range = new LinkedHashMap<>();
        range.put("start", 1);
        range.put("end", 2);
        final List<RpcParams> calls = List.of(
                RpcParams.empty(),
                RpcParams.of("tx-name", "TX_NAME").put("address", "FA2jK2Hc").put("amount", 100),
                RpcParams.of("range", range),
                RpcParams.of("addresses", List.of(Map.of("secret", "Fs3E"))),
                RpcParams.of("tx-name", "TX_NAME").putIfPresent("force", null));

        try (Factom factom = connect()) {
            for (RpcParams params : calls) {
                final ApiResponse<Map<String, Object>> response = factom.call(
                        Daemon.WALLETD, "echo", params, new TypeReference<Map<String, Object>>() {});

                assertEquals(params.asMap(), response.result());
            }
        }
    }

    private static void respond(HttpExchange exchange, String body) throws IOException {
        exchange.getRequestBody().readAllBytes();
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
