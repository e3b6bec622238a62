// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.factom.core.error.TransportException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpFactomProviderTest {

    private HttpServer server;
    private String endpoint;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        endpoint = "http://127.0.0.1:" + server.getAddress().getPort() + "/v2";
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void postsJsonAndReturnsBody() {
        final AtomicReference<String> method = new AtomicReference<>();
        final AtomicReference<String> contentType = new AtomicReference<>();
        final AtomicReference<String> received = new AtomicReference<>();
        server.createContext("/v2", exchange -> {
            method.set(exchange.getRequestMethod());
            contentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            received.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, "{\"jsonrpc\":\"2.0\",\"id\":0,\"result\":{}}");
        });

        final HttpFactomProvider provider = HttpFactomProvider.builder().build();
        final byte[] body = provider.send(endpoint, "{\"method\":\"heights\"}".getBytes(StandardCharsets.UTF_8));

        assertEquals("{\"jsonrpc\":\"2.0\",\"id\":0,\"result\":{}}", new String(body, StandardCharsets.UTF_8));
        assertEquals("POST", method.get());
        assertEquals("application/json", contentType.get());
        assertEquals("{\"method\":\"heights\"}", received.get());
    }

    @Test
    void nonSuccessStatusStillReturnsBody() {
        server.createContext("/v2", exchange -> respond(exchange, 500,
                "{\"jsonrpc\":\"2.0\",\"id\":0,\"error\":{\"code\":-32601,\"message\":\"Method not found\"}}"));

        final byte[] body = HttpFactomProvider.builder().build().send(endpoint, new byte[0]);

        assertTrue(new String(body, StandardCharsets.UTF_8).contains("Method not found"));
    }

    @Test
    void sendsConfiguredHeaders() {
        final AtomicReference<String> auth = new AtomicReference<>();
        server.createContext("/v2", exchange -> {
            auth.set(exchange.getRequestHeaders().getFirst("Authorization"));
            respond(exchange, 200, "{}");
        });

        HttpFactomProvider.builder().header("Authorization", "Basic dXNlcjpwYXNz").build().send(endpoint, new byte[0]);

        assertEquals("Basic dXNlcjpwYXNz", auth.get());
    }

    @Test
    void connectionRefusedIsTransportException() {
        server.stop(0);

        final TransportException ex = assertThrows(TransportException.class,
                () -> HttpFactomProvider.builder().build().send(endpoint, new byte[0]));
        assertEquals(endpoint, ex.endpoint());
    }

    @Test
    void invalidUrlIsTransportException() {
        final TransportException ex = assertThrows(TransportException.class,
                () -> HttpFactomProvider.builder().build().send("not a url", new byte[0]));

        assertTrue(ex.getMessage().startsWith("Invalid endpoint URL"));
    }

    @Test
    void nonHttpSchemeIsTransportException() {
        assertThrows(TransportException.class,
                () -> HttpFactomProvider.builder().build().send("ftp://localhost:8089/v2", new byte[0]));
    }

    @Test
    void sendAsyncCompletesWithBody() throws Exception {
        server.createContext("/v2", exchange -> respond(exchange, 200, "{\"ok\":true}"));

        final byte[] body = HttpFactomProvider.builder().build()
                .sendAsync(endpoint, new byte[0])
                .get(5, TimeUnit.SECONDS);

        assertEquals("{\"ok\":true}", new String(body, StandardCharsets.UTF_8));
    }

    @Test
    void sendAsyncFailsWithTransportException() {
        server.stop(0);

        final ExecutionException ex = assertThrows(ExecutionException.class,
                () -> HttpFactomProvider.builder().build().sendAsync(endpoint, new byte[0]).get(5, TimeUnit.SECONDS));
        assertInstanceOf(TransportException.class, ex.getCause());
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
