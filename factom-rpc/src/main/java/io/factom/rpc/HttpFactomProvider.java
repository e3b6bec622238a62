// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import io.factom.core.DebugLogger;
import io.factom.core.LogFormatter;
import io.factom.core.error.TransportException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.jspecify.annotations.Nullable;

/**
 * {@link FactomProvider} backed by the JDK {@link HttpClient}.
 *
 * <p>Every call is a single {@code POST} with
 * {@code Content-Type: application/json}. The HTTP status is not interpreted:
 * any body that was read is returned, and a non-2xx status only produces a
 * debug log line. No timeouts apply unless configured on the {@link Builder}.
 */
public final class HttpFactomProvider implements FactomProvider {

    private final HttpClient httpClient;
    private final @Nullable Duration requestTimeout;
    private final Map<String, String> headers;

    private HttpFactomProvider(final Builder builder) {
        final HttpClient.Builder clientBuilder = HttpClient.newBuilder();
        if (builder.connectTimeout != null) {
            clientBuilder.connectTimeout(builder.connectTimeout);
        }
        this.httpClient = clientBuilder.build();
        this.requestTimeout = builder.requestTimeout;
        this.headers = Map.copyOf(builder.headers);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public byte[] send(final String endpoint, final byte[] body) throws TransportException {
        final HttpRequest request = buildRequest(endpoint, body);
        final HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(endpoint, "Interrupted during JSON-RPC call", e);
        } catch (IOException e) {
            throw new TransportException(endpoint, "Network error during JSON-RPC call: " + describe(e), e);
        }
        return readBody(endpoint, response);
    }

    @Override
    public CompletableFuture<byte[]> sendAsync(final String endpoint, final byte[] body) {
        final HttpRequest request;
        try {
            request = buildRequest(endpoint, body);
        } catch (TransportException e) {
            return CompletableFuture.failedFuture(e);
        }

        final CompletableFuture<HttpResponse<byte[]>> exchange =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        final CompletableFuture<byte[]> result = new CompletableFuture<>();
        exchange.whenComplete((response, error) -> {
            if (error != null) {
                final Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                result.completeExceptionally(new TransportException(
                        endpoint, "Network error during JSON-RPC call: " + describe(cause), cause));
                return;
            }
            result.complete(readBody(endpoint, response));
        });
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    private HttpRequest buildRequest(final String endpoint, final byte[] body) {
        final HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder(URI.create(endpoint));
        } catch (IllegalArgumentException e) {
            throw new TransportException(endpoint, "Invalid endpoint URL: " + e.getMessage(), e);
        }
        builder.header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        if (requestTimeout != null) {
            builder.timeout(requestTimeout);
        }
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    private static byte[] readBody(final String endpoint, final HttpResponse<byte[]> response) {
        final int status = response.statusCode();
        if (status < 200 || status >= 300) {
            DebugLogger.logRpc(LogFormatter.formatHttpStatus(endpoint, status));
        }
        final byte[] body = response.body();
        return body == null ? new byte[0] : body;
    }

    private static String describe(final Throwable error) {
        final String message = error.getMessage();
        return message == null ? error.getClass().getSimpleName() : message;
    }

    public static final class Builder {
        private @Nullable Duration connectTimeout;
        private @Nullable Duration requestTimeout;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Sets the TCP connect timeout. Unset by default.
         */
        public Builder connectTimeout(final @Nullable Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        /**
         * Sets the timeout for a whole request/response exchange. Unset by default.
         */
        public Builder requestTimeout(final @Nullable Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        /**
         * Adds a header sent with every request, e.g. {@code Authorization}
         * for a daemon behind basic auth.
         */
        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public HttpFactomProvider build() {
            return new HttpFactomProvider(this);
        }
    }
}
