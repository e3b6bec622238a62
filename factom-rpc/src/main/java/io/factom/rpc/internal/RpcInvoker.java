// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc.internal;

import com.fasterxml.jackson.databind.JavaType;
import io.factom.core.DebugLogger;
import io.factom.core.InternalApi;
import io.factom.core.LogFormatter;
import io.factom.core.error.FactomException;
import io.factom.core.error.TransportException;
import io.factom.rpc.ApiResponse;
import io.factom.rpc.Daemon;
import io.factom.rpc.FactomConfig;
import io.factom.rpc.FactomProvider;
import io.factom.rpc.JsonRpcCodec;
import io.factom.rpc.JsonRpcError;
import io.factom.rpc.JsonRpcResponse;
import io.factom.rpc.RpcParams;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs one typed RPC call: encode, route, send, decode the envelope, decode
 * the result.
 *
 * <p>Every typed client method is a one-line delegation to this class. The
 * invoker holds only immutable references, so a single instance serves any
 * number of concurrent callers.
 */
@InternalApi
public final class RpcInvoker {

    private final FactomConfig config;
    private final FactomProvider provider;
    private final JsonRpcCodec codec;

    public RpcInvoker(final FactomConfig config, final FactomProvider provider, final JsonRpcCodec codec) {
        this.config = Objects.requireNonNull(config, "config");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public FactomConfig config() {
        return config;
    }

    /**
     * Invokes a method and blocks for its typed outcome.
     *
     * @param daemon the daemon that serves the method
     * @param method the remote method name
     * @param params the named parameters
     * @param resultType the result type on success
     * @param <T> the result type
     * @return the typed outcome, a {@link ApiResponse.Failure} if the daemon declined
     * @throws FactomException on transport, serialization or envelope failures
     */
    public <T> ApiResponse<T> call(
            final Daemon daemon, final String method, final RpcParams params, final JavaType resultType) {
        final String endpoint = config.endpoint(daemon);
        final byte[] request = encode(method, params);
        final long start = System.nanoTime();
        final byte[] body;
        try {
            body = provider.send(endpoint, request);
        } catch (TransportException e) {
            logTransportError(daemon, method, e);
            throw e;
        }
        return complete(daemon, method, body, resultType, start);
    }

    /**
     * Invokes a method without blocking.
     *
     * <p>The returned future completes exceptionally with the same
     * {@link FactomException} types {@link #call} throws. Serialization
     * failures are reported through the future too. Cancelling it cancels the
     * provider's exchange.
     */
    public <T> CompletableFuture<ApiResponse<T>> callAsync(
            final Daemon daemon, final String method, final RpcParams params, final JavaType resultType) {
        final String endpoint = config.endpoint(daemon);
        final byte[] request;
        try {
            request = encode(method, params);
        } catch (FactomException e) {
            return CompletableFuture.failedFuture(e);
        }
        final long start = System.nanoTime();
        final CompletableFuture<ApiResponse<T>> result = new CompletableFuture<>();
        final CompletableFuture<byte[]> exchange = provider.sendAsync(endpoint, request);
        exchange.whenComplete((body, error) -> {
            if (error != null) {
                final Throwable cause = unwrap(error);
                if (cause instanceof TransportException transport) {
                    logTransportError(daemon, method, transport);
                }
                result.completeExceptionally(cause);
                return;
            }
            try {
                result.complete(complete(daemon, method, body, resultType, start));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    private byte[] encode(final String method, final RpcParams params) {
        final byte[] request = codec.encode(method, params.asMap());
        DebugLogger.logPayload(method, "request", request);
        return request;
    }

    private <T> ApiResponse<T> complete(
            final Daemon daemon,
            final String method,
            final byte[] body,
            final JavaType resultType,
            final long start) {
        DebugLogger.logPayload(method, "response", body);
        final JsonRpcResponse envelope = codec.decode(method, body);
        final long durationMicros = (System.nanoTime() - start) / 1_000L;
        if (envelope.hasError()) {
            final JsonRpcError err = envelope.error();
            DebugLogger.logRpc(LogFormatter.formatRpcError(
                    daemon.displayName(), method, err.code(), err.message(), durationMicros));
        } else {
            DebugLogger.logRpc(LogFormatter.formatRpc(daemon.displayName(), method, durationMicros));
        }
        return codec.toApiResponse(method, envelope, resultType);
    }

    private static void logTransportError(final Daemon daemon, final String method, final TransportException e) {
        DebugLogger.logRpc(LogFormatter.formatTransportError(
                daemon.displayName(), method, e.endpoint(), e.getMessage()));
    }

    private static Throwable unwrap(final Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
