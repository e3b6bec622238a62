// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import com.fasterxml.jackson.core.type.TypeReference;
import io.factom.rpc.internal.RpcInvoker;
import io.factom.rpc.internal.RpcUtils;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Future-based access to either daemon for callers that prefer not to block.
 *
 * <p>
 * Requests go through {@link FactomProvider#sendAsync}, so the HTTP provider
 * never parks a caller thread while waiting for the daemon. Futures complete
 * exceptionally with the same {@link io.factom.core.error.FactomException}
 * types the blocking clients throw; a daemon-declined request completes
 * normally with an {@link ApiResponse.Failure}. Cancelling a future abandons
 * the call.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * FactomAsyncClient async = Factom.create().async();
 *
 * async.callAsync(Daemon.FACTOMD, "heights", RpcParams.empty(), Heights.class)
 *         .thenAccept(response -> System.out.println(response.result()));
 * }</pre>
 *
 * <p>
 * <strong>Thread Safety:</strong> This class is thread-safe and can be shared
 * across multiple threads.
 */
public final class FactomAsyncClient {

    private final RpcInvoker invoker;

    FactomAsyncClient(final RpcInvoker invoker) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
    }

    /**
     * Sends a request without blocking and decodes the result as {@code type}.
     *
     * @param daemon the daemon that serves the method
     * @param method the remote method name
     * @param params the named parameters
     * @param type the result type on success
     * @param <T> the result type
     * @return a future for the typed outcome
     */
    public <T> CompletableFuture<ApiResponse<T>> callAsync(
            final Daemon daemon, final String method, final RpcParams params, final Class<T> type) {
        return invoker.callAsync(daemon, method, params, RpcUtils.type(type));
    }

    /**
     * Variant of {@link #callAsync(Daemon, String, RpcParams, Class)} for
     * generic result shapes such as {@code List<PendingEntry>}.
     */
    public <T> CompletableFuture<ApiResponse<T>> callAsync(
            final Daemon daemon, final String method, final RpcParams params, final TypeReference<T> type) {
        return invoker.callAsync(daemon, method, params, RpcUtils.type(type));
    }
}
