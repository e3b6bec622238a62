// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import io.factom.core.error.RpcException;
import java.util.Objects;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Typed outcome of a completed Factom RPC call.
 *
 * <p>
 * A call that reached the daemon and got back a well-formed envelope always
 * produces an {@code ApiResponse}, whether or not the daemon accepted the
 * request:
 * <ul>
 * <li>{@link Success} carries the method-specific result</li>
 * <li>{@link Failure} carries the daemon's {@link JsonRpcError} (nonzero code)</li>
 * </ul>
 * Transport, serialization and envelope decoding problems are thrown as
 * {@link io.factom.core.error.FactomException} instead and never show up here.
 *
 * <pre>{@code
 * ApiResponse<CommitEntry> response = factom.factomd().commitEntry(message);
 * if (response.success()) {
 *     System.out.println(response.result().entryhash());
 * } else if (response.error().code() == RpcException.REPEATED_COMMIT) {
 *     // already committed, go straight to reveal
 * }
 *
 * // or, exception style
 * CommitEntry commit = factom.factomd().commitEntry(message).orElseThrow();
 * }</pre>
 *
 * @param <T> the result type of the method
 */
public sealed interface ApiResponse<T> permits ApiResponse.Success, ApiResponse.Failure {

    /**
     * @return the JSON-RPC version reported by the daemon
     */
    String jsonrpc();

    /**
     * @return the echoed request id
     */
    long id();

    /**
     * Returns whether the daemon accepted the request. This is true exactly
     * when the response carried no error or an error with code {@code 0}.
     *
     * @return true for {@link Success}
     */
    boolean success();

    default boolean isError() {
        return !success();
    }

    /**
     * Returns the decoded result.
     *
     * @return the result, which may be {@code null} for a JSON null result
     * @throws IllegalStateException if this is a {@link Failure}
     */
    @Nullable T result();

    /**
     * @return the daemon error, or {@code null} for a {@link Success}
     */
    @Nullable JsonRpcError error();

    /**
     * Returns the result, or throws the daemon error as an {@link RpcException}.
     *
     * @return the result
     * @throws RpcException if this is a {@link Failure}
     */
    @Nullable T orElseThrow();

    /**
     * Transforms the result of a {@link Success}; a {@link Failure} is passed
     * through with its error unchanged.
     *
     * @param mapper the function applied to the result
     * @param <U> the new result type
     * @return the mapped response
     */
    <U> ApiResponse<U> map(Function<? super T, ? extends U> mapper);

    static <T> ApiResponse<T> ofResult(final String jsonrpc, final long id, final @Nullable T result) {
        return new Success<>(jsonrpc, id, result);
    }

    static <T> ApiResponse<T> ofError(final String jsonrpc, final long id, final JsonRpcError error) {
        return new Failure<>(jsonrpc, id, error);
    }

    /**
     * The daemon accepted the request.
     */
    record Success<T>(String jsonrpc, long id, @Nullable T result) implements ApiResponse<T> {

        @Override
        public boolean success() {
            return true;
        }

        @Override
        public @Nullable JsonRpcError error() {
            return null;
        }

        @Override
        public @Nullable T orElseThrow() {
            return result;
        }

        @Override
        public <U> ApiResponse<U> map(final Function<? super T, ? extends U> mapper) {
            return new Success<>(jsonrpc, id, mapper.apply(result));
        }
    }

    /**
     * The daemon declined the request with a nonzero error code.
     */
    record Failure<T>(String jsonrpc, long id, JsonRpcError error) implements ApiResponse<T> {

        public Failure {
            Objects.requireNonNull(error, "error");
            if (!error.isError()) {
                throw new IllegalArgumentException("error code 0 is not a failure");
            }
        }

        @Override
        public boolean success() {
            return false;
        }

        @Override
        public T result() {
            throw new IllegalStateException(
                    "No result: daemon returned error " + error.code() + " (" + error.message() + ")");
        }

        @Override
        public T orElseThrow() {
            throw error.toException();
        }

        @Override
        public <U> ApiResponse<U> map(final Function<? super T, ? extends U> mapper) {
            return new Failure<>(jsonrpc, id, error);
        }
    }
}
