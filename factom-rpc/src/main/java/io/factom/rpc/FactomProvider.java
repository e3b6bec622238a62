// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import io.factom.core.error.TransportException;
import java.util.concurrent.CompletableFuture;

/**
 * Low-level transport that posts an encoded JSON-RPC request to a daemon and
 * returns the raw response body.
 *
 * <p>
 * A provider does no JSON work. The body it returns goes to
 * {@link JsonRpcCodec} whatever the HTTP status, because Factom daemons answer
 * application errors with a JSON-RPC error envelope. Failures that happen
 * before a body has been read are reported as {@link TransportException}.
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe. Each
 * call owns its request and response buffers.
 *
 * <p>
 * <strong>Built-in Implementations:</strong>
 * <ul>
 * <li>{@link HttpFactomProvider} - HTTP/HTTPS transport on the JDK client (default)</li>
 * </ul>
 *
 * @see HttpFactomProvider
 */
public interface FactomProvider extends AutoCloseable {

    /**
     * Posts one request and blocks until the response body has been read.
     *
     * @param endpoint the daemon base URL
     * @param body the encoded request
     * @return the raw response body
     * @throws TransportException if the URL is invalid or the exchange fails
     */
    byte[] send(String endpoint, byte[] body) throws TransportException;

    /**
     * Posts one request without blocking the caller.
     *
     * <p>The default implementation runs {@link #send} on the common pool.
     * The returned future completes exceptionally with a
     * {@link TransportException} on failure.
     *
     * @param endpoint the daemon base URL
     * @param body the encoded request
     * @return a future for the raw response body
     */
    default CompletableFuture<byte[]> sendAsync(final String endpoint, final byte[] body) {
        return CompletableFuture.supplyAsync(() -> send(endpoint, body));
    }

    /**
     * Creates a default HTTP provider with no timeouts.
     *
     * @return a new FactomProvider instance
     */
    static FactomProvider http() {
        return HttpFactomProvider.builder().build();
    }

    /**
     * Releases any resources held by this provider. The default does nothing.
     */
    @Override
    default void close() {
    }
}
