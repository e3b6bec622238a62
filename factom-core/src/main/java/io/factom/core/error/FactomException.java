// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.error;

/**
 * Base runtime exception for all Factom client failures.
 *
 * <p>
 * The hierarchy is sealed, so a single catch clause covers every library
 * failure and the compiler knows the complete set of cases.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * FactomException
 * ├── {@link TransportException} - the HTTP exchange failed (bad URI, refused connection, IO)
 * ├── {@link SerializationException} - a request parameter could not be written as JSON
 * ├── {@link DeserializationException} - the response was not a well-formed JSON-RPC envelope
 * └── {@link RpcException} - a daemon error, raised only on request via {@code orElseThrow()}
 * </pre>
 *
 * <p>
 * A daemon that declines a request (for example a repeated entry commit) is
 * not a failure of the call. The typed clients return that outcome as data.
 *
 * <pre>{@code
 * try {
 *     ApiResponse<CommitEntry> response = factom.factomd().commitEntry(message);
 *     if (!response.success()) {
 *         // the daemon declined: inspect response.error().code()
 *     }
 * } catch (TransportException e) {
 *     // daemon unreachable or misconfigured URL
 * } catch (FactomException e) {
 *     // protocol mismatch or programmer error
 * }
 * }</pre>
 */
public sealed class FactomException extends RuntimeException
        permits TransportException,
        SerializationException,
        DeserializationException,
        RpcException {

    public FactomException(final String message) {
        super(message);
    }

    public FactomException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
