// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a daemon response is not a well-formed JSON-RPC envelope, or when
 * its result does not match the shape expected for the method.
 *
 * <p>This usually means a protocol mismatch between the client and the daemon
 * version, or a malfunctioning daemon or proxy.
 */
public final class DeserializationException extends FactomException {

    private final @Nullable String body;

    public DeserializationException(final String message, final @Nullable String body, final @Nullable Throwable cause) {
        super(message, cause);
        this.body = body;
    }

    public DeserializationException(final String message, final @Nullable String body) {
        this(message, body, null);
    }

    /**
     * @return the raw response body that failed to decode, if available
     */
    public @Nullable String body() {
        return body;
    }
}
