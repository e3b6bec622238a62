// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when the HTTP exchange with a daemon fails before a response body is
 * read.
 *
 * <p>Causes include an unparseable or non-HTTP endpoint URL (a configuration
 * error), DNS or connection failures, and IO errors while reading the body.
 * No response decoding is attempted after a transport failure.
 */
public final class TransportException extends FactomException {

    private final String endpoint;

    public TransportException(final String endpoint, final String message, final @Nullable Throwable cause) {
        super(message + " [endpoint=" + endpoint + "]", cause);
        this.endpoint = endpoint;
    }

    /**
     * @return the endpoint URL the request was addressed to
     */
    public String endpoint() {
        return endpoint;
    }
}
