// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.error;

/**
 * Thrown when a request parameter cannot be written as JSON.
 *
 * <p>This indicates a programming error in how the call arguments were built.
 */
public final class SerializationException extends FactomException {

    private final String method;

    public SerializationException(final String method, final String message, final Throwable cause) {
        super(message, cause);
        this.method = method;
    }

    public String method() {
        return method;
    }
}
