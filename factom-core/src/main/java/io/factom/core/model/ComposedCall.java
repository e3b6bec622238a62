// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A ready-to-send factomd request built by factom-walletd.
 *
 * <p>{@code compose-transaction} returns one of these for
 * {@code factoid-submit}; {@code compose-entry} and {@code compose-chain}
 * return a commit and a reveal pair (see {@link ComposedEntry}).
 *
 * @param jsonrpc the protocol version
 * @param id the request id chosen by the wallet
 * @param method the factomd method to call
 * @param params the named parameters for that method
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ComposedCall(String jsonrpc, long id, String method, Map<String, Object> params) {

    /**
     * Returns a string parameter, e.g. {@code message} for a commit or
     * {@code entry} for a reveal.
     *
     * @param name the parameter name
     * @return the value as a string, or {@code null} if absent
     */
    public @Nullable String param(final String name) {
        final Object value = params == null ? null : params.get(name);
        return value == null ? null : value.toString();
    }
}
