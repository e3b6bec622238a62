// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;
import java.util.Objects;

/**
 * Outbound JSON-RPC 2.0 request envelope.
 *
 * <p>Factom daemons take named parameters, so {@code params} is always a JSON
 * object (empty when the method takes none). Every request carries the fixed
 * id {@value #REQUEST_ID}: each call is its own HTTP exchange, so responses
 * never need correlating.
 *
 * @param jsonrpc the protocol version, always {@value #VERSION}
 * @param id the request id, always {@value #REQUEST_ID}
 * @param method the remote method name, e.g. {@code commit-entry}
 * @param params named parameters in insertion order
 */
@JsonPropertyOrder({"jsonrpc", "id", "method", "params"})
public record JsonRpcRequest(String jsonrpc, long id, String method, Map<String, ?> params) {

    public static final String VERSION = "2.0";
    public static final long REQUEST_ID = 0L;

    public JsonRpcRequest {
        Objects.requireNonNull(method, "method");
        if (method.isEmpty()) {
            throw new IllegalArgumentException("method must not be empty");
        }
        params = params == null ? Map.of() : params;
    }

    public static JsonRpcRequest of(final String method, final Map<String, ?> params) {
        return new JsonRpcRequest(VERSION, REQUEST_ID, method, params);
    }
}
