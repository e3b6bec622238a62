// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * Generic JSON-RPC 2.0 response envelope, the output of the first decode
 * phase.
 *
 * <p>The success payload is kept as an undecoded {@link JsonNode} because its
 * shape depends on the method. {@link JsonRpcCodec#toApiResponse} performs the
 * second, method-specific phase.
 *
 * @param jsonrpc the protocol version reported by the daemon
 * @param id the echoed request id
 * @param result the raw result tree, or {@code null} if absent or JSON null
 * @param error the error object, or {@code null} if absent
 */
public record JsonRpcResponse(
        String jsonrpc,
        long id,
        @Nullable JsonNode result,
        @Nullable JsonRpcError error) {

    /**
     * Checks if this response carries an application error. An error object
     * with code {@code 0} does not count.
     *
     * @return {@code true} if the daemon declined the request
     */
    public boolean hasError() {
        return error != null && error.isError();
    }
}
