// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import static io.factom.rpc.internal.RpcUtils.MAPPER;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import io.factom.core.error.DeserializationException;
import io.factom.core.error.SerializationException;
import io.factom.rpc.internal.RpcUtils;
import java.io.IOException;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Encodes JSON-RPC requests and decodes responses in two phases.
 *
 * <ol>
 * <li>{@link #decode} checks the envelope and keeps the result as a raw tree</li>
 * <li>{@link #toApiResponse} turns that tree into the method's result type, or
 * exposes the daemon error as a {@link ApiResponse.Failure}</li>
 * </ol>
 *
 * <p>The codec knows nothing about individual methods. It is stateless and
 * thread-safe.
 */
public final class JsonRpcCodec {

    private static final ObjectReader ENVELOPE_READER =
            MAPPER.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    /**
     * Serializes a request for the given method.
     *
     * @param method the remote method name, non-empty
     * @param params named parameters; no key is added for absent optionals
     * @return the UTF-8 encoded request body
     * @throws IllegalArgumentException if {@code method} is empty
     * @throws SerializationException if a parameter cannot be written as JSON
     */
    public byte[] encode(final String method, final Map<String, ?> params) {
        final JsonRpcRequest request = JsonRpcRequest.of(method, params);
        try {
            return MAPPER.writeValueAsBytes(request);
        } catch (JsonProcessingException e) {
            throw new SerializationException(
                    method, "Unable to serialize JSON-RPC request for " + method, e);
        }
    }

    /**
     * Parses a response body into the generic envelope.
     *
     * <p>A daemon error is a valid envelope and does not throw.
     *
     * @param method the method the body answers, used in error messages
     * @param body the raw response body
     * @return the envelope with an undecoded result
     * @throws DeserializationException if the body is not JSON, not an object,
     *         carries trailing content, lacks {@code jsonrpc}, lacks an
     *         integer {@code id}, or has neither
     *         {@code result} nor {@code error}
     */
    public JsonRpcResponse decode(final String method, final byte[] body) {
        final JsonNode root;
        try {
            root = ENVELOPE_READER.readTree(body);
        } catch (IOException e) {
            throw new DeserializationException(
                    "Unable to parse JSON-RPC response for method " + method, RpcUtils.utf8(body), e);
        }
        if (root == null || !root.isObject()) {
            throw malformed(method, "response is not a JSON object", body);
        }

        final JsonNode version = root.get("jsonrpc");
        if (version == null || !version.isTextual()) {
            throw malformed(method, "missing jsonrpc", body);
        }
        final long id = decodeId(method, root.get("id"), body);

        final boolean hasResult = root.has("result");
        final JsonNode errorNode = root.get("error");
        final boolean hasError = errorNode != null && !errorNode.isNull();
        if (!hasResult && !hasError) {
            throw malformed(method, "neither result nor error present", body);
        }

        JsonRpcError error = null;
        if (hasError) {
            if (!errorNode.isObject()) {
                throw malformed(method, "error is not an object", body);
            }
            try {
                error = MAPPER.treeToValue(errorNode, JsonRpcError.class);
            } catch (JsonProcessingException e) {
                throw new DeserializationException(
                        "Malformed error object in response for method " + method, RpcUtils.utf8(body), e);
            }
        }

        final JsonNode result = root.get("result");
        return new JsonRpcResponse(
                version.asText(),
                id,
                result == null || result.isNull() ? null : result,
                error);
    }

    /**
     * Second decode phase: converts the envelope into a typed response.
     *
     * @param method the method the response answers
     * @param response the generic envelope
     * @param resultType the method-specific result type
     * @param <T> the result type
     * @return a {@link ApiResponse.Failure} for a nonzero error code, otherwise a
     *         {@link ApiResponse.Success} holding the converted result
     * @throws DeserializationException if the result does not fit {@code resultType}
     */
    public <T> ApiResponse<T> toApiResponse(
            final String method, final JsonRpcResponse response, final JavaType resultType) {
        if (response.hasError()) {
            return ApiResponse.ofError(response.jsonrpc(), response.id(), response.error());
        }
        return ApiResponse.ofResult(response.jsonrpc(), response.id(), convert(method, response.result(), resultType));
    }

    private <T> @Nullable T convert(final String method, final @Nullable JsonNode result, final JavaType resultType) {
        if (result == null) {
            return null;
        }
        try {
            return MAPPER.readerFor(resultType).readValue(result);
        } catch (IOException | IllegalArgumentException e) {
            throw new DeserializationException(
                    "Unable to map result of " + method + " to " + resultType.toCanonical(),
                    result.toString(),
                    e);
        }
    }

    private long decodeId(final String method, final @Nullable JsonNode id, final byte[] body) {
        if (id == null || id.isNull()) {
            throw malformed(method, "missing id", body);
        }
        if (id.isIntegralNumber() && id.canConvertToLong()) {
            return id.asLong();
        }
        throw malformed(method, "id is not an integer", body);
    }

    private static DeserializationException malformed(final String method, final String reason, final byte[] body) {
        return new DeserializationException(
                "Malformed JSON-RPC response for method " + method + ": " + reason, RpcUtils.utf8(body));
    }
}
