// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.factom.core.InternalApi;
import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Internal helpers shared by the codec, the invoker and the typed clients.
 *
 * <ul>
 * <li>Shared {@link ObjectMapper} instance</li>
 * <li>{@link JavaType} construction for result shapes</li>
 * <li>JSON-RPC error data extraction</li>
 * </ul>
 */
@InternalApi
public final class RpcUtils {

    /**
     * Shared, thread-safe ObjectMapper. It is never reconfigured after class
     * initialization.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private RpcUtils() {
        // Utility class - prevent instantiation
    }

    public static JavaType type(final Class<?> type) {
        return MAPPER.getTypeFactory().constructType(type);
    }

    public static JavaType type(final TypeReference<?> type) {
        return MAPPER.getTypeFactory().constructType(type);
    }

    public static String utf8(final byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Flattens the optional {@code data} member of a JSON-RPC error into a
     * string.
     *
     * <p>Strings are returned as is. Maps, arrays and iterables are searched
     * for the first nested non-null value; anything else falls back to
     * {@code toString()}.
     *
     * @param dataValue the error data from the response
     * @return the extracted string, or null if dataValue is null
     */
    public static @Nullable String extractErrorData(final @Nullable Object dataValue) {
        if (dataValue == null) {
            return null;
        }
        if (dataValue instanceof String s) {
            return s;
        }
        if (dataValue instanceof Map<?, ?> map) {
            return extractFromIterable(map.values(), dataValue);
        }
        if (dataValue instanceof Iterable<?> iterable) {
            return extractFromIterable(iterable, dataValue);
        }
        if (dataValue.getClass().isArray()) {
            return extractFromArray(dataValue, dataValue);
        }
        return dataValue.toString();
    }

    private static String extractFromIterable(final Iterable<?> iterable, final Object fallback) {
        for (final Object item : iterable) {
            final String extracted = extractErrorData(item);
            if (extracted != null) {
                return extracted;
            }
        }
        return fallback.toString();
    }

    private static String extractFromArray(final Object array, final Object fallback) {
        final int length = Array.getLength(array);
        for (int i = 0; i < length; i++) {
            final String extracted = extractErrorData(Array.get(array, i));
            if (extracted != null) {
                return extracted;
            }
        }
        return fallback.toString();
    }
}
