// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Builder for the named {@code params} object of a request.
 *
 * <p>Factom daemons treat an absent parameter differently from one that is
 * present but empty, so optional arguments must go through
 * {@link #putIfPresent}, which adds nothing for {@code null}. Names are unique
 * and keep insertion order.
 *
 * <pre>{@code
 * RpcParams params = RpcParams.of("hash", hash)
 *         .put("chainid", "f")
 *         .putIfPresent("fulltransaction", fullTransaction);
 * }</pre>
 */
public final class RpcParams {

    private final Map<String, Object> values = new LinkedHashMap<>();

    private RpcParams() {
    }

    public static RpcParams empty() {
        return new RpcParams();
    }

    public static RpcParams of(final String name, final Object value) {
        return new RpcParams().put(name, value);
    }

    /**
     * Adds a required parameter.
     *
     * @param name the parameter name
     * @param value the value, which must not be null
     * @return this builder
     * @throws NullPointerException if {@code value} is null
     * @throws IllegalArgumentException if {@code name} was already added
     */
    public RpcParams put(final String name, final Object value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, name);
        if (values.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate parameter: " + name);
        }
        values.put(name, value);
        return this;
    }

    /**
     * Adds an optional parameter, or nothing if {@code value} is null.
     *
     * @param name the parameter name
     * @param value the value, or null to omit the parameter
     * @return this builder
     */
    public RpcParams putIfPresent(final String name, final @Nullable Object value) {
        return value == null ? this : put(name, value);
    }

    public boolean contains(final String name) {
        return values.containsKey(name);
    }

    /**
     * @return an unmodifiable snapshot of the parameters
     */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public String toString() {
        return "RpcParams" + values.keySet();
    }
}
