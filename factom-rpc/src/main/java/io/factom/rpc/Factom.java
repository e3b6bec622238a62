// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import com.fasterxml.jackson.core.type.TypeReference;
import io.factom.rpc.internal.RpcInvoker;
import io.factom.rpc.internal.RpcUtils;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Entry point for talking to a Factom node (factomd) and wallet
 * (factom-walletd).
 *
 * <p>A {@code Factom} handle is immutable. It holds the two daemon URLs and
 * one transport, and hands out typed clients that share them. Build it once
 * and share it across threads.
 *
 * <h2>Creating a handle</h2>
 *
 * <pre>{@code
 * // http://localhost:8089/v2 and http://localhost:8088/v2
 * Factom factom = Factom.create();
 *
 * // Remote node over TLS on the default ports
 * Factom remote = Factom.fromHttpsHost("node.example.com");
 *
 * // Explicit URLs and transport
 * Factom custom = Factom.builder()
 *     .factomdUrl("https://api.factomd.net/v2")
 *     .walletdUrl("http://localhost:8088/v2")
 *     .provider(HttpFactomProvider.builder()
 *         .requestTimeout(Duration.ofSeconds(10))
 *         .build())
 *     .build();
 * }</pre>
 *
 * <h2>Writing an entry</h2>
 *
 * <pre>{@code
 * ComposedEntry composed = factom.walletd()
 *     .composeEntry(chainId, List.of("cafe"), "babe", ecAddress)
 *     .orElseThrow();
 *
 * ApiResponse<CommitEntry> commit = factom.factomd().commitEntry(composed.commit().param("message"));
 * if (commit.isError() && !commit.error().toException().isRepeatedCommit()) {
 *     throw commit.error().toException();
 * }
 * factom.factomd().revealEntry(composed.reveal().param("entry")).orElseThrow();
 * }</pre>
 */
public final class Factom implements AutoCloseable {

    private final FactomConfig config;
    private final FactomProvider provider;
    private final RpcInvoker invoker;
    private final FactomdClient factomd;
    private final WalletdClient walletd;
    private final FactomAsyncClient async;

    private Factom(final FactomConfig config, final FactomProvider provider) {
        this.config = config;
        this.provider = provider;
        this.invoker = new RpcInvoker(config, provider, new JsonRpcCodec());
        this.factomd = new DefaultFactomdClient(invoker);
        this.walletd = new DefaultWalletdClient(invoker);
        this.async = new FactomAsyncClient(invoker);
    }

    /**
     * Connects to both daemons on localhost over HTTP.
     */
    public static Factom create() {
        return builder().build();
    }

    /**
     * Connects to both daemons on {@code host} over HTTP, at
     * {@code http://host:8089/v2} and {@code http://host:8088/v2}.
     */
    public static Factom fromHost(final String host) {
        return builder().host(host).build();
    }

    /**
     * Connects to both daemons on {@code host} over HTTPS.
     */
    public static Factom fromHttpsHost(final String host) {
        return builder().host(host).https(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public FactomdClient factomd() {
        return factomd;
    }

    public WalletdClient walletd() {
        return walletd;
    }

    public FactomAsyncClient async() {
        return async;
    }

    public FactomConfig config() {
        return config;
    }

    /**
     * Calls a method that has no typed wrapper.
     *
     * @param daemon the daemon that serves the method
     * @param method the remote method name
     * @param params the named parameters
     * @param type the result type on success
     * @param <T> the result type
     * @return the typed outcome
     */
    public <T> ApiResponse<T> call(
            final Daemon daemon, final String method, final RpcParams params, final Class<T> type) {
        return invoker.call(daemon, method, params, RpcUtils.type(type));
    }

    public <T> ApiResponse<T> call(
            final Daemon daemon, final String method, final RpcParams params, final TypeReference<T> type) {
        return invoker.call(daemon, method, params, RpcUtils.type(type));
    }

    /**
     * Closes the underlying provider.
     */
    @Override
    public void close() {
        provider.close();
    }

    /**
     * Builder for {@link Factom}.
     *
     * <p>URL resolution priority: an explicit {@link #config(FactomConfig)},
     * then {@link #factomdUrl}/{@link #walletdUrl} overriding the URLs derived
     * from {@link #host} and {@link #https}.
     */
    public static final class Builder {

        private @Nullable FactomConfig config;
        private String host = "localhost";
        private boolean https;
        private @Nullable String factomdUrl;
        private @Nullable String walletdUrl;
        private @Nullable FactomProvider provider;

        private Builder() {
        }

        /**
         * Uses a complete configuration. Takes precedence over every other
         * URL setting.
         */
        public Builder config(final FactomConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder host(final String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        public Builder https(final boolean https) {
            this.https = https;
            return this;
        }

        /**
         * Overrides the node daemon URL derived from the host.
         */
        public Builder factomdUrl(final String factomdUrl) {
            this.factomdUrl = Objects.requireNonNull(factomdUrl, "factomdUrl");
            return this;
        }

        /**
         * Overrides the wallet daemon URL derived from the host.
         */
        public Builder walletdUrl(final String walletdUrl) {
            this.walletdUrl = Objects.requireNonNull(walletdUrl, "walletdUrl");
            return this;
        }

        /**
         * Sets the transport. Defaults to {@link HttpFactomProvider} without
         * timeouts.
         */
        public Builder provider(final FactomProvider provider) {
            this.provider = Objects.requireNonNull(provider, "provider");
            return this;
        }

        public Factom build() {
            final FactomProvider resolvedProvider = provider != null ? provider : FactomProvider.http();
            return new Factom(resolveConfig(), resolvedProvider);
        }

        private FactomConfig resolveConfig() {
            if (config != null) {
                return config;
            }
            final FactomConfig derived = FactomConfig.forScheme(https ? "https" : "http", host);
            return FactomConfig.of(
                    factomdUrl != null ? factomdUrl : derived.factomdUrl(),
                    walletdUrl != null ? walletdUrl : derived.walletdUrl());
        }
    }
}
