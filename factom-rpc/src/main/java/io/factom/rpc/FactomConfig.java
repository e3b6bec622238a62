// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

import java.util.Objects;

/**
 * Immutable pair of base URLs, one per daemon.
 *
 * <p>URLs are stored as given and only parsed when a request is sent, so a
 * malformed URL surfaces as a {@link io.factom.core.error.TransportException}
 * on the first call.
 *
 * @param factomdUrl the node daemon endpoint, e.g. {@code http://localhost:8089/v2}
 * @param walletdUrl the wallet daemon endpoint, e.g. {@code http://localhost:8088/v2}
 */
public record FactomConfig(String factomdUrl, String walletdUrl) {

    /** Version segment of the daemon URL path. */
    public static final int API_VERSION = 2;

    public FactomConfig {
        Objects.requireNonNull(factomdUrl, "factomdUrl");
        Objects.requireNonNull(walletdUrl, "walletdUrl");
    }

    /**
     * @return {@code http://localhost:8089/v2} and {@code http://localhost:8088/v2}
     */
    public static FactomConfig defaults() {
        return fromHost("localhost");
    }

    public static FactomConfig fromHost(final String host) {
        return forScheme("http", host);
    }

    public static FactomConfig fromHttpsHost(final String host) {
        return forScheme("https", host);
    }

    public static FactomConfig of(final String factomdUrl, final String walletdUrl) {
        return new FactomConfig(factomdUrl, walletdUrl);
    }

    static FactomConfig forScheme(final String scheme, final String host) {
        Objects.requireNonNull(host, "host");
        return new FactomConfig(url(scheme, host, Daemon.FACTOMD), url(scheme, host, Daemon.WALLETD));
    }

    /**
     * Returns the endpoint a call for the given daemon is posted to.
     *
     * @param daemon the target daemon
     * @return the base URL
     */
    public String endpoint(final Daemon daemon) {
        return daemon == Daemon.FACTOMD ? factomdUrl : walletdUrl;
    }

    private static String url(final String scheme, final String host, final Daemon daemon) {
        return scheme + "://" + host + ":" + daemon.defaultPort() + "/v" + API_VERSION;
    }
}
