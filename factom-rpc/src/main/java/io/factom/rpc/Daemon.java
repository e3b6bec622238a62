// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.rpc;

/**
 * The two Factom services a call can be routed to.
 *
 * <p>factomd answers chain-state queries and accepts commits, reveals and
 * signed transactions. factom-walletd holds keys and builds and signs
 * transactions. Each RPC method lives on exactly one of them.
 */
public enum Daemon {

    /** The node daemon, factomd. */
    FACTOMD("factomd", 8089),

    /** The wallet daemon, factom-walletd. */
    WALLETD("walletd", 8088);

    private final String displayName;
    private final int defaultPort;

    Daemon(final String displayName, final int defaultPort) {
        this.displayName = displayName;
        this.defaultPort = defaultPort;
    }

    public String displayName() {
        return displayName;
    }

    public int defaultPort() {
        return defaultPort;
    }
}
