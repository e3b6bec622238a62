// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core;

/**
 * Switches for debug logging of Factom RPC traffic.
 *
 * <p>Two independent switches exist:
 * <ul>
 * <li><b>RPC logging</b> - one line per call with daemon, method, outcome and duration</li>
 * <li><b>Payload logging</b> - the sanitized request and response bodies of each call</li>
 * </ul>
 *
 * <p>Both start from system properties, so logging can be turned on without a
 * code change: {@code -Dfactom.debug=true} enables both,
 * {@code -Dfactom.debug.rpc=true} and {@code -Dfactom.debug.payload=true}
 * enable one each. The setters override the properties at runtime.
 */
public final class FactomDebug {

    public static final String PROPERTY = "factom.debug";
    public static final String RPC_PROPERTY = "factom.debug.rpc";
    public static final String PAYLOAD_PROPERTY = "factom.debug.payload";

    private static volatile boolean rpcLogging =
            Boolean.getBoolean(PROPERTY) || Boolean.getBoolean(RPC_PROPERTY);
    private static volatile boolean payloadLogging =
            Boolean.getBoolean(PROPERTY) || Boolean.getBoolean(PAYLOAD_PROPERTY);

    private FactomDebug() {
    }

    /**
     * Turns both RPC and payload logging on or off.
     */
    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
        payloadLogging = enabled;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    /**
     * Payload lines contain request parameters and results. Secrets are
     * redacted, but addresses and balances are not.
     */
    public static void setPayloadLogging(final boolean enabled) {
        payloadLogging = enabled;
    }

    public static boolean isPayloadLoggingEnabled() {
        return payloadLogging;
    }
}
