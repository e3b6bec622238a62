// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core;

import static io.factom.core.AnsiColors.*;

import java.util.Locale;

/**
 * Formats debug log lines for Factom RPC calls.
 *
 * <p>
 * All lines use a bracketed operation tag and a status symbol (✓ ✗) so that
 * a call and its outcome can be followed with a quick scan:
 *
 * <pre>{@code
 * [RPC] daemon=factomd method=heights duration=1.06ms
 * [HTTP] endpoint=http://localhost:8089/v2 status=502
 * ✗ [RPC-ERROR] daemon=factomd method=commit-entry code=-32011 message=Repeated Commit duration=3.10ms
 * ✗ [TRANSPORT-ERROR] daemon=walletd method=get-height endpoint=http://localhost:8088/v2 reason=Connection refused
 * [PAYLOAD] method=entry direction=request body={"jsonrpc":"2.0",...}
 * }</pre>
 *
 * <p>
 * All methods are pure functions. The returned strings are passed to
 * {@link DebugLogger}, which sanitizes them.
 *
 * @see AnsiColors
 * @see DebugLogger
 */
public final class LogFormatter {

    private LogFormatter() {
    }

    /**
     * Format: [RPC] daemon=factomd method=heights duration=1.06ms
     */
    public static String formatRpc(String daemon, String method, long durationMicros) {
        return String.format(
                "%s[RPC]%s daemon=%s method=%s%s%s %s",
                TEAL, RESET,
                daemon,
                INDIGO, method, RESET,
                duration(durationMicros));
    }

    /**
     * Format: [HTTP] endpoint=http://localhost:8089/v2 status=502
     */
    public static String formatHttpStatus(String endpoint, int status) {
        return String.format(
                "%s[HTTP]%s endpoint=%s status=%s%d%s",
                AMBER, RESET,
                endpoint,
                CORAL, status, RESET);
    }

    /**
     * Format: ✗ [RPC-ERROR] daemon=factomd method=commit-entry code=-32011 message=error
     * duration=1.5ms
     */
    public static String formatRpcError(String daemon, String method, int code, String message, long durationMicros) {
        return String.format(
                "%s✗%s %s[RPC-ERROR]%s daemon=%s method=%s code=%d message=%s %s",
                CORAL, RESET,
                CORAL, RESET,
                daemon,
                method,
                code,
                CORAL + message + RESET,
                duration(durationMicros));
    }

    /**
     * Format: ✗ [TRANSPORT-ERROR] daemon=walletd method=get-height endpoint=... reason=...
     */
    public static String formatTransportError(String daemon, String method, String endpoint, String reason) {
        return String.format(
                "%s✗%s %s[TRANSPORT-ERROR]%s daemon=%s method=%s endpoint=%s reason=%s",
                CORAL, RESET,
                CORAL, RESET,
                daemon,
                method,
                endpoint,
                CORAL + reason + RESET);
    }

    /**
     * Format: [PAYLOAD] method=entry direction=request body={...}
     */
    public static String formatPayload(String method, String direction, String body) {
        return String.format(
                "%s[PAYLOAD]%s method=%s direction=%s body=%s",
                AMBER, RESET,
                method,
                direction,
                body);
    }

    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format(Locale.ROOT, "%.2fms", ms);
        } else {
            formatted = String.format(Locale.ROOT, "%.2fs", ms / 1000.0);
        }
        return SLATE + "duration=" + formatted + RESET;
    }
}
