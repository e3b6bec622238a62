// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core.error;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Exception form of an error returned by factomd or factom-walletd.
 *
 * <p>
 * The typed clients never throw this on their own: a daemon error is a
 * completed call and is returned as data. It is raised when a caller opts into
 * exception-style handling through {@code ApiResponse.orElseThrow()}.
 *
 * <p>
 * <strong>Common Factom Error Codes:</strong>
 * <ul>
 * <li><strong>-32700</strong>: Parse error</li>
 * <li><strong>-32600</strong>: Invalid request</li>
 * <li><strong>-32601</strong>: Method not found</li>
 * <li><strong>-32602</strong>: Invalid params</li>
 * <li><strong>-32008</strong>: Object not found (missing entry, block or receipt)</li>
 * <li><strong>-32009</strong>: Missing chain head</li>
 * <li><strong>-32011</strong>: Repeated commit</li>
 * </ul>
 *
 * @see <a href="https://www.jsonrpc.org/specification#error_object">JSON-RPC
 *      Error Specification</a>
 */
public final class RpcException extends FactomException {

    public static final int REPEATED_COMMIT = -32011;
    public static final int OBJECT_NOT_FOUND = -32008;

    private final int code;
    private final @Nullable String data;

    public RpcException(final int code, final String message, final @Nullable String data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public int code() {
        return code;
    }

    public @Nullable String data() {
        return data;
    }

    /**
     * Checks whether the daemon rejected an entry or chain commit it has
     * already seen. The caller can go straight to the reveal in that case.
     *
     * @return true for a repeated commit
     */
    public boolean isRepeatedCommit() {
        final String msg = getMessage();
        return code == REPEATED_COMMIT
                || (msg != null && msg.toLowerCase(Locale.ROOT).contains("repeated commit"));
    }

    public boolean isNotFound() {
        return code == OBJECT_NOT_FOUND;
    }

    @Override
    public String toString() {
        return "RpcException{"
                + "code="
                + code
                + ", message="
                + getMessage()
                + ", data="
                + data
                + "}";
    }
}
