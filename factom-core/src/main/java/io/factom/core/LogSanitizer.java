// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core;

import java.util.regex.Pattern;

/**
 * Utility that removes wallet secrets from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts {@code "secret"}, {@code "passphrase"} and {@code "wallet-seed"} JSON values and bare
 * private key strings ({@code Fs...}, {@code Es...}, {@code idsec...})</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final String REDACTED = "***[REDACTED]***";

    /** Matches "secret", "passphrase" and "wallet-seed" JSON string members. */
    private static final Pattern SECRET_FIELD_PATTERN =
            Pattern.compile("\"(secret|passphrase|wallet-seed)\"\\s*:\\s*\"[^\"]*\"");

    /** Human readable Factoid, Entry Credit and identity private keys. */
    private static final Pattern PRIVATE_KEY_PATTERN =
            Pattern.compile("\\b(Fs|Es)[1-9A-HJ-NP-Za-km-z]{50}\\b|\\bidsec[1-9A-HJ-NP-Za-km-z]{40,}\\b");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"secret\"")
                || sanitized.contains("\"passphrase\"")
                || sanitized.contains("\"wallet-seed\"")) {
            sanitized = SECRET_FIELD_PATTERN.matcher(sanitized).replaceAll("\"$1\":\"" + REDACTED + "\"");
        }

        sanitized = PRIVATE_KEY_PATTERN.matcher(sanitized).replaceAll(REDACTED);

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
