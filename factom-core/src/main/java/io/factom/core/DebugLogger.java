// SPDX-License-Identifier: MIT OR Apache-2.0
package io.factom.core;

import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes RPC debug lines to the SLF4J logger {@code io.factom.debug}.
 *
 * <p>Nothing is formatted unless the matching {@link FactomDebug} switch is on
 * and the logger accepts INFO. Every line passes through {@link LogSanitizer}
 * first, so wallet secrets never reach an appender.
 */
public final class DebugLogger {

    public static final String LOGGER_NAME = "io.factom.debug";

    private static final Logger LOG = LoggerFactory.getLogger(LOGGER_NAME);

    private DebugLogger() {
    }

    /**
     * Logs a call outcome line built by {@link LogFormatter}.
     *
     * @param line the formatted line
     */
    public static void logRpc(final String line) {
        if (FactomDebug.isRpcLoggingEnabled() && LOG.isInfoEnabled()) {
            LOG.info(LogSanitizer.sanitize(line));
        }
    }

    /**
     * Logs one request or response body.
     *
     * @param method the remote method
     * @param direction {@code request} or {@code response}
     * @param body the raw UTF-8 body
     */
    public static void logPayload(final String method, final String direction, final byte[] body) {
        if (FactomDebug.isPayloadLoggingEnabled() && LOG.isInfoEnabled()) {
            final String text = new String(body, StandardCharsets.UTF_8);
            LOG.info(LogSanitizer.sanitize(LogFormatter.formatPayload(method, direction, text)));
        }
    }
}
