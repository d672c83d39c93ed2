// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger writing to the {@code io.tbex.debug} SLF4J logger.
 *
 * <p>Every line passes through {@link LogSanitizer} before it is emitted.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("io.tbex.debug");

    private DebugLogger() {
    }

    public static void logRpc(final String message, final Object... args) {
        if (!TbexDebug.isRpcLoggingEnabled()) {
            return;
        }
        emit(message, args);
    }

    public static void logRetry(final String message, final Object... args) {
        if (!TbexDebug.isRetryLoggingEnabled()) {
            return;
        }
        emit(message, args);
    }

    /**
     * Formats an RPC success line.
     *
     * @param method         the JSON-RPC method
     * @param durationMicros round trip time
     * @return the line
     */
    public static String formatRpc(final String method, final long durationMicros) {
        return "[RPC] " + method + " " + formatDuration(durationMicros);
    }

    /**
     * Formats an RPC failure line.
     */
    public static String formatRpcError(final String method, final int code, final String message, final long durationMicros) {
        return "[RPC-ERROR] " + method + " code=" + code + " message=" + message + " " + formatDuration(durationMicros);
    }

    private static String formatDuration(final long micros) {
        if (micros < 1_000L) {
            return micros + "us";
        }
        return (micros / 1_000L) + "ms";
    }

    private static void emit(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
