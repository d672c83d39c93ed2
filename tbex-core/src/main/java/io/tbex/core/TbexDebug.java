// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core;

/**
 * Global toggle for verbose debug logging of RPC traffic and retry decisions.
 *
 * <p>The flags are volatile; {@link #isEnabled()} reads them non-atomically, which is
 * fine for best-effort logging.
 */
public final class TbexDebug {

    private static volatile boolean rpcLogging = false;
    private static volatile boolean retryLogging = false;

    private TbexDebug() {
    }

    /**
     * @return true if either RPC or retry logging is enabled
     */
    public static boolean isEnabled() {
        return rpcLogging || retryLogging;
    }

    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
        retryLogging = enabled;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setRetryLogging(final boolean enabled) {
        retryLogging = enabled;
    }

    public static boolean isRetryLoggingEnabled() {
        return retryLogging;
    }
}
