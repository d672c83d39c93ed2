// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc;

import io.tbex.core.LogSanitizer;
import io.tbex.core.error.RpcException;
import io.tbex.rpc.exception.RetryFailedException;
import io.tbex.rpc.internal.Futures;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders failures as single human-readable messages.
 *
 * <pre>{@code
 * explorer.block(19_000_000).exceptionally(e -> {
 *     statusBar.show(FailureReport.describe(e, explorer.endpoint()));
 *     return null;
 * });
 * }</pre>
 */
public final class FailureReport {

    private FailureReport() {
    }

    /**
     * Joins the messages of {@code error} and its causes with {@code ": "}.
     *
     * <p>A {@link RetryFailedException} already embeds its last failure, so the walk
     * stops there.
     */
    public static String chain(final Throwable error) {
        return render(error, false);
    }

    /**
     * Same walk as {@link #chain(Throwable)}, but {@link RpcException}s contribute their
     * raw message. Request ids are numbers and must not be mistaken for HTTP status
     * codes when classifying a failure.
     */
    public static String bareChain(final Throwable error) {
        return render(error, true);
    }

    private static String render(final Throwable error, final boolean bare) {
        final List<String> parts = new ArrayList<>();
        Throwable current = Futures.unwrap(error);
        while (current != null) {
            final String message = messageOf(current, bare);
            if (parts.isEmpty() || !parts.get(parts.size() - 1).equals(message)) {
                parts.add(message);
            }
            if (current instanceof RetryFailedException || current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return String.join(": ", parts);
    }

    /**
     * The full chain followed by {@code "\n\nRPC: <endpoint>"}, with credentials removed
     * from both.
     */
    public static String describe(final Throwable error, final String endpoint) {
        return LogSanitizer.sanitize(chain(error)) + "\n\nRPC: " + LogSanitizer.sanitize(endpoint);
    }

    private static String messageOf(final Throwable error, final boolean bare) {
        if (bare && error instanceof RpcException rpc) {
            return rpc.rawMessage() == null || rpc.rawMessage().isBlank()
                    ? error.getClass().getSimpleName()
                    : rpc.rawMessage();
        }
        final String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        // Throwable(cause) copies cause.toString() into the message
        if (error.getCause() != null && message.equals(error.getCause().toString())) {
            return messageOf(error.getCause(), bare);
        }
        return message;
    }
}
