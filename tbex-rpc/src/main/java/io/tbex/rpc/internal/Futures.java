// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc.internal;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * <strong>Internal Use Only.</strong>
 */
public final class Futures {

    private Futures() {
    }

    /** Strips the {@link CompletionException} / {@link ExecutionException} wrappers. */
    public static Throwable unwrap(final Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
