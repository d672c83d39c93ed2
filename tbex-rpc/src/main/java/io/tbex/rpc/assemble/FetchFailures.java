// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc.assemble;

import io.tbex.core.error.FetchException;
import io.tbex.core.error.NotFoundException;
import io.tbex.rpc.internal.Futures;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.jspecify.annotations.Nullable;

/**
 * Shared failure shaping for the assemblers.
 */
final class FetchFailures {

    private FetchFailures() {
    }

    /** Fails with a {@link NotFoundException} when the node answered {@code null}. */
    static <T> T requireFound(final @Nullable T value, final String kind, final String identifier) {
        if (value == null) {
            throw new NotFoundException(kind, identifier);
        }
        return value;
    }

    /** Wraps any failure of {@code future} in a {@link FetchException} naming the target. */
    static <T> CompletableFuture<T> wrap(final CompletableFuture<T> future, final String operation, final String target) {
        return future.handle((value, error) -> {
            if (error != null) {
                throw new CompletionException(new FetchException(operation, target, Futures.unwrap(error)));
            }
            return value;
        });
    }
}
