// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Forward ENS resolution (name to address) failed at a specific step.
 */
public final class NameResolutionException extends TbexException {

    /** The step of the registry/resolver protocol that failed. */
    public enum Step {
        /** {@code resolver(bytes32)} on the registry. */
        REGISTRY_LOOKUP,
        /** {@code addr(bytes32)} on the resolver. */
        RESOLVER_LOOKUP
    }

    private final String name;
    private final Step step;

    public NameResolutionException(final String message, final String name, final Step step, final @Nullable Throwable cause) {
        super(message, cause);
        this.name = name;
        this.step = step;
    }

    public String name() {
        return name;
    }

    public Step step() {
        return step;
    }
}
