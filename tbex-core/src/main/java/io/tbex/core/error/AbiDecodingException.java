// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.error;

/**
 * Thrown when a contract's return data does not have the expected length or layout.
 */
public final class AbiDecodingException extends TbexException {

    public AbiDecodingException(final String message) {
        super(message);
    }

    public AbiDecodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
