// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.model;

import java.util.Objects;

/**
 * One decoded event argument.
 *
 * @param name      argument name, e.g. {@code "from"} or {@code "topic2"}
 * @param value     display value
 * @param isAddress {@code true} when the value is an address a viewer may navigate to
 */
public record DecodedParam(String name, String value, boolean isAddress) {

    public DecodedParam {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    public static DecodedParam address(final String name, final io.tbex.core.types.Address address) {
        return new DecodedParam(name, address.value(), true);
    }

    public static DecodedParam value(final String name, final String value) {
        return new DecodedParam(name, value, false);
    }
}
