// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.model;

/**
 * Transaction envelope type.
 *
 * <p>
 * Classification from the raw type byte is total: 0 to 3 map to the known envelopes
 * and every other value becomes {@link Kind#UNKNOWN} carrying the raw byte.
 *
 * @param kind    the classified envelope
 * @param rawType the type byte as reported by the node
 */
public record TxType(Kind kind, int rawType) {

    public enum Kind {
        LEGACY,
        ACCESS_LIST,
        EIP1559,
        BLOB,
        UNKNOWN
    }

    public static final TxType LEGACY = new TxType(Kind.LEGACY, 0);
    public static final TxType ACCESS_LIST = new TxType(Kind.ACCESS_LIST, 1);
    public static final TxType EIP1559 = new TxType(Kind.EIP1559, 2);
    public static final TxType BLOB = new TxType(Kind.BLOB, 3);

    public TxType {
        java.util.Objects.requireNonNull(kind, "kind");
    }

    public static TxType fromTypeByte(final int type) {
        switch (type) {
            case 0:
                return LEGACY;
            case 1:
                return ACCESS_LIST;
            case 2:
                return EIP1559;
            case 3:
                return BLOB;
            default:
                return new TxType(Kind.UNKNOWN, type);
        }
    }

    /** Display label, e.g. {@code "EIP-1559 (Type 2)"}. */
    public String label() {
        switch (kind) {
            case LEGACY:
                return "Legacy (Type 0)";
            case ACCESS_LIST:
                return "Access List (Type 1)";
            case EIP1559:
                return "EIP-1559 (Type 2)";
            case BLOB:
                return "Blob (Type 3)";
            default:
                return "Unknown";
        }
    }
}
