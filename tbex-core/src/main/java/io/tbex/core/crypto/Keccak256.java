// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.jcajce.provider.digest.Keccak;

/**
 * Keccak-256 hashing for event signatures, function selectors, namehash and storage
 * slot derivation.
 *
 * <p>
 * Ethereum uses Keccak-256 (not SHA3-256). Digest instances are cached per thread;
 * call {@link #cleanup()} from pooled threads that are being recycled across class
 * loaders.
 */
public final class Keccak256 {

    private static final ThreadLocal<Keccak.Digest256> DIGEST = ThreadLocal.withInitial(Keccak.Digest256::new);

    private Keccak256() {
        // Utility class
    }

    /**
     * Computes the Keccak-256 hash of the input bytes.
     *
     * @param input the data to hash
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");
        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Computes the Keccak-256 hash of several arrays concatenated, without building the
     * concatenation.
     *
     * @param inputs the data arrays to hash
     * @return 32-byte hash
     * @throws NullPointerException if inputs or any element is null
     */
    public static byte[] hash(final byte[]... inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        for (byte[] input : inputs) {
            Objects.requireNonNull(input, "input element cannot be null");
            digest.update(input);
        }
        return digest.digest();
    }

    /**
     * Hashes the UTF-8 bytes of a string, e.g. an event or function signature.
     *
     * @param text the text to hash
     * @return 32-byte hash
     */
    public static byte[] hashUtf8(final String text) {
        Objects.requireNonNull(text, "text cannot be null");
        return hash(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns the 4-byte function selector of a canonical signature such as
     * {@code "balanceOf(address)"}.
     *
     * @param signature the canonical function signature
     * @return the first four bytes of its hash
     */
    public static byte[] selector(final String signature) {
        return Arrays.copyOf(hashUtf8(signature), 4);
    }

    public static void cleanup() {
        DIGEST.remove();
    }
}
