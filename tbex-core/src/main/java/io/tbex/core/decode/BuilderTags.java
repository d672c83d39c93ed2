// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.decode;

import io.tbex.core.types.Address;
import io.tbex.core.types.HexData;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Identifies the block builder from a block's extra data or fee recipient.
 */
public final class BuilderTags {

    private record Marker(List<String> substrings, String tag) {
    }

    /** Checked in order; the first match wins. */
    private static final List<Marker> EXTRA_DATA_MARKERS = List.of(
            new Marker(List.of("flashbots"), "Flashbots"),
            new Marker(List.of("bloxroute", "blxr"), "bloXroute"),
            new Marker(List.of("builder0x69"), "builder0x69"),
            new Marker(List.of("titan"), "Titan"),
            new Marker(List.of("rsync"), "rsync"),
            new Marker(List.of("beaver"), "Beaver"),
            new Marker(List.of("buildai"), "BuildAI"),
            new Marker(List.of("penguinbuild"), "Penguin"),
            new Marker(List.of("ethbuilder"), "EthBuilder"),
            new Marker(List.of("blocknative"), "Blocknative"));

    private static final Map<Address, String> KNOWN_BUILDERS = Map.of(
            new Address("0x95222290dd7278aa3ddd389cc1e1d165cc4bafe5"), "Flashbots",
            new Address("0x690b9a9e9aa1c9db991c7721a92d351db4fac990"), "builder0x69",
            new Address("0x1f9090aae28b8a3dceadf281b0f12828e676c326"), "rsync",
            new Address("0xdafea492d9c6733ae3d56b7ed1adb60692c98bc5"), "Beacon Depositor");

    /** Plain extra data shorter than this many bytes may itself be the builder name. */
    private static final int MAX_PLAIN_TAG_BYTES = 32;

    private BuilderTags() {
    }

    /**
     * @param extraData block extra data
     * @param miner     block fee recipient
     * @return the builder tag, or {@code null} if neither source identifies one
     */
    public static @Nullable String detect(final HexData extraData, final Address miner) {
        final String text = strictUtf8(extraData.toBytes());
        if (text != null) {
            final String lower = text.toLowerCase(Locale.ROOT);
            for (Marker marker : EXTRA_DATA_MARKERS) {
                for (String substring : marker.substrings()) {
                    if (lower.contains(substring)) {
                        return marker.tag();
                    }
                }
            }
            if (!text.isEmpty() && extraData.byteLength() < MAX_PLAIN_TAG_BYTES && isPlainName(text)) {
                return text;
            }
        }
        return KNOWN_BUILDERS.get(miner);
    }

    /**
     * Extra data as text when every character is printable ASCII or a space.
     *
     * @return the text, or {@code null} for empty or binary extra data
     */
    public static @Nullable String decodeExtraData(final HexData extraData) {
        if (extraData.isEmpty()) {
            return null;
        }
        final String text = strictUtf8(extraData.toBytes());
        if (text == null) {
            return null;
        }
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c < 0x20 || c > 0x7e) {
                return null;
            }
        }
        return text;
    }

    private static boolean isPlainName(final String text) {
        return text.codePoints().allMatch(c -> Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '_');
    }

    private static @Nullable String strictUtf8(final byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }
}
