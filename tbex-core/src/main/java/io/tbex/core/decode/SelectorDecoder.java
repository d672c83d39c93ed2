// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.decode;

import io.tbex.core.types.HexData;
import io.tbex.primitives.Hex;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Names a call from the first four bytes of its input using a fixed table of widely
 * used selectors. Pure; no I/O.
 *
 * <p>
 * Entries whose argument list is ambiguous across deployments (router swaps, Aave
 * pool calls) are stored as the bare method name.
 */
public final class SelectorDecoder {

    private static final Map<String, String> SELECTORS = Map.ofEntries(
            // ERC-20
            Map.entry("a9059cbb", "transfer(address,uint256)"),
            Map.entry("23b872dd", "transferFrom(address,address,uint256)"),
            Map.entry("095ea7b3", "approve(address,uint256)"),
            Map.entry("70a08231", "balanceOf(address)"),
            Map.entry("dd62ed3e", "allowance(address,address)"),
            // ERC-721
            Map.entry("42842e0e", "safeTransferFrom(address,address,uint256)"),
            Map.entry("b88d4fde", "safeTransferFrom(address,address,uint256,bytes)"),
            Map.entry("6352211e", "getApproved(uint256)"),
            Map.entry("a22cb465", "setApprovalForAll(address,bool)"),
            // Uniswap V2 router
            Map.entry("38ed1739", "swapExactTokensForTokens"),
            Map.entry("7ff36ab5", "swapExactETHForTokens"),
            Map.entry("18cbafe5", "swapExactTokensForETH"),
            Map.entry("fb3bdb41", "swapETHForExactTokens"),
            // Uniswap V3 router
            Map.entry("c04b8d59", "exactInput"),
            Map.entry("db3e2198", "exactInputSingle"),
            Map.entry("09b81346", "exactOutput"),
            Map.entry("5ae401dc", "exactOutputSingle"),
            Map.entry("ac9650d8", "multicall(uint256,bytes[])"),
            Map.entry("1f0e7408", "multicall(bytes[])"),
            // Common
            Map.entry("39509351", "deposit"),
            Map.entry("2e1a7d4d", "withdraw(uint256)"),
            Map.entry("3ccfd60b", "withdraw"),
            Map.entry("d0e30db0", "mint"),
            Map.entry("a0712d68", "burn"),
            Map.entry("01ffc9a7", "supportsInterface(bytes4)"),
            // Proxy administration
            Map.entry("3e58c58c", "proxy()"),
            Map.entry("5c60da1b", "implementation()"),
            Map.entry("f851a440", "admin()"),
            Map.entry("4f1ef286", "upgradeTo(address)"),
            // Aave
            Map.entry("e8eda9df", "flashLoan"),
            Map.entry("69328dec", "supply"),
            Map.entry("a415bcad", "borrow"),
            Map.entry("573eab5f", "repay"),
            // ENS
            Map.entry("3b3b57de", "setAddr(bytes32,address)"),
            Map.entry("01fbc98e", "setName(string)"));

    private SelectorDecoder() {
    }

    /**
     * @param input call input; only the first four bytes are read
     * @return the table entry, or {@code null} when the input is shorter than four
     *         bytes or the selector is unknown
     */
    public static @Nullable String decode(final byte[] input) {
        if (input == null || input.length < 4) {
            return null;
        }
        return SELECTORS.get(Hex.encodeNoPrefix(java.util.Arrays.copyOf(input, 4)));
    }

    public static @Nullable String decode(final HexData input) {
        return decode(input.toBytes());
    }

    /**
     * Strips the argument list: {@code "transfer(address,uint256)"} becomes
     * {@code "transfer"}.
     */
    public static String shortName(final String signature) {
        final int paren = signature.indexOf('(');
        return paren < 0 ? signature : signature.substring(0, paren);
    }

    /**
     * {@code 0x}-prefixed hex of the first four input bytes, or {@code null} when the
     * input is too short.
     */
    public static @Nullable String selectorHex(final byte[] input) {
        if (input == null || input.length < 4) {
            return null;
        }
        return Hex.encode(input, 0, 4);
    }

    /** Number of known selectors. */
    public static int size() {
        return SELECTORS.size();
    }
}
