// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.core.registry;

import io.tbex.core.types.Address;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Fixed table of widely held mainnet ERC-20 tokens, checked for every contract
 * address that is looked up.
 */
public final class PopularTokens {

    /**
     * @param address  token contract
     * @param symbol   ticker
     * @param name     display name
     * @param decimals token decimals
     */
    public record Token(Address address, String symbol, String name, int decimals) {

        public Token {
            Objects.requireNonNull(address, "address");
            Objects.requireNonNull(symbol, "symbol");
            Objects.requireNonNull(name, "name");
        }

        /**
         * Smallest balance worth showing: {@code 10^(decimals - 4)}, or 1 for tokens with
         * fewer than four decimals.
         */
        public BigInteger dustThreshold() {
            return BigInteger.TEN.pow(Math.max(decimals - 4, 0));
        }
    }

    public static final List<Token> ALL = List.of(
            token("0xdAC17F958D2ee523a2206206994597C13D831ec7", "USDT", "Tether USD", 6),
            token("0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48", "USDC", "USD Coin", 6),
            token("0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2", "WETH", "Wrapped Ether", 18),
            token("0x6B175474E89094C44Da98b954EedeAC495271d0F", "DAI", "Dai Stablecoin", 18),
            token("0x2260FAC5E5542a773Aa44fBCfeDf7C193bc2C599", "WBTC", "Wrapped Bitcoin", 8),
            token("0x514910771AF9Ca656af840dff83E8264EcF986CA", "LINK", "Chainlink", 18),
            token("0x1f9840a85d5aF5bf1D1762F925BDADdC4201F984", "UNI", "Uniswap", 18),
            token("0x7D1AfA7B718fb893dB30A3aBc0Cfc608AaCfeBB0", "MATIC", "Polygon", 18),
            token("0x95aD61b0a150d79219dCF64E1E6Cc01f0B64C4cE", "SHIB", "Shiba Inu", 18),
            token("0xae7ab96520DE3A18E5e111B5EaAb095312D7fE84", "stETH", "Lido Staked ETH", 18));

    private PopularTokens() {
    }

    private static Token token(final String address, final String symbol, final String name, final int decimals) {
        return new Token(new Address(address), symbol, name, decimals);
    }
}
