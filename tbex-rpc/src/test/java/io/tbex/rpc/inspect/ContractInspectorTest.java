// SPDX-License-Identifier: MIT OR Apache-2.0
package io.tbex.rpc.inspect;

import static org.junit.jupiter.api.Assertions.*;

import io.tbex.core.error.RpcException;
import io.tbex.core.model.TokenInfo;
import io.tbex.core.types.Address;
import io.tbex.core.types.Hash;
import io.tbex.core.types.HexData;
import io.tbex.rpc.AbiResponses;
import io.tbex.rpc.FakeChainTransport;
import io.tbex.rpc.InlineRetry;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class ContractInspectorTest {

    private static final Address USDC = new Address("0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48");
    private static final Address IMPLEMENTATION = new Address("0x43506849D7C04F9138D1A2050bbF3A0c054402dd");
    private static final Address OWNER = new Address("0xFcb19e6a322b27c06842A71e8c725399f049AE3a");

    private final FakeChainTransport transport = new FakeChainTransport();
    private final ContractInspector inspector = new ContractInspector(transport, InlineRetry.create());

    @Test
    void readsImplementationFromLowTwentyBytes() {
        // high bytes are ignored
        transport.implementationSlot(USDC, new Hash("0xffffffffffffffffffffffff" + IMPLEMENTATION.value().substring(2)));

        assertEquals(IMPLEMENTATION, inspector.proxyImplementation(USDC).join());
    }

    @Test
    void emptySlotIsNotAProxy() {
        assertNull(inspector.proxyImplementation(USDC).join());
    }

    @Test
    void slotReadFailureIsAbsent() {
        transport.failing("eth_getStorageAt", new RpcException(-32601, "method not supported", null, null));

        assertNull(inspector.proxyImplementation(USDC).join());
    }

    @Test
    void detectsErc20Metadata() {
        transport.onCall(USDC, "name()", AbiResponses.string("USD Coin"))
                .onCall(USDC, "symbol()", AbiResponses.string("USDC"))
                .onCall(USDC, "decimals()", AbiResponses.uint(6))
                .onCall(USDC, "totalSupply()", AbiResponses.uint(new BigInteger("25000000000000000")));

        final TokenInfo token = inspector.tokenInfo(USDC).join();

        assertEquals(new TokenInfo("USD Coin", "USDC", 6, new BigInteger("25000000000000000")), token);
    }

    @Test
    void symbolAndDecimalsAreEnough() {
        transport.onCall(USDC, "symbol()", AbiResponses.string("MKR"))
                .onCall(USDC, "decimals()", AbiResponses.uint(18));

        final TokenInfo token = inspector.tokenInfo(USDC).join();

        assertNotNull(token);
        assertNull(token.name());
        assertNull(token.totalSupply());
        assertEquals("MKR", token.symbol());
    }

    @Test
    void missingDecimalsIsNotAToken() {
        transport.onCall(USDC, "name()", AbiResponses.string("Thing"))
                .onCall(USDC, "symbol()", AbiResponses.string("THG"));

        assertNull(inspector.tokenInfo(USDC).join());
    }

    @Test
    void shortStringReturnIsNotDecoded() {
        transport.onCall(USDC, "symbol()", AbiResponses.uint(1))
                .onCall(USDC, "decimals()", AbiResponses.uint(18));

        assertNull(inspector.tokenInfo(USDC).join());
    }

    @Test
    void emptyDecimalsReturnIsNotDecoded() {
        transport.onCall(USDC, "symbol()", AbiResponses.string("X"))
                .onCall(USDC, "decimals()", HexData.EMPTY);

        assertNull(inspector.tokenInfo(USDC).join());
    }

    @Test
    void readsOwner() {
        transport.onCall(USDC, "owner()", AbiResponses.address(OWNER));

        assertEquals(OWNER, inspector.owner(USDC).join());
    }

    @Test
    void zeroOwnerIsAbsent() {
        transport.onCall(USDC, "owner()", AbiResponses.address(Address.ZERO));

        assertNull(inspector.owner(USDC).join());
    }

    @Test
    void revertingOwnerIsAbsent() {
        assertNull(inspector.owner(USDC).join());
    }
}
