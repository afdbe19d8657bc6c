package com.dexarb.infra.flashloan;

import com.dexarb.domain.Token;
import com.dexarb.domain.TransactionRequest;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FlashLoanRouterTest {

    private static final String EXECUTOR = "0x00000000000000000000000000000000000000ee";
    private static final Token WETH = Token.of("0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2", "WETH", 18);

    private final AaveFlashLoanProvider aave = new AaveFlashLoanProvider(EXECUTOR, 120_000);
    private final BalancerFlashLoanProvider balancer = new BalancerFlashLoanProvider(EXECUTOR, 100_000);

    private static TransactionRequest swap(long gas) {
        return TransactionRequest.builder()
                .to(EXECUTOR)
                .data("0xdeadbeef")
                .gasLimit(BigInteger.valueOf(gas))
                .profitToken(WETH)
                .build();
    }

    @Test
    void testFeeQuotes() {
        assertEquals(0.009, aave.quoteFee(WETH, 10.0), 1e-12);
        assertEquals(0.0, balancer.quoteFee(WETH, 10.0));
    }

    @Test
    void testRouterPicksCheapestProvider() {
        FlashLoanRouter router = new FlashLoanRouter(List.of(aave, balancer));

        assertEquals("balancer", router.cheapest(WETH, 50.0).orElseThrow().name());
        assertEquals("aave", new FlashLoanRouter(List.of(aave)).cheapest(WETH, 50.0).orElseThrow().name());
        assertTrue(new FlashLoanRouter(List.of()).cheapest(WETH, 50.0).isEmpty());
        assertTrue(new FlashLoanRouter(List.of()).isEmpty());
    }

    @Test
    void testWrapFoldsCallsIntoOneExecutorTransaction() {
        TransactionRequest wrapped = aave.wrap(List.of(swap(300_000), swap(450_000)), WETH, 2.5);

        assertEquals(EXECUTOR, wrapped.getTo());
        assertEquals(BigInteger.valueOf(120_000 + 300_000 + 450_000), wrapped.getGasLimit());
        assertEquals(WETH, wrapped.getProfitToken());
        assertFalse(wrapped.isSigned());
        assertTrue(wrapped.getData().startsWith(
                Hash.sha3String("flashArbitrageAave(address,uint256,bytes[])").substring(0, 10)));
        // inner calldata is carried verbatim
        assertTrue(wrapped.getData().contains("deadbeef"));
    }

    @Test
    void testOnlyExecutorCallsCanBeWrapped() {
        TransactionRequest foreign = swap(100_000).toBuilder().to("0x0000000000000000000000000000000000000001").build();

        assertThrows(IllegalArgumentException.class, () -> balancer.wrap(List.of(foreign), WETH, 1.0));
        assertThrows(IllegalArgumentException.class, () -> balancer.wrap(List.of(), WETH, 1.0));
    }
}
