package com.dexarb.core;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.ArbitragePath;
import com.dexarb.domain.TransactionRequest;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Hash;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;

import static com.dexarb.core.TestGraphs.A;
import static com.dexarb.core.TestGraphs.B;
import static com.dexarb.core.TestGraphs.C;
import static com.dexarb.core.TestGraphs.T0;
import static org.junit.jupiter.api.Assertions.*;

class TransactionFactoryTest {

    @Test
    void testArbitrageCallEncodesRouteAndAmounts() {
        ArbProperties properties = TestGraphs.properties();
        properties.getChain().setExecutorAddress("0x00000000000000000000000000000000000000ee");
        LiquidityGraph graph = new LiquidityGraph(properties, new MutableClock(T0));
        TestGraphs.triangle(graph, 1.00);
        ArbitragePath path = new PathFinder(properties).findCycles(graph.snapshot(), A.getAddress(), 3, 1).get(0);

        TransactionRequest tx = new TransactionFactory(properties).arbitrageCall(path, 2.5, 2.4);

        // 1. Target, gas and profit token
        assertEquals("0x00000000000000000000000000000000000000ee", tx.getTo());
        assertEquals(BigInteger.valueOf(21_000 + 150_000L * 3), tx.getGasLimit());
        assertEquals(A, tx.getProfitToken());
        assertFalse(tx.isSigned());

        // 2. Calldata carries the selector, every hop and both amounts
        String data = tx.getData();
        assertTrue(data.startsWith(Hash.sha3String(
                TransactionFactory.EXECUTE_ARBITRAGE + "(address[],address[],uint256,uint256)").substring(0, 10)));
        assertTrue(data.contains(TypeEncoder.encode(new Address(B.getAddress()))));
        assertTrue(data.contains(TypeEncoder.encode(new Address(C.getAddress()))));
        for (String pool : path.poolAddresses()) {
            assertTrue(data.contains(TypeEncoder.encode(new Address(pool))), pool);
        }
        assertTrue(data.contains(TypeEncoder.encode(new Uint256(new BigInteger("2500000000000000000")))));
        assertTrue(data.contains(TypeEncoder.encode(new Uint256(new BigInteger("2400000000000000000")))));
    }
}
