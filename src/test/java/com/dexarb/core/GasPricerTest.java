package com.dexarb.core;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.TransactionRequest;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GasPricerTest {

    private static final BigInteger GWEI = BigInteger.valueOf(1_000_000_000L);

    private static TransactionRequest tx() {
        return TransactionRequest.builder().to("0x00000000000000000000000000000000000000ee").data("0x").build();
    }

    @Test
    void testOnlyLeadTransactionTips() {
        ArbProperties properties = new ArbProperties();
        properties.getGas().setPriorityFeeGwei(2.0);
        properties.setGasPriceMultiplier(1.5);
        GasPricer pricer = new GasPricer(properties);

        List<TransactionRequest> priced = pricer.price(List.of(tx(), tx()), GWEI.multiply(BigInteger.valueOf(20)));

        assertEquals(GWEI.multiply(BigInteger.valueOf(3)), priced.get(0).getMaxPriorityFeePerGas());
        assertEquals(GWEI.multiply(BigInteger.valueOf(43)), priced.get(0).getMaxFeePerGas());
        assertEquals(BigInteger.ZERO, priced.get(1).getMaxPriorityFeePerGas());
        assertEquals(GWEI.multiply(BigInteger.valueOf(40)), priced.get(1).getMaxFeePerGas());
    }

    @Test
    void testPriorityFeeIsCapped() {
        ArbProperties properties = new ArbProperties();
        properties.getGas().setPriorityFeeGwei(4.0);
        properties.getGas().setMaxPriorityFeeGwei(5.0);
        properties.setGasPriceMultiplier(2.0);

        assertEquals(GWEI.multiply(BigInteger.valueOf(5)), new GasPricer(properties).leadPriorityFee());
    }
}
