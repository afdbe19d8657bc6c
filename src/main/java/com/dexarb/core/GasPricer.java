package com.dexarb.core;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.TransactionRequest;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * EIP-1559 fee caps for a bundle. Only the lead transaction pays a priority fee; the rest ride
 * on bundle atomicity with zero tip. Max fee covers two consecutive full blocks of base fee growth.
 */
@Component
public class GasPricer {

    private static final BigDecimal WEI_PER_GWEI = BigDecimal.valueOf(1_000_000_000L);

    private final ArbProperties.GasProperties gas;
    private final double multiplier;

    public GasPricer(ArbProperties properties) {
        this.gas = properties.getGas();
        this.multiplier = properties.getGasPriceMultiplier();
    }

    public BigInteger leadPriorityFee() {
        double gwei = Math.min(gas.getPriorityFeeGwei() * multiplier, gas.getMaxPriorityFeeGwei());
        return BigDecimal.valueOf(gwei).multiply(WEI_PER_GWEI).toBigInteger();
    }

    public List<TransactionRequest> price(List<TransactionRequest> transactions, BigInteger baseFee) {
        BigInteger baseCap = baseFee.shiftLeft(1);
        List<TransactionRequest> priced = new ArrayList<>(transactions.size());
        for (int i = 0; i < transactions.size(); i++) {
            BigInteger priority = i == 0 ? leadPriorityFee() : BigInteger.ZERO;
            priced.add(transactions.get(i)
                    .withMaxPriorityFeePerGas(priority)
                    .withMaxFeePerGas(baseCap.add(priority)));
        }
        return priced;
    }
}
