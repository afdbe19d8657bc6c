package com.dexarb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.util.Map;

@Value
@Builder
public class SimulationResult {
    boolean success;
    Map<String, BigInteger> balanceDeltas;
    long gasUsed;
    BigInteger gasFeesWei;
    double netProfit;
    String error;

    public static SimulationResult failed(String error) {
        return SimulationResult.builder()
                .success(false)
                .balanceDeltas(Map.of())
                .gasFeesWei(BigInteger.ZERO)
                .error(error)
                .build();
    }
}
