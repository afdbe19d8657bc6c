package com.dexarb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One direction of a constant-product pool, as seen in a graph snapshot.
 * <p>
 * {@code weight = -ln(spotRate)}, so a cycle whose weights sum below zero returns more than it
 * consumed.
 */
@Value
@Builder(toBuilder = true)
public class PoolEdge {
    String poolAddress;
    String venue;
    Token tokenIn;
    Token tokenOut;
    BigInteger reserveIn;
    BigInteger reserveOut;
    int feeBps;
    double weight;
    Instant updatedAt;
    long blockNumber;

    public double feeFactor() {
        return 1.0 - feeBps / 10_000.0;
    }

    public double normalizedReserveIn() {
        return tokenIn.toUnits(reserveIn);
    }

    public double normalizedReserveOut() {
        return tokenOut.toUnits(reserveOut);
    }

    /** Marginal output per unit of input, after fees. */
    public double spotRate() {
        return normalizedReserveOut() / normalizedReserveIn() * feeFactor();
    }

    /** Constant-product output for {@code amountIn} units of {@code tokenIn}. */
    public double amountOut(double amountIn) {
        if (amountIn <= 0) {
            return 0;
        }
        double effectiveIn = amountIn * feeFactor();
        return effectiveIn * normalizedReserveOut() / (normalizedReserveIn() + effectiveIn);
    }

    public static double weightOf(double rate) {
        return -Math.log(rate);
    }
}
