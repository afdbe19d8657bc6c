package com.dexarb.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A closed trading cycle: {@code tokens.get(0) == tokens.get(tokens.size() - 1)} and
 * {@code pools.get(i)} converts {@code tokens.get(i)} into {@code tokens.get(i + 1)}.
 * Amounts are in units of the start token.
 */
@Value
@Builder
public class ArbitragePath {
    @Singular
    List<Token> tokens;
    @Singular
    List<String> venues;
    @Singular
    List<PoolEdge> pools;
    double pathYield;
    double totalWeight;
    double requiredInput;
    double expectedProfit;
    double confidence;

    public Token startToken() {
        return tokens.get(0);
    }

    public int hops() {
        return pools.size();
    }

    public boolean isCyclic() {
        return tokens.size() >= 2 && tokens.get(0).equals(tokens.get(tokens.size() - 1));
    }

    /** Walks {@code amountIn} through every hop using the snapshot reserves. */
    public double outputFor(double amountIn) {
        double amount = amountIn;
        for (PoolEdge pool : pools) {
            amount = pool.amountOut(amount);
        }
        return amount;
    }

    public double profitFor(double amountIn) {
        return outputFor(amountIn) - amountIn;
    }

    public List<String> poolAddresses() {
        return pools.stream().map(PoolEdge::getPoolAddress).collect(Collectors.toList());
    }

    public String describe() {
        return tokens.stream().map(Token::toString).collect(Collectors.joining(" -> "))
                + " via " + String.join(",", venues);
    }
}
