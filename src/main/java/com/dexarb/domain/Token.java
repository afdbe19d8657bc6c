package com.dexarb.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;

/**
 * ERC-20 token identity. Equality is by address only; {@link #of} lower-cases it.
 */
@Value
@Builder
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Token {
    @EqualsAndHashCode.Include
    String address;
    String symbol;
    int decimals;

    public static Token of(String address, String symbol, int decimals) {
        return Token.builder()
                .address(address.toLowerCase(Locale.ROOT))
                .symbol(symbol)
                .decimals(decimals)
                .build();
    }

    /** Raw on-chain units to a human amount, e.g. 1e18 wei -> 1.0. */
    public double toUnits(BigInteger raw) {
        return new BigDecimal(raw).movePointLeft(decimals).doubleValue();
    }

    public BigInteger toRaw(double units) {
        return BigDecimal.valueOf(units).movePointRight(decimals).toBigInteger();
    }

    @Override
    public String toString() {
        return symbol != null ? symbol : address;
    }
}
