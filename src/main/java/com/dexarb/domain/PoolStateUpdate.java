package com.dexarb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * One reserve observation pushed by a pool adapter. Delivery is at-least-once.
 */
@Value
@Builder
public class PoolStateUpdate {
    PoolDescriptor pool;
    BigInteger reserve0;
    BigInteger reserve1;
    int feeBps;
    long blockNumber;
    boolean delisted;
}
