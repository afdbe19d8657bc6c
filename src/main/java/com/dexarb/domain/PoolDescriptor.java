package com.dexarb.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Static identity of a liquidity pool as configured or discovered by a venue adapter.
 */
@Value
@Builder
public class PoolDescriptor {
    String address;
    String venue;
    Token token0;
    Token token1;
    int feeBps;
}
