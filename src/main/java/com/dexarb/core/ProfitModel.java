package com.dexarb.core;

import com.dexarb.domain.ArbitragePath;

/**
 * Expected net profit of running {@code capital} through one path, in start-token units.
 * Implementations must return 0 for zero capital.
 */
@FunctionalInterface
public interface ProfitModel {

    double profit(ArbitragePath path, double capital);
}
