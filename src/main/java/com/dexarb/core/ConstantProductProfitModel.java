package com.dexarb.core;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.ArbitragePath;
import org.springframework.stereotype.Component;

/**
 * Walks the capital through each pool's constant-product curve, so returns diminish with size,
 * then charges a flat gas cost for every funded path.
 */
@Component
public class ConstantProductProfitModel implements ProfitModel {

    private final double gasCostPerPath;

    public ConstantProductProfitModel(ArbProperties properties) {
        this.gasCostPerPath = properties.getAllocation().getGasCostPerPath();
    }

    @Override
    public double profit(ArbitragePath path, double capital) {
        if (capital <= 0) {
            return 0.0;
        }
        return path.profitFor(capital) - gasCostPerPath;
    }
}
