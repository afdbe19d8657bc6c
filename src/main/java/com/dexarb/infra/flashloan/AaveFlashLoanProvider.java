package com.dexarb.infra.flashloan;

public class AaveFlashLoanProvider extends ExecutorFlashLoanProvider {

    // Aave V3 flash loan premium, 0.09%
    private static final int FEE_BPS = 9;

    public AaveFlashLoanProvider(String executorAddress, long gasOverhead) {
        super(executorAddress, gasOverhead);
    }

    @Override
    public String name() {
        return "aave";
    }

    @Override
    protected String entryPoint() {
        return "flashArbitrageAave";
    }

    @Override
    protected int feeBps() {
        return FEE_BPS;
    }
}
