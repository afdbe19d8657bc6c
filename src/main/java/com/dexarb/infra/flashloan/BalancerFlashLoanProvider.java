package com.dexarb.infra.flashloan;

/**
 * Balancer vault flash loans, currently fee-free.
 */
public class BalancerFlashLoanProvider extends ExecutorFlashLoanProvider {

    public BalancerFlashLoanProvider(String executorAddress, long gasOverhead) {
        super(executorAddress, gasOverhead);
    }

    @Override
    public String name() {
        return "balancer";
    }

    @Override
    protected String entryPoint() {
        return "flashArbitrageBalancer";
    }

    @Override
    protected int feeBps() {
        return 0;
    }
}
