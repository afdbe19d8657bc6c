package com.dexarb.event;

import com.dexarb.domain.ExecutionOutcome;
import com.dexarb.domain.ExecutionState;
import lombok.Value;

/**
 * Terminal result of an execution pipeline. {@code profit} is the simulated net profit when the
 * bundle got that far, otherwise the optimizer's estimate.
 */
@Value
public class OpportunityExecutedEvent {
    ExecutionOutcome outcome;

    public ExecutionState getStatus() {
        return outcome.getState();
    }

    public double getProfit() {
        return outcome.getSimulatedProfit() != null ? outcome.getSimulatedProfit() : outcome.getExpectedProfit();
    }
}
