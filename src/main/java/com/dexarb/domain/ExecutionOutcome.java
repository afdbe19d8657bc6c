package com.dexarb.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Terminal report of one opportunity pipeline.
 */
@Value
@Builder
public class ExecutionOutcome {
    String opportunityId;
    Token startToken;
    ExecutionState state;
    FailureReason failureReason;
    String detail;
    List<ExecutionState> transitions;
    double expectedProfit;
    Double simulatedProfit;
    boolean flashLoan;
    Long includedBlock;
    String bundleHash;

    public boolean reached(ExecutionState s) {
        return transitions.contains(s);
    }
}
