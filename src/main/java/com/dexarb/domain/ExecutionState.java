package com.dexarb.domain;

public enum ExecutionState {
    DISCOVERED,
    ALLOCATED,
    BUNDLE_BUILT,
    SIMULATED,
    SUBMITTED,
    INCLUDED,
    FAILED,
    EXPIRED;

    public boolean isTerminal() {
        return this == INCLUDED || this == FAILED || this == EXPIRED;
    }
}
