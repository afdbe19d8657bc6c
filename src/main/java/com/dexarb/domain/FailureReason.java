package com.dexarb.domain;

public enum FailureReason {
    UNPROFITABLE,
    INSUFFICIENT_CAPITAL,
    STALE_POOLS,
    SIMULATION_FAILED,
    BELOW_PROFIT_THRESHOLD,
    RELAY_ERROR,
    SUBMISSION_FAILED,
    REJECTED,
    WATCH_ONLY,
    INTERNAL_ERROR
}
