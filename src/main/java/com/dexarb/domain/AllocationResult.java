package com.dexarb.domain;

import lombok.Value;

import java.util.List;

/**
 * Capital assigned to each candidate path, index-aligned with the optimizer input.
 */
@Value
public class AllocationResult {
    List<Double> allocations;
    double expectedProfit;
    double baselineProfit;

    public static AllocationResult empty(double baselineProfit) {
        return new AllocationResult(List.of(), 0.0, baselineProfit);
    }

    public boolean isEmpty() {
        return allocations.isEmpty();
    }

    public double totalAllocated() {
        return allocations.stream().mapToDouble(Double::doubleValue).sum();
    }
}
