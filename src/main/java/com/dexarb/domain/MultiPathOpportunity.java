package com.dexarb.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Paths from one start token together with the capital the optimizer assigned to them.
 * Lives for the duration of a single execution pipeline.
 */
@Value
@Builder
public class MultiPathOpportunity {
    String id;
    Token startToken;
    List<ArbitragePath> paths;
    List<Double> allocations;
    double expectedProfit;
    double confidence;
    Instant createdAt;

    public double totalAllocated() {
        return allocations.stream().mapToDouble(Double::doubleValue).sum();
    }

    /** Paths with a non-zero allocation, in input order. */
    public List<ArbitragePath> activePaths() {
        List<ArbitragePath> active = new ArrayList<>();
        for (int i = 0; i < paths.size(); i++) {
            if (allocations.get(i) > 0) {
                active.add(paths.get(i));
            }
        }
        return active;
    }

    public List<Double> activeAllocations() {
        return allocations.stream().filter(a -> a > 0).toList();
    }

    public Set<String> poolAddresses() {
        Set<String> pools = new LinkedHashSet<>();
        activePaths().forEach(p -> pools.addAll(p.poolAddresses()));
        return pools;
    }
}
