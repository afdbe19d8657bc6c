package com.dexarb.core;

import com.dexarb.domain.ArbitragePath;
import com.dexarb.domain.Token;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One group per start token, filled greedily in ranking order with paths that share no pool with
 * a path already taken. Disjoint pools keep per-path profit estimates independent.
 */
public class StartTokenGroupingPolicy implements PathGroupingPolicy {

    private final int maxPathsPerGroup;

    public StartTokenGroupingPolicy(int maxPathsPerGroup) {
        this.maxPathsPerGroup = maxPathsPerGroup;
    }

    @Override
    public List<List<ArbitragePath>> group(List<ArbitragePath> rankedPaths) {
        Map<Token, List<ArbitragePath>> groups = new LinkedHashMap<>();
        Map<Token, Set<String>> usedPools = new LinkedHashMap<>();

        for (ArbitragePath path : rankedPaths) {
            List<ArbitragePath> group = groups.computeIfAbsent(path.startToken(), k -> new ArrayList<>());
            Set<String> used = usedPools.computeIfAbsent(path.startToken(), k -> new HashSet<>());
            if (group.size() >= maxPathsPerGroup) {
                continue;
            }
            if (path.poolAddresses().stream().anyMatch(used::contains)) {
                continue;
            }
            group.add(path);
            used.addAll(path.poolAddresses());
        }
        return new ArrayList<>(groups.values());
    }
}
