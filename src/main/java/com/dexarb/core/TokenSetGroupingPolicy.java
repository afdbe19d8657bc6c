package com.dexarb.core;

import com.dexarb.domain.ArbitragePath;
import com.dexarb.domain.Token;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Groups paths that trade exactly the same set of tokens, e.g. the same triangle routed through
 * different venues. Paths in a group may share pools.
 */
public class TokenSetGroupingPolicy implements PathGroupingPolicy {

    private final int maxPathsPerGroup;

    public TokenSetGroupingPolicy(int maxPathsPerGroup) {
        this.maxPathsPerGroup = maxPathsPerGroup;
    }

    @Override
    public List<List<ArbitragePath>> group(List<ArbitragePath> rankedPaths) {
        Map<String, List<ArbitragePath>> groups = new LinkedHashMap<>();
        for (ArbitragePath path : rankedPaths) {
            TreeSet<String> tokenSet = new TreeSet<>();
            for (Token token : path.getTokens()) {
                tokenSet.add(token.getAddress());
            }
            String key = path.startToken().getAddress() + "/" + String.join(",", tokenSet);
            List<ArbitragePath> group = groups.computeIfAbsent(key, k -> new ArrayList<>());
            if (group.size() < maxPathsPerGroup) {
                group.add(path);
            }
        }
        return new ArrayList<>(groups.values());
    }
}
