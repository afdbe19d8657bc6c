package com.dexarb.core;

import com.dexarb.domain.ArbitragePath;

import java.util.List;

/**
 * Decides which discovered paths are allocated capital together. Every returned group shares a
 * start token; order inside a group is the discovery ranking.
 */
public interface PathGroupingPolicy {

    List<List<ArbitragePath>> group(List<ArbitragePath> rankedPaths);
}
