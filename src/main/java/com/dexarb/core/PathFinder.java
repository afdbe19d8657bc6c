package com.dexarb.core;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.ArbitragePath;
import com.dexarb.domain.PoolEdge;
import com.dexarb.domain.Token;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Searches a {@link GraphView} for negative-weight cycles through a start token.
 * <p>
 * The search is a depth-bounded, level-by-level relaxation: every level extends the surviving
 * partial paths by one edge and keeps, per token, only the {@code beamWidth} lightest ones. Each
 * partial carries its full edge chain so a closing edge yields a concrete cycle.
 */
@Slf4j
@Service
public class PathFinder {

    private final int beamWidth;
    private final double maxPoolImpact;
    private final double tieTolerance;
    private final double minWeightGain;

    public PathFinder(ArbProperties properties) {
        ArbProperties.DiscoveryProperties discovery = properties.getDiscovery();
        this.beamWidth = discovery.getBeamWidth();
        this.maxPoolImpact = discovery.getMaxPoolImpact();
        this.tieTolerance = discovery.getTieTolerance();
        this.minWeightGain = discovery.getMinWeightGain();
    }

    public List<ArbitragePath> findCycles(GraphView view, String startToken, int maxHops, int maxResults) {
        Optional<Token> start = view.token(startToken);
        if (start.isEmpty() || maxHops < 2 || maxResults <= 0) {
            return List.of();
        }
        return findCycles(view, start.get(), maxHops, maxResults);
    }

    public List<ArbitragePath> findCycles(GraphView view, Token start, int maxHops, int maxResults) {
        List<Partial> frontier = List.of(Partial.root(start));
        Map<String, ArbitragePath> candidates = new HashMap<>();
        int rejectedForImpact = 0;

        for (int depth = 1; depth <= maxHops && !frontier.isEmpty(); depth++) {
            Map<Token, List<Partial>> nextLevel = new HashMap<>();

            for (Partial partial : frontier) {
                for (PoolEdge edge : view.outgoing(partial.head.getAddress())) {
                    if (partial.pools.contains(edge.getPoolAddress())) {
                        continue;
                    }
                    Partial extended = partial.extend(edge);

                    if (edge.getTokenOut().equals(start)) {
                        if (depth >= 2 && extended.weight < -minWeightGain) {
                            ArbitragePath path = materialize(extended);
                            if (path == null) {
                                rejectedForImpact++;
                            } else {
                                candidates.putIfAbsent(String.join("|", path.poolAddresses()), path);
                            }
                        }
                        continue;
                    }
                    if (depth < maxHops && !partial.visited.contains(edge.getTokenOut())) {
                        nextLevel.computeIfAbsent(edge.getTokenOut(), k -> new ArrayList<>()).add(extended);
                    }
                }
            }

            List<Partial> survivors = new ArrayList<>();
            for (List<Partial> atNode : nextLevel.values()) {
                atNode.sort(Comparator.comparingDouble(p -> p.weight));
                survivors.addAll(atNode.subList(0, Math.min(beamWidth, atNode.size())));
            }
            frontier = survivors;
        }

        List<ArbitragePath> ranked = rank(new ArrayList<>(candidates.values()));
        if (ranked.size() > maxResults) {
            ranked = ranked.subList(0, maxResults);
        }
        if (!ranked.isEmpty() || rejectedForImpact > 0) {
            log.debug("[DISCOVERY] {} cycles from {} ({} dropped for pool impact)",
                    ranked.size(), start, rejectedForImpact);
        }
        return List.copyOf(ranked);
    }

    /**
     * Higher yield first. A path with fewer hops moves ahead of every longer path directly before
     * it whose yield is at most {@code tieTolerance} higher.
     */
    List<ArbitragePath> rank(List<ArbitragePath> paths) {
        List<ArbitragePath> byYield = new ArrayList<>(paths);
        byYield.sort(Comparator.comparingDouble(ArbitragePath::getPathYield).reversed()
                .thenComparingInt(ArbitragePath::hops)
                .thenComparing(p -> String.join("|", p.poolAddresses())));

        List<ArbitragePath> ranked = new ArrayList<>(byYield.size());
        for (ArbitragePath path : byYield) {
            int slot = ranked.size();
            while (slot > 0 && nearTieWithMoreHops(ranked.get(slot - 1), path)) {
                slot--;
            }
            ranked.add(slot, path);
        }
        return ranked;
    }

    private boolean nearTieWithMoreHops(ArbitragePath ahead, ArbitragePath path) {
        return ahead.hops() > path.hops()
                && ahead.getPathYield() - path.getPathYield() <= tieTolerance;
    }

    /**
     * Sizes the cycle and applies the pool impact filter.
     *
     * @return null when the optimal input would move some pool by more than the allowed impact
     */
    private ArbitragePath materialize(Partial cycle) {
        List<PoolEdge> edges = cycle.edges();
        double optimalInput = optimalInput(edges);
        if (optimalInput <= 0) {
            return null;
        }

        double amount = optimalInput;
        double confidence = 1.0;
        for (PoolEdge edge : edges) {
            double impact = amount / edge.normalizedReserveIn();
            if (impact > maxPoolImpact) {
                return null;
            }
            confidence *= 1.0 - impact;
            amount = edge.amountOut(amount);
        }
        double profit = amount - optimalInput;
        if (profit <= 0) {
            return null;
        }

        ArbitragePath.ArbitragePathBuilder builder = ArbitragePath.builder()
                .token(edges.get(0).getTokenIn())
                .pathYield(Math.exp(-cycle.weight))
                .totalWeight(cycle.weight)
                .requiredInput(optimalInput)
                .expectedProfit(profit)
                .confidence(confidence);
        for (PoolEdge edge : edges) {
            builder.token(edge.getTokenOut()).venue(edge.getVenue()).pool(edge);
        }
        return builder.build();
    }

    /**
     * Folds the cycle's constant-product pools into one virtual pool (reserves {@code e0}, {@code e1},
     * fee factor of the first hop) and returns the input that maximises {@code out(x) - x}.
     */
    static double optimalInput(List<PoolEdge> edges) {
        PoolEdge first = edges.get(0);
        double gamma = first.feeFactor();
        double e0 = first.normalizedReserveIn();
        double e1 = first.normalizedReserveOut();
        for (int i = 1; i < edges.size(); i++) {
            PoolEdge next = edges.get(i);
            double a = next.normalizedReserveIn();
            double b = next.normalizedReserveOut();
            double g = next.feeFactor();
            double denominator = a + g * e1;
            double composedIn = e0 * a / denominator;
            double composedOut = g * e1 * b / denominator;
            e0 = composedIn;
            e1 = composedOut;
        }
        if (gamma * e1 <= e0) {
            return 0;
        }
        return (Math.sqrt(gamma * e0 * e1) - e0) / gamma;
    }

    private static final class Partial {
        private final Token head;
        private final Partial parent;
        private final PoolEdge edge;
        private final double weight;
        private final Set<Token> visited;
        private final Set<String> pools;

        private Partial(Token head, Partial parent, PoolEdge edge, double weight,
                        Set<Token> visited, Set<String> pools) {
            this.head = head;
            this.parent = parent;
            this.edge = edge;
            this.weight = weight;
            this.visited = visited;
            this.pools = pools;
        }

        static Partial root(Token start) {
            return new Partial(start, null, null, 0.0, Set.of(start), Set.of());
        }

        Partial extend(PoolEdge next) {
            Set<Token> nextVisited = new HashSet<>(visited);
            nextVisited.add(next.getTokenOut());
            Set<String> nextPools = new HashSet<>(pools);
            nextPools.add(next.getPoolAddress());
            return new Partial(next.getTokenOut(), this, next, weight + next.getWeight(), nextVisited, nextPools);
        }

        List<PoolEdge> edges() {
            List<PoolEdge> chain = new ArrayList<>();
            for (Partial p = this; p.edge != null; p = p.parent) {
                chain.add(0, p.edge);
            }
            return chain;
        }
    }
}
