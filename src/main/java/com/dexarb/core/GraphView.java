package com.dexarb.core;

import com.dexarb.domain.PoolEdge;
import com.dexarb.domain.Token;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable point-in-time copy of the liquidity graph. Safe to share between threads.
 * Edges older than the pool TTL at capture time stay in the view but are hidden from
 * {@link #outgoing(String)}.
 */
public final class GraphView {

    private final Map<String, Token> tokens;
    private final Map<String, List<PoolEdge>> adjacency;
    private final Instant capturedAt;
    private final Duration poolTtl;
    private final long version;

    GraphView(Map<String, Token> tokens, Map<String, List<PoolEdge>> adjacency,
              Instant capturedAt, Duration poolTtl, long version) {
        this.tokens = Map.copyOf(tokens);
        this.adjacency = Map.copyOf(adjacency);
        this.capturedAt = capturedAt;
        this.poolTtl = poolTtl;
        this.version = version;
    }

    GraphView recapturedAt(Instant instant) {
        return new GraphView(tokens, adjacency, instant, poolTtl, version);
    }

    public List<PoolEdge> outgoing(String tokenAddress) {
        List<PoolEdge> edges = adjacency.get(normalize(tokenAddress));
        if (edges == null) {
            return List.of();
        }
        return edges.stream().filter(this::isFresh).toList();
    }

    public boolean isFresh(PoolEdge edge) {
        return !edge.getUpdatedAt().plus(poolTtl).isBefore(capturedAt);
    }

    public Optional<Token> token(String address) {
        return Optional.ofNullable(tokens.get(normalize(address)));
    }

    public List<PoolEdge> edges() {
        return adjacency.values().stream().flatMap(List::stream).toList();
    }

    /** Best fresh direct quote from one token into another. */
    public Optional<Double> spotRate(String from, String to) {
        String target = normalize(to);
        return outgoing(from).stream()
                .filter(e -> e.getTokenOut().getAddress().equals(target))
                .map(PoolEdge::spotRate)
                .max(Comparator.naturalOrder());
    }

    public int nodeCount() {
        return tokens.size();
    }

    public int edgeCount() {
        return adjacency.values().stream().mapToInt(List::size).sum();
    }

    public long freshEdgeCount() {
        return adjacency.values().stream().flatMap(List::stream).filter(this::isFresh).count();
    }

    public Instant capturedAt() {
        return capturedAt;
    }

    public long version() {
        return version;
    }

    private static String normalize(String address) {
        return address == null ? null : address.toLowerCase(Locale.ROOT);
    }
}
