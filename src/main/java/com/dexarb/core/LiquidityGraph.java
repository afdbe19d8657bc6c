package com.dexarb.core;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.PoolDescriptor;
import com.dexarb.domain.PoolEdge;
import com.dexarb.domain.PoolStateUpdate;
import com.dexarb.domain.Token;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Owner of the mutable pool state. All writes go through one lock; readers only ever see
 * {@link GraphView} snapshots, which are rebuilt lazily after a mutation.
 */
@Slf4j
@Component
public class LiquidityGraph {

    private final Clock clock;
    private final Duration poolTtl;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final Map<String, PoolRecord> pools = new LinkedHashMap<>();
    private final List<Consumer<GraphChange>> listeners = new CopyOnWriteArrayList<>();

    private volatile long version;
    private volatile GraphView cached;

    public LiquidityGraph(ArbProperties properties, Clock clock) {
        this.clock = clock;
        this.poolTtl = properties.getGraph().getPoolTtl();
    }

    public boolean applyUpdate(PoolDescriptor pool, BigInteger reserve0, BigInteger reserve1, int feeBps) {
        return applyUpdate(PoolStateUpdate.builder()
                .pool(pool)
                .reserve0(reserve0)
                .reserve1(reserve1)
                .feeBps(feeBps)
                .build());
    }

    /**
     * Inserts or refreshes a pool and recomputes both directed edge weights.
     *
     * @return false if the update was malformed and ignored
     */
    public boolean applyUpdate(PoolStateUpdate update) {
        String rejection = validate(update);
        if (rejection != null) {
            log.warn("[GRAPH] Rejected update for pool {}: {}",
                    update.getPool() != null ? update.getPool().getAddress() : "null", rejection);
            return false;
        }

        PoolDescriptor pool = update.getPool();
        String key = normalize(pool.getAddress());
        Instant now = clock.instant();

        writeLock.lock();
        try {
            PoolRecord record = pools.computeIfAbsent(key, k -> new PoolRecord(pool));
            record.reserve0 = update.getReserve0();
            record.reserve1 = update.getReserve1();
            record.feeBps = update.getFeeBps();
            record.blockNumber = update.getBlockNumber();
            record.updatedAt = now;
            record.recomputeEdges();
            version++;
            cached = null;
        } finally {
            writeLock.unlock();
        }

        notifyListeners(new GraphChange(key, GraphChange.Type.UPDATED));
        return true;
    }

    public boolean remove(String poolAddress) {
        String key = normalize(poolAddress);
        boolean removed;
        writeLock.lock();
        try {
            removed = pools.remove(key) != null;
            if (removed) {
                version++;
                cached = null;
            }
        } finally {
            writeLock.unlock();
        }
        if (removed) {
            log.info("[GRAPH] Pool {} de-listed", key);
            notifyListeners(new GraphChange(key, GraphChange.Type.REMOVED));
        }
        return removed;
    }

    /**
     * Deletes pools that have not been refreshed within {@code ttl}.
     *
     * @return number of pools removed
     */
    public int pruneStale(Duration ttl) {
        Instant cutoff = clock.instant().minus(ttl);
        int removed = 0;
        writeLock.lock();
        try {
            Iterator<PoolRecord> it = pools.values().iterator();
            while (it.hasNext()) {
                if (it.next().updatedAt.isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                version++;
                cached = null;
            }
        } finally {
            writeLock.unlock();
        }
        if (removed > 0) {
            log.info("[GRAPH] Pruned {} stale pools (ttl {})", removed, ttl);
        }
        return removed;
    }

    public GraphView snapshot() {
        GraphView view = cached;
        if (view != null && view.version() == version) {
            // structure unchanged; freshness is re-evaluated against the current clock
            return view.recapturedAt(clock.instant());
        }
        writeLock.lock();
        try {
            Map<String, Token> tokens = new HashMap<>();
            Map<String, List<PoolEdge>> adjacency = new HashMap<>();
            for (PoolRecord record : pools.values()) {
                for (PoolEdge edge : record.edges) {
                    tokens.putIfAbsent(edge.getTokenIn().getAddress(), edge.getTokenIn());
                    adjacency.computeIfAbsent(edge.getTokenIn().getAddress(), k -> new ArrayList<>()).add(edge);
                }
            }
            adjacency.replaceAll((k, v) -> List.copyOf(v));
            view = new GraphView(tokens, adjacency, clock.instant(), poolTtl, version);
            cached = view;
            return view;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * True when every pool is still in the graph and was refreshed within the pool TTL.
     */
    public boolean areFresh(Iterable<String> poolAddresses) {
        Instant cutoff = clock.instant().minus(poolTtl);
        writeLock.lock();
        try {
            for (String address : poolAddresses) {
                PoolRecord record = pools.get(normalize(address));
                if (record == null || record.updatedAt.isBefore(cutoff)) {
                    return false;
                }
            }
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    public void addChangeListener(Consumer<GraphChange> listener) {
        listeners.add(listener);
    }

    public int poolCount() {
        writeLock.lock();
        try {
            return pools.size();
        } finally {
            writeLock.unlock();
        }
    }

    private void notifyListeners(GraphChange change) {
        for (Consumer<GraphChange> listener : listeners) {
            try {
                listener.accept(change);
            } catch (RuntimeException e) {
                log.error("[GRAPH] Change listener failed for pool {}", change.getPoolAddress(), e);
            }
        }
    }

    private static String validate(PoolStateUpdate update) {
        PoolDescriptor pool = update.getPool();
        if (pool == null || pool.getAddress() == null) {
            return "missing pool identity";
        }
        if (pool.getToken0() == null || pool.getToken1() == null) {
            return "unknown token";
        }
        if (pool.getToken0().equals(pool.getToken1())) {
            return "identical tokens";
        }
        if (update.getReserve0() == null || update.getReserve1() == null
                || update.getReserve0().signum() <= 0 || update.getReserve1().signum() <= 0) {
            return "zero or negative liquidity";
        }
        if (update.getFeeBps() < 0 || update.getFeeBps() >= 10_000) {
            return "fee out of range: " + update.getFeeBps();
        }
        return null;
    }

    private static String normalize(String address) {
        return address.toLowerCase(Locale.ROOT);
    }

    public static final class GraphChange {
        public enum Type { UPDATED, REMOVED }

        private final String poolAddress;
        private final Type type;

        GraphChange(String poolAddress, Type type) {
            this.poolAddress = poolAddress;
            this.type = type;
        }

        public String getPoolAddress() {
            return poolAddress;
        }

        public Type getType() {
            return type;
        }
    }

    private static final class PoolRecord {
        private final PoolDescriptor descriptor;
        private BigInteger reserve0;
        private BigInteger reserve1;
        private int feeBps;
        private long blockNumber;
        private Instant updatedAt;
        private List<PoolEdge> edges = List.of();

        PoolRecord(PoolDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        void recomputeEdges() {
            edges = List.of(
                    edge(descriptor.getToken0(), descriptor.getToken1(), reserve0, reserve1),
                    edge(descriptor.getToken1(), descriptor.getToken0(), reserve1, reserve0));
        }

        private PoolEdge edge(Token in, Token out, BigInteger reserveIn, BigInteger reserveOut) {
            PoolEdge unweighted = PoolEdge.builder()
                    .poolAddress(normalize(descriptor.getAddress()))
                    .venue(descriptor.getVenue())
                    .tokenIn(in)
                    .tokenOut(out)
                    .reserveIn(reserveIn)
                    .reserveOut(reserveOut)
                    .feeBps(feeBps)
                    .updatedAt(updatedAt)
                    .blockNumber(blockNumber)
                    .build();
            return unweighted.toBuilder().weight(PoolEdge.weightOf(unweighted.spotRate())).build();
        }
    }
}
