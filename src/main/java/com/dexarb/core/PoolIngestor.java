package com.dexarb.core;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.PoolDescriptor;
import com.dexarb.domain.PoolStateUpdate;
import com.dexarb.domain.Token;
import com.dexarb.infra.pool.PoolAdapter;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires configured pools to their venue adapters and feeds updates into the graph.
 */
@Slf4j
@Service
public class PoolIngestor {

    private final ArbProperties properties;
    private final LiquidityGraph graph;
    private final TokenRegistry tokenRegistry;
    private final List<PoolAdapter> adapters;

    private final Map<String, Long> lastBlockByPool = new ConcurrentHashMap<>();
    private final List<PoolAdapter.Subscription> subscriptions = new CopyOnWriteArrayList<>();

    public PoolIngestor(ArbProperties properties, LiquidityGraph graph, TokenRegistry tokenRegistry,
                        List<PoolAdapter> adapters) {
        this.properties = properties;
        this.graph = graph;
        this.tokenRegistry = tokenRegistry;
        this.adapters = adapters;
    }

    @PostConstruct
    public void start() {
        for (ArbProperties.PoolProperties pool : properties.getPools()) {
            resolve(pool).ifPresent(this::subscribe);
        }
        log.info("Pool ingestion started for {} pools", subscriptions.size());
    }

    public boolean subscribe(PoolDescriptor pool) {
        for (PoolAdapter adapter : adapters) {
            if (adapter.supports(pool.getVenue())) {
                subscriptions.add(adapter.subscribe(pool, this::onUpdate));
                return true;
            }
        }
        log.warn("No adapter for venue {} (pool {})", pool.getVenue(), pool.getAddress());
        return false;
    }

    /**
     * Applies one adapter push. Repeats of an already-seen block are ignored.
     *
     * @return true if the update reached the graph
     */
    public boolean onUpdate(PoolStateUpdate update) {
        String key = update.getPool().getAddress().toLowerCase(Locale.ROOT);
        AtomicBoolean fresh = new AtomicBoolean(false);
        lastBlockByPool.compute(key, (k, last) -> {
            if (last != null && update.getBlockNumber() <= last) {
                return last;
            }
            fresh.set(true);
            return update.getBlockNumber();
        });
        if (!fresh.get()) {
            log.trace("Duplicate update for {} at block {}", key, update.getBlockNumber());
            return false;
        }

        if (update.isDelisted()) {
            lastBlockByPool.remove(key);
            return graph.remove(key);
        }
        return graph.applyUpdate(update);
    }

    @Scheduled(fixedDelayString = "${arb.graph.prune-interval-ms:30000}")
    public void pruneStale() {
        Duration pruneAfter = properties.getGraph().getPruneAfter();
        graph.pruneStale(pruneAfter);
    }

    private Optional<PoolDescriptor> resolve(ArbProperties.PoolProperties pool) {
        Optional<Token> token0 = tokenRegistry.find(pool.getToken0());
        Optional<Token> token1 = tokenRegistry.find(pool.getToken1());
        if (token0.isEmpty() || token1.isEmpty()) {
            log.warn("Skipping pool {}: unknown token {}", pool.getAddress(),
                    token0.isEmpty() ? pool.getToken0() : pool.getToken1());
            return Optional.empty();
        }
        return Optional.of(PoolDescriptor.builder()
                .address(pool.getAddress().toLowerCase(Locale.ROOT))
                .venue(pool.getVenue())
                .token0(token0.get())
                .token1(token1.get())
                .feeBps(pool.getFeeBps())
                .build());
    }

    @PreDestroy
    public void stop() {
        subscriptions.forEach(PoolAdapter.Subscription::close);
        subscriptions.clear();
    }
}
