package com.dexarb.core;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.ArbitragePath;
import com.dexarb.domain.Token;
import com.dexarb.event.EngineControlCommand;
import com.dexarb.event.EngineEventPublisher;
import com.dexarb.infra.SigningKeyUnavailableException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs discovery on a timer and on graph changes, and hands each group of paths to the
 * {@link ExecutionEngine}. At most {@code maxConcurrentExecutions} pipelines run at once; anything
 * discovered while all slots are busy is dropped, since it will be stale by the time a slot frees.
 */
@Slf4j
@Service
public class ArbitrageOrchestrator {

    private final ArbProperties properties;
    private final LiquidityGraph graph;
    private final PathFinder pathFinder;
    private final PathGroupingPolicy groupingPolicy;
    private final ExecutionEngine executionEngine;
    private final TokenRegistry tokenRegistry;
    private final EngineEventPublisher events;
    private final ExecutorService executionExecutor;

    private final Semaphore executionSlots;
    private final Set<String> poolsInFlight = ConcurrentHashMap.newKeySet();
    private final ReentrantLock discoveryLock = new ReentrantLock();
    private final AtomicBoolean triggerPending = new AtomicBoolean();
    private final ExecutorService discoveryExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "discovery");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean paused;
    private volatile boolean halted;

    public ArbitrageOrchestrator(ArbProperties properties, LiquidityGraph graph, PathFinder pathFinder,
                                 PathGroupingPolicy groupingPolicy, ExecutionEngine executionEngine,
                                 TokenRegistry tokenRegistry, EngineEventPublisher events,
                                 @Qualifier("executionExecutor") ExecutorService executionExecutor) {
        this.properties = properties;
        this.graph = graph;
        this.pathFinder = pathFinder;
        this.groupingPolicy = groupingPolicy;
        this.executionEngine = executionEngine;
        this.tokenRegistry = tokenRegistry;
        this.events = events;
        this.executionExecutor = executionExecutor;
        this.executionSlots = new Semaphore(properties.getMaxConcurrentExecutions());
    }

    @PostConstruct
    public void registerGraphTrigger() {
        graph.addChangeListener(change -> triggerDiscovery());
    }

    /**
     * Queues a discovery pass. Bursts of graph changes collapse into a single pending pass.
     */
    public void triggerDiscovery() {
        if (paused || halted || !triggerPending.compareAndSet(false, true)) {
            return;
        }
        try {
            discoveryExecutor.execute(() -> {
                triggerPending.set(false);
                runDiscovery();
            });
        } catch (RejectedExecutionException e) {
            triggerPending.set(false);
            log.debug("[DISCOVERY] Trigger ignored, discovery executor is shut down");
        }
    }

    @Scheduled(fixedDelayString = "${arb.discovery.interval-ms:2000}")
    public void runLoop() {
        runDiscovery();
    }

    /**
     * One pass over every start token. Failures are contained per token.
     *
     * @return number of groups handed to the execution engine
     */
    public int runDiscovery() {
        if (paused || halted) {
            return 0;
        }
        if (!discoveryLock.tryLock()) {
            return 0;
        }
        int dispatched = 0;
        try {
            GraphView view = graph.snapshot();
            events.graphStats(view);

            for (Token start : startTokens()) {
                if (halted) {
                    break;
                }
                try {
                    List<ArbitragePath> paths = pathFinder.findCycles(
                            view, start, properties.getMaxHops(), properties.getMaxResults());
                    if (paths.isEmpty()) {
                        continue;
                    }
                    log.info("[DISCOVERY] {} profitable cycles from {} (best yield {})",
                            paths.size(), start, paths.get(0).getPathYield());
                    for (List<ArbitragePath> group : groupingPolicy.group(paths)) {
                        if (!group.isEmpty() && dispatch(start, group)) {
                            dispatched++;
                        }
                    }
                } catch (SigningKeyUnavailableException e) {
                    halt(e);
                } catch (RuntimeException e) {
                    log.error("[DISCOVERY] Error while scanning from {}", start, e);
                }
            }
        } finally {
            discoveryLock.unlock();
        }
        return dispatched;
    }

    /**
     * @return true if a pipeline was started for the group
     */
    boolean dispatch(Token start, List<ArbitragePath> group) {
        String id = UUID.randomUUID().toString();
        events.discovered(id, start, group);

        Set<String> pools = new LinkedHashSet<>();
        group.forEach(p -> pools.addAll(p.poolAddresses()));

        if (!executionSlots.tryAcquire()) {
            log.info("[DISCOVERY] Dropping opportunity {}: all {} execution slots busy",
                    id, properties.getMaxConcurrentExecutions());
            return false;
        }
        if (!reservePools(pools)) {
            executionSlots.release();
            log.debug("[DISCOVERY] Skipping opportunity {}: pools already in flight", id);
            return false;
        }

        try {
            executionExecutor.execute(() -> {
                try {
                    executionEngine.execute(id, start, group);
                } catch (SigningKeyUnavailableException e) {
                    halt(e);
                } catch (RuntimeException e) {
                    log.error("[EXECUTION] Pipeline {} failed unexpectedly", id, e);
                } finally {
                    poolsInFlight.removeAll(pools);
                    executionSlots.release();
                }
            });
        } catch (RejectedExecutionException e) {
            poolsInFlight.removeAll(pools);
            executionSlots.release();
            log.warn("[DISCOVERY] Execution executor rejected opportunity {}", id);
            return false;
        }
        return true;
    }

    private synchronized boolean reservePools(Set<String> pools) {
        for (String pool : pools) {
            if (poolsInFlight.contains(pool)) {
                return false;
            }
        }
        poolsInFlight.addAll(pools);
        return true;
    }

    @EventListener
    public void onControl(EngineControlCommand command) {
        switch (command.getAction()) {
            case PAUSE -> {
                paused = true;
                log.warn("Engine PAUSED: {}", command.getReason());
            }
            case RESUME -> {
                if (halted) {
                    log.error("Cannot resume: engine halted after a fatal error");
                    return;
                }
                paused = false;
                log.info("Engine RESUMED: {}", command.getReason());
            }
        }
    }

    private void halt(SigningKeyUnavailableException e) {
        if (!halted) {
            halted = true;
            log.error("🚨 ENGINE HALTED: {}", e.getMessage(), e);
        }
    }

    private Collection<Token> startTokens() {
        List<String> configured = properties.getStartTokens();
        if (configured.isEmpty()) {
            return tokenRegistry.all();
        }
        List<Token> tokens = new ArrayList<>(configured.size());
        for (String address : configured) {
            tokenRegistry.find(address).ifPresentOrElse(tokens::add,
                    () -> log.warn("[DISCOVERY] Start token {} is not registered", address));
        }
        return tokens;
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isHalted() {
        return halted;
    }

    public int executionsInFlight() {
        return properties.getMaxConcurrentExecutions() - executionSlots.availablePermits();
    }

    @PreDestroy
    public void shutdown() {
        discoveryExecutor.shutdownNow();
    }
}
