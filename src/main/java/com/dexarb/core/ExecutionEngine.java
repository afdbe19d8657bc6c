package com.dexarb.core;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.AllocationResult;
import com.dexarb.domain.ArbitragePath;
import com.dexarb.domain.Bundle;
import com.dexarb.domain.BundleStatus;
import com.dexarb.domain.ExecutionOutcome;
import com.dexarb.domain.ExecutionState;
import com.dexarb.domain.FailureReason;
import com.dexarb.domain.MultiPathOpportunity;
import com.dexarb.domain.SimulationResult;
import com.dexarb.domain.SubmissionHandle;
import com.dexarb.domain.Token;
import com.dexarb.domain.TransactionRequest;
import com.dexarb.event.EngineEventPublisher;
import com.dexarb.infra.SigningKeyUnavailableException;
import com.dexarb.infra.Web3Service;
import com.dexarb.infra.flashloan.FlashLoanProvider;
import com.dexarb.infra.flashloan.FlashLoanRouter;
import com.dexarb.infra.relay.BundleClient;
import com.dexarb.infra.relay.RelayException;
import com.dexarb.infra.relay.TransientRelayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Drives one opportunity through
 * {@code DISCOVERED -> ALLOCATED -> BUNDLE_BUILT -> SIMULATED -> SUBMITTED -> INCLUDED | FAILED | EXPIRED}.
 * Each step consumes the current state and produces the next one or a terminal failure. Nothing
 * here outlives the call to {@link #execute}.
 */
@Slf4j
@Service
public class ExecutionEngine {

    private static final double CAPITAL_EPSILON = 1e-9;

    private final ArbProperties properties;
    private final BundleClient bundleClient;
    private final Web3Service web3Service;
    private final LiquidityGraph graph;
    private final CapitalAllocator allocator;
    private final TransactionFactory transactionFactory;
    private final GasPricer gasPricer;
    private final FlashLoanRouter flashLoanRouter;
    private final EngineEventPublisher events;
    private final Clock clock;

    public ExecutionEngine(ArbProperties properties, BundleClient bundleClient, Web3Service web3Service,
                           LiquidityGraph graph, CapitalAllocator allocator, TransactionFactory transactionFactory,
                           GasPricer gasPricer, FlashLoanRouter flashLoanRouter, EngineEventPublisher events,
                           Clock clock) {
        this.properties = properties;
        this.bundleClient = bundleClient;
        this.web3Service = web3Service;
        this.graph = graph;
        this.allocator = allocator;
        this.transactionFactory = transactionFactory;
        this.gasPricer = gasPricer;
        this.flashLoanRouter = flashLoanRouter;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Runs the pipeline to a terminal state and publishes the outcome.
     *
     * @throws SigningKeyUnavailableException if a configured key cannot sign; the engine cannot
     *                                        continue without it
     */
    public ExecutionOutcome execute(String opportunityId, Token startToken, List<ArbitragePath> paths) {
        Pipeline p = new Pipeline(opportunityId, startToken, paths);
        log.info("--- START ARB EXECUTION: {} from {} over {} paths ---", opportunityId, startToken, paths.size());

        while (!p.state.isTerminal()) {
            try {
                switch (p.state) {
                    case DISCOVERED -> allocate(p);
                    case ALLOCATED -> buildBundle(p);
                    case BUNDLE_BUILT -> simulate(p);
                    case SIMULATED -> submit(p);
                    case SUBMITTED -> awaitInclusion(p);
                    default -> throw new IllegalStateException("No transition out of " + p.state);
                }
            } catch (SigningKeyUnavailableException e) {
                log.error("[EXECUTION] FATAL: signing key unavailable during state {}", p.state, e);
                p.fail(FailureReason.INTERNAL_ERROR, e.getMessage());
                events.executed(p.outcome());
                throw e;
            } catch (RelayException e) {
                log.warn("[EXECUTION] Relay error during state {}: {}", p.state, e.getMessage());
                p.fail(FailureReason.RELAY_ERROR, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                p.fail(FailureReason.INTERNAL_ERROR, "interrupted");
            } catch (RuntimeException e) {
                log.error("[EXECUTION] ERROR during state {}", p.state, e);
                p.fail(FailureReason.INTERNAL_ERROR, e.getMessage());
            }
        }

        ExecutionOutcome outcome = p.outcome();
        if (outcome.getState() == ExecutionState.INCLUDED) {
            log.info("--- 🎯 EXECUTION SUCCESSFUL for Arb {} in block {} ---", opportunityId, outcome.getIncludedBlock());
        } else if (outcome.getState() == ExecutionState.EXPIRED) {
            log.info("--- Missed opportunity {}: not included within {} blocks ---", opportunityId,
                    properties.getMaxWaitBlocks());
        } else {
            log.info("--- Arb {} ended {} ({}) {} ---", opportunityId, outcome.getState(),
                    outcome.getFailureReason(), outcome.getDetail() != null ? outcome.getDetail() : "");
        }
        events.executed(outcome);
        return outcome;
    }

    private void allocate(Pipeline p) {
        Token token = p.startToken;
        p.walletBalance = token.toUnits(web3Service.tokenBalance(token.getAddress()));
        ArbProperties.CapitalProperties capital = properties.getCapital();
        double borrowable = capital.isFlashLoanEnabled() && !flashLoanRouter.isEmpty()
                ? capital.getFlashLoanCapacity()
                : 0.0;
        double totalCapital = p.walletBalance + borrowable;
        if (totalCapital <= 0) {
            p.fail(FailureReason.INSUFFICIENT_CAPITAL, "no wallet balance and no flash loan capacity");
            return;
        }

        AllocationResult allocation = allocator.optimize(p.paths, totalCapital, gasCostEstimator(token));
        if (allocation.isEmpty()) {
            p.fail(FailureReason.UNPROFITABLE, "optimizer found no positive allocation");
            return;
        }

        double weightedConfidence = 0.0;
        for (int i = 0; i < p.paths.size(); i++) {
            weightedConfidence += p.paths.get(i).getConfidence() * allocation.getAllocations().get(i);
        }
        p.opportunity = MultiPathOpportunity.builder()
                .id(p.id)
                .startToken(token)
                .paths(p.paths)
                .allocations(allocation.getAllocations())
                .expectedProfit(allocation.getExpectedProfit())
                .confidence(weightedConfidence / allocation.totalAllocated())
                .createdAt(clock.instant())
                .build();
        log.info("[EXECUTION] State: ALLOCATED | {} {} across {} paths, expected profit {} (baseline {})",
                allocation.totalAllocated(), token, p.opportunity.activePaths().size(),
                allocation.getExpectedProfit(), allocation.getBaselineProfit());
        p.advance(ExecutionState.ALLOCATED);
    }

    /**
     * Expected gas spend for one path, in units of the profit token, at the current base fee plus
     * the lead priority fee.
     */
    ToDoubleFunction<ArbitragePath> gasCostEstimator(Token profitToken) {
        ArbProperties.GasProperties gas = properties.getGas();
        BigInteger gasPrice = web3Service.baseFeePerGas().add(gasPricer.leadPriorityFee());
        double nativePerGas = new BigDecimal(gasPrice).movePointLeft(18).doubleValue();
        double rate = nativeToProfitRate(profitToken);
        return path -> (gas.getBaseGas() + (double) gas.getSwapGasPerHop() * path.hops()) * nativePerGas * rate;
    }

    private void buildBundle(Pipeline p) {
        MultiPathOpportunity opp = p.opportunity;
        if (web3Service.isWatchOnly()) {
            log.info("[WATCH-ONLY] Would execute {} paths from {} with {} capital, expected profit {}",
                    opp.activePaths().size(), opp.getStartToken(), opp.totalAllocated(), opp.getExpectedProfit());
            p.fail(FailureReason.WATCH_ONLY, null);
            return;
        }
        if (!graph.areFresh(opp.poolAddresses())) {
            p.fail(FailureReason.STALE_POOLS, "pool data expired before bundle build");
            return;
        }

        List<ArbitragePath> active = opp.activePaths();
        List<Double> amounts = opp.activeAllocations();
        List<TransactionRequest> calls = new ArrayList<>();
        for (int i = 0; i < active.size(); i++) {
            calls.add(transactionFactory.arbitrageCall(active.get(i), amounts.get(i), amounts.get(i)));
        }

        List<TransactionRequest> unsigned = calls;
        double shortfall = opp.totalAllocated() - p.walletBalance;
        if (shortfall > CAPITAL_EPSILON) {
            Optional<FlashLoanProvider> provider = flashLoanRouter.cheapest(opp.getStartToken(), shortfall);
            if (provider.isEmpty() || !properties.getCapital().isFlashLoanEnabled()) {
                p.fail(FailureReason.INSUFFICIENT_CAPITAL, "needs " + shortfall + " more and no flash loan available");
                return;
            }
            double fee = provider.get().quoteFee(opp.getStartToken(), shortfall);
            if (opp.getExpectedProfit() - fee < properties.getMinProfitThreshold()) {
                p.fail(FailureReason.BELOW_PROFIT_THRESHOLD,
                        "flash loan fee " + fee + " leaves " + (opp.getExpectedProfit() - fee));
                return;
            }
            unsigned = List.of(provider.get().wrap(calls, opp.getStartToken(), shortfall));
            p.flashLoan = true;
            log.info("[EXECUTION] Borrowing {} {} via {} (fee {})", shortfall, opp.getStartToken(),
                    provider.get().name(), fee);
        }

        List<TransactionRequest> priced = gasPricer.price(unsigned, web3Service.baseFeePerGas());
        BigInteger nonce = web3Service.pendingNonce();
        List<TransactionRequest> signed = new ArrayList<>(priced.size());
        for (TransactionRequest tx : priced) {
            signed.add(web3Service.sign(tx.toBuilder().nonce(nonce).build()));
            nonce = nonce.add(BigInteger.ONE);
        }

        long targetBlock = web3Service.currentBlockNumber() + 1;
        p.bundle = bundleClient.build(signed, targetBlock, nativeToProfitRate(opp.getStartToken()));
        log.info("[EXECUTION] State: BUNDLE_BUILT | bundle {} with {} txs for block {}{}",
                p.bundle.getId(), signed.size(), targetBlock, p.flashLoan ? " (flash loan)" : "");
        p.advance(ExecutionState.BUNDLE_BUILT);
    }

    private void simulate(Pipeline p) {
        SimulationResult result;
        try {
            result = bundleClient.simulate(p.bundle);
        } catch (TransientRelayException e) {
            // state has moved on by the time a retry would land; never resimulate the same bundle
            p.fail(FailureReason.RELAY_ERROR, "simulation unavailable: " + e.getMessage());
            return;
        }
        if (!result.isSuccess()) {
            p.fail(FailureReason.SIMULATION_FAILED, result.getError());
            return;
        }
        p.simulatedProfit = result.getNetProfit();
        if (result.getNetProfit() <= 0 || result.getNetProfit() < properties.getMinProfitThreshold()) {
            p.fail(FailureReason.BELOW_PROFIT_THRESHOLD,
                    "simulated net profit " + result.getNetProfit() + " < " + properties.getMinProfitThreshold());
            return;
        }
        log.info("[EXECUTION] State: SIMULATED | net profit {} {}, gas used {}",
                result.getNetProfit(), p.startToken, result.getGasUsed());
        p.advance(ExecutionState.SIMULATED);
    }

    private void submit(Pipeline p) throws InterruptedException {
        ArbProperties.RelayProperties relay = properties.getRelay();
        Bundle bundle = p.bundle;
        for (int attempt = 0; ; attempt++) {
            if (!graph.areFresh(p.opportunity.poolAddresses())) {
                p.fail(FailureReason.STALE_POOLS, "pool data expired before submission");
                return;
            }
            try {
                // a failed block read must not leave a submitted bundle behind
                long submitBlock = web3Service.currentBlockNumber();
                p.handle = bundleClient.submit(bundle);
                p.bundle = bundle;
                p.submitBlock = submitBlock;
                log.info("[EXECUTION] State: SUBMITTED | bundle {} targeting block {} (attempt {})",
                        bundle.getId(), bundle.getTargetBlock(), attempt + 1);
                p.advance(ExecutionState.SUBMITTED);
                return;
            } catch (RelayException e) {
                if (attempt >= relay.getMaxSubmitRetries()) {
                    p.fail(FailureReason.SUBMISSION_FAILED,
                            "gave up after " + (attempt + 1) + " attempts: " + e.getMessage());
                    return;
                }
                long backoff = relay.getRetryBackoff().toMillis() << attempt;
                log.warn("[EXECUTION] Submission attempt {} failed ({}). Retrying in {}ms for block {}",
                        attempt + 1, e.getMessage(), backoff, bundle.getTargetBlock() + 1);
                Thread.sleep(backoff);
                bundle = bundle.withTargetBlock(bundle.getTargetBlock() + 1);
            }
        }
    }

    private void awaitInclusion(Pipeline p) throws InterruptedException {
        long deadline = p.submitBlock + properties.getMaxWaitBlocks();
        Duration pollInterval = properties.getChain().getPollInterval();
        while (true) {
            BundleStatus status;
            try {
                status = bundleClient.status(p.handle);
            } catch (TransientRelayException e) {
                log.warn("[EXECUTION] Status poll failed for {}: {}", p.id, e.getMessage());
                status = BundleStatus.pending();
            }

            switch (status.getKind()) {
                case INCLUDED -> {
                    p.includedBlock = status.getIncludedBlock();
                    p.advance(ExecutionState.INCLUDED);
                    return;
                }
                case REJECTED -> {
                    p.fail(FailureReason.REJECTED, status.getReason());
                    return;
                }
                default -> {
                    if (web3Service.currentBlockNumber() >= deadline) {
                        // the bundle never executed, so the capital was never at risk
                        p.advance(ExecutionState.EXPIRED);
                        return;
                    }
                    Thread.sleep(pollInterval.toMillis());
                }
            }
        }
    }

    /**
     * Profit-token units per native token, for netting gas out of simulated profit.
     */
    double nativeToProfitRate(Token profitToken) {
        String wrappedNative = properties.getChain().getWrappedNativeAddress();
        if (profitToken.getAddress().equalsIgnoreCase(wrappedNative)) {
            return 1.0;
        }
        Optional<Double> quoted = graph.snapshot().spotRate(wrappedNative, profitToken.getAddress());
        if (quoted.isPresent()) {
            return quoted.get();
        }
        double fallback = properties.getGas().getNativeTokenFallbackRate();
        if (fallback <= 0) {
            log.warn("[EXECUTION] No native price for {}; gas will not be netted out of simulated profit", profitToken);
        }
        return fallback;
    }

    private static final class Pipeline {
        private final String id;
        private final Token startToken;
        private final List<ArbitragePath> paths;
        private final List<ExecutionState> transitions = new ArrayList<>();

        private ExecutionState state;
        private FailureReason failureReason;
        private String detail;
        private double walletBalance;
        private MultiPathOpportunity opportunity;
        private boolean flashLoan;
        private Bundle bundle;
        private Double simulatedProfit;
        private SubmissionHandle handle;
        private long submitBlock;
        private Long includedBlock;

        Pipeline(String id, Token startToken, List<ArbitragePath> paths) {
            this.id = id;
            this.startToken = startToken;
            this.paths = List.copyOf(paths);
            advance(ExecutionState.DISCOVERED);
        }

        void advance(ExecutionState next) {
            state = next;
            transitions.add(next);
        }

        void fail(FailureReason reason, String why) {
            failureReason = reason;
            detail = why;
            advance(ExecutionState.FAILED);
        }

        ExecutionOutcome outcome() {
            return ExecutionOutcome.builder()
                    .opportunityId(id)
                    .startToken(startToken)
                    .state(state)
                    .failureReason(failureReason)
                    .detail(detail)
                    .transitions(List.copyOf(transitions))
                    .expectedProfit(opportunity != null ? opportunity.getExpectedProfit() : 0.0)
                    .simulatedProfit(simulatedProfit)
                    .flashLoan(flashLoan)
                    .includedBlock(includedBlock)
                    .bundleHash(handle != null ? handle.getBundleHash() : null)
                    .build();
        }
    }
}
