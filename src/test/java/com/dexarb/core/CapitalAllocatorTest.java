package com.dexarb.core;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.AllocationResult;
import com.dexarb.domain.ArbitragePath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.dexarb.core.TestGraphs.A;
import static com.dexarb.core.TestGraphs.B;
import static com.dexarb.core.TestGraphs.C;
import static com.dexarb.core.TestGraphs.D;
import static com.dexarb.core.TestGraphs.T0;
import static org.junit.jupiter.api.Assertions.*;

class CapitalAllocatorTest {

    private ArbProperties properties;
    private LiquidityGraph graph;
    private PathFinder pathFinder;

    @BeforeEach
    void setUp() {
        properties = TestGraphs.properties();
        graph = new LiquidityGraph(properties, new MutableClock(T0));
        pathFinder = new PathFinder(properties);
    }

    private CapitalAllocator allocator(long seed) {
        return new CapitalAllocator(properties, new ConstantProductProfitModel(properties), new Random(seed));
    }

    @Test
    void testSinglePathGetsPositiveCapital() {
        TestGraphs.triangle(graph, 1.00);
        List<ArbitragePath> paths = pathFinder.findCycles(graph.snapshot(), A.getAddress(), 3, 10);

        AllocationResult result = allocator(1).optimize(paths, 10.0);

        assertFalse(result.isEmpty());
        assertEquals(1, result.getAllocations().size());
        assertTrue(result.getAllocations().get(0) > 0);
        assertTrue(result.getExpectedProfit() > 0);
        // putting all 10 units in is past the optimum and loses money
        assertTrue(result.getBaselineProfit() < 0);
        assertEquals(paths.get(0).getRequiredInput(), result.getAllocations().get(0), 0.05);
    }

    @Test
    void testNoPathsOrNoCapitalIsEmpty() {
        TestGraphs.triangle(graph, 1.00);
        List<ArbitragePath> paths = pathFinder.findCycles(graph.snapshot(), A.getAddress(), 3, 10);

        assertTrue(allocator(1).optimize(List.of(), 10.0).isEmpty());
        assertTrue(allocator(1).optimize(paths, 0.0).isEmpty());
    }

    @Test
    void testGasCostThatEatsTheEdgeGivesEmptyAllocation() {
        TestGraphs.triangle(graph, 1.00);
        List<ArbitragePath> paths = pathFinder.findCycles(graph.snapshot(), A.getAddress(), 3, 10);

        properties.getAllocation().setGasCostPerPath(paths.get(0).getExpectedProfit() * 2);
        AllocationResult result = allocator(1).optimize(paths, 10.0);

        assertTrue(result.isEmpty());
        assertEquals(0.0, result.getExpectedProfit());
    }

    @Test
    void testExecutionCostIsChargedPerFundedPath() {
        TestGraphs.triangle(graph, 1.00);
        List<ArbitragePath> paths = pathFinder.findCycles(graph.snapshot(), A.getAddress(), 3, 10);
        double edge = paths.get(0).getExpectedProfit();

        AllocationResult free = allocator(1).optimize(paths, 10.0);
        AllocationResult charged = allocator(1).optimize(paths, 10.0, path -> edge / 4);
        AllocationResult priced = allocator(1).optimize(paths, 10.0, path -> edge * 2);

        assertFalse(charged.isEmpty());
        assertEquals(free.getExpectedProfit() - edge / 4, charged.getExpectedProfit(), 1e-6);
        assertTrue(priced.isEmpty());
    }

    @Test
    void testTinyAllocationsAreZeroed() {
        List<ArbitragePath> paths = twoPaths();
        properties.getAllocation().setMinAllocationFraction(0.25);

        AllocationResult result = allocator(3).optimize(paths, 20.0);

        for (double allocation : result.getAllocations()) {
            assertTrue(allocation == 0.0 || allocation >= 5.0, "dust allocation " + allocation);
        }
    }

    @Test
    void testAllocationPropertiesHoldAcrossSeedsAndBudgets() {
        List<ArbitragePath> paths = twoPaths();
        CapitalAllocator scorer = allocator(0);

        for (long seed = 0; seed < 10; seed++) {
            for (double capital : new double[]{0.5, 2.0, 8.0, 40.0, 500.0}) {
                AllocationResult result = allocator(seed).optimize(paths, capital);

                assertTrue(result.getExpectedProfit() >= result.getBaselineProfit(),
                        "worse than equal split for seed " + seed + " capital " + capital);
                if (result.isEmpty()) {
                    continue;
                }
                assertTrue(result.totalAllocated() <= capital, "over budget: " + result.totalAllocated());
                assertTrue(result.getExpectedProfit() > 0);
                double[] vector = result.getAllocations().stream().mapToDouble(Double::doubleValue).toArray();
                assertEquals(result.getExpectedProfit(), scorer.score(paths, vector), 1e-9);
                result.getAllocations().forEach(a -> assertTrue(a >= 0));
            }
        }
    }

    @Test
    void testSecondPathIsFundedWhenTheFirstSaturates() {
        List<ArbitragePath> paths = twoPaths();

        AllocationResult result = allocator(5).optimize(paths, 100.0);

        assertEquals(2, result.getAllocations().size());
        assertTrue(result.getAllocations().get(0) > 0);
        assertTrue(result.getAllocations().get(1) > 0);
        double singleBest = Math.max(paths.get(0).getExpectedProfit(), paths.get(1).getExpectedProfit());
        assertTrue(result.getExpectedProfit() > singleBest);
    }

    /** Two pool-disjoint cycles from A. */
    private List<ArbitragePath> twoPaths() {
        TestGraphs.triangle(graph, 1.00);
        TestGraphs.pool(graph, "0xad1", A, D, 1.0);
        TestGraphs.pool(graph, "0xad2", D, A, 1.03);
        List<ArbitragePath> found = pathFinder.findCycles(graph.snapshot(), A.getAddress(), 3, 10);
        List<ArbitragePath> paths = new ArrayList<>(found);
        assertEquals(2, paths.size());
        assertNotEquals(paths.get(0).getTokens().contains(B), paths.get(1).getTokens().contains(B));
        assertTrue(paths.stream().allMatch(p -> p.getTokens().contains(C) || p.getTokens().contains(D)));
        return paths;
    }
}
