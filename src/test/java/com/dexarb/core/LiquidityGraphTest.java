package com.dexarb.core;

import com.dexarb.domain.PoolDescriptor;
import com.dexarb.domain.PoolEdge;
import com.dexarb.domain.PoolStateUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.dexarb.core.TestGraphs.A;
import static com.dexarb.core.TestGraphs.B;
import static com.dexarb.core.TestGraphs.C;
import static com.dexarb.core.TestGraphs.T0;
import static org.junit.jupiter.api.Assertions.*;

class LiquidityGraphTest {

    private MutableClock clock;
    private LiquidityGraph graph;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        graph = new LiquidityGraph(TestGraphs.properties(), clock);
    }

    @Test
    void testUpdateCreatesBothDirectedEdges() {
        TestGraphs.pool(graph, "0xAB", A, B, 1.02);

        GraphView view = graph.snapshot();
        assertEquals(2, view.nodeCount());
        assertEquals(2, view.edgeCount());

        PoolEdge forward = view.outgoing(A.getAddress()).get(0);
        assertEquals(B, forward.getTokenOut());
        assertEquals(1.02, forward.spotRate(), 1e-9);
        assertEquals(-Math.log(1.02), forward.getWeight(), 1e-9);
        assertEquals("0xab", forward.getPoolAddress());

        PoolEdge backward = view.outgoing(B.getAddress()).get(0);
        assertEquals(A, backward.getTokenOut());
        // 1/1.02 once for the inverse price, then the fee on the way back
        assertEquals(0.997 * 0.997 / 1.02, backward.spotRate(), 1e-9);
    }

    @Test
    void testReupdateRecomputesWeight() {
        PoolDescriptor pool = TestGraphs.pool(graph, "0xab", A, B, 1.00);
        double before = graph.snapshot().outgoing(A.getAddress()).get(0).getWeight();

        graph.applyUpdate(pool, TestGraphs.raw(A, 1000), TestGraphs.raw(B, 2000), 30);
        double after = graph.snapshot().outgoing(A.getAddress()).get(0).getWeight();

        assertNotEquals(before, after);
        assertEquals(-Math.log(2.0 * 0.997), after, 1e-9);
        assertEquals(1, graph.poolCount());
    }

    @Test
    void testMalformedUpdatesAreRejected() {
        PoolDescriptor pool = PoolDescriptor.builder().address("0xab").venue("uniswap_v2")
                .token0(A).token1(B).feeBps(30).build();

        assertFalse(graph.applyUpdate(pool, BigInteger.ZERO, BigInteger.TEN, 30), "zero reserve");
        assertFalse(graph.applyUpdate(pool, BigInteger.valueOf(-1), BigInteger.TEN, 30), "negative reserve");
        assertFalse(graph.applyUpdate(pool, BigInteger.TEN, BigInteger.TEN, 10_000), "fee out of range");
        assertFalse(graph.applyUpdate(pool, null, BigInteger.TEN, 30), "missing reserve");

        PoolDescriptor selfPair = PoolDescriptor.builder()
                .address("0xaa").venue("uniswap_v2").token0(A).token1(A).feeBps(30).build();
        assertFalse(graph.applyUpdate(selfPair, BigInteger.TEN, BigInteger.TEN, 30), "identical tokens");

        PoolDescriptor unknownToken = PoolDescriptor.builder()
                .address("0xac").venue("uniswap_v2").token0(A).feeBps(30).build();
        assertFalse(graph.applyUpdate(unknownToken, BigInteger.TEN, BigInteger.TEN, 30), "unknown token");

        assertEquals(0, graph.poolCount());
        assertEquals(0, graph.snapshot().edgeCount());
    }

    @Test
    void testSnapshotIsIdempotentWithoutUpdates() {
        TestGraphs.triangle(graph, 1.00);

        GraphView first = graph.snapshot();
        GraphView second = graph.snapshot();

        assertEquals(weights(first), weights(second));
        assertEquals(first.version(), second.version());
    }

    @Test
    void testSnapshotIsNotAffectedByLaterUpdates() {
        PoolDescriptor pool = TestGraphs.pool(graph, "0xab", A, B, 1.00);
        GraphView before = graph.snapshot();

        graph.applyUpdate(pool, TestGraphs.raw(A, 1000), TestGraphs.raw(B, 5000), 30);

        assertEquals(1.00, before.outgoing(A.getAddress()).get(0).spotRate(), 1e-9);
        assertTrue(graph.snapshot().version() > before.version());
    }

    @Test
    void testStaleEdgesAreHiddenButKept() {
        TestGraphs.pool(graph, "0xab", A, B, 1.00);
        clock.advance(Duration.ofSeconds(30));
        TestGraphs.pool(graph, "0xbc", B, C, 1.00);

        // pool TTL is 60s: 0xab is 61s old, 0xbc 31s
        clock.advance(Duration.ofSeconds(31));
        GraphView view = graph.snapshot();

        assertTrue(view.outgoing(A.getAddress()).isEmpty());
        assertEquals(1, view.outgoing(B.getAddress()).size());
        assertEquals(4, view.edgeCount());
        assertEquals(2, view.freshEdgeCount());
        assertFalse(graph.areFresh(List.of("0xab")));
        assertTrue(graph.areFresh(List.of("0xbc")));
    }

    @Test
    void testPruneStaleRemovesOldPools() {
        TestGraphs.pool(graph, "0xab", A, B, 1.00);
        clock.advance(Duration.ofMinutes(5));
        TestGraphs.pool(graph, "0xbc", B, C, 1.00);
        clock.advance(Duration.ofMinutes(6));

        int removed = graph.pruneStale(Duration.ofMinutes(10));

        assertEquals(1, removed);
        assertEquals(1, graph.poolCount());
        assertTrue(graph.snapshot().outgoing(A.getAddress()).isEmpty());
    }

    @Test
    void testRemoveAndChangeNotifications() {
        List<LiquidityGraph.GraphChange> changes = new ArrayList<>();
        graph.addChangeListener(changes::add);

        PoolDescriptor pool = TestGraphs.pool(graph, "0xAB", A, B, 1.00);
        assertTrue(graph.remove(pool.getAddress()));
        assertFalse(graph.remove(pool.getAddress()));

        assertEquals(2, changes.size());
        assertEquals(LiquidityGraph.GraphChange.Type.UPDATED, changes.get(0).getType());
        assertEquals(LiquidityGraph.GraphChange.Type.REMOVED, changes.get(1).getType());
        assertEquals("0xab", changes.get(1).getPoolAddress());
        assertEquals(0, graph.snapshot().edgeCount());
    }

    @Test
    void testFailingListenerDoesNotBlockUpdate() {
        graph.addChangeListener(change -> {
            throw new IllegalStateException("listener bug");
        });

        boolean applied = graph.applyUpdate(PoolStateUpdate.builder()
                .pool(PoolDescriptor.builder().address("0xab").venue("uniswap_v2").token0(A).token1(B).feeBps(30).build())
                .reserve0(BigInteger.TEN)
                .reserve1(BigInteger.TEN)
                .feeBps(30)
                .blockNumber(7)
                .build());

        assertTrue(applied);
        assertEquals(7, graph.snapshot().outgoing(A.getAddress()).get(0).getBlockNumber());
    }

    private static Map<String, Double> weights(GraphView view) {
        return view.edges().stream().collect(Collectors.toMap(
                e -> e.getPoolAddress() + ":" + e.getTokenIn().getAddress(),
                PoolEdge::getWeight));
    }
}
