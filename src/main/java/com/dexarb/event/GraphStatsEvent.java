package com.dexarb.event;

import lombok.Value;

import java.time.Instant;

@Value
public class GraphStatsEvent {
    int nodes;
    int edges;
    long freshEdges;
    Instant capturedAt;
}
