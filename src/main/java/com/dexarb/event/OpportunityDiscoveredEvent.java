package com.dexarb.event;

import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class OpportunityDiscoveredEvent {
    String opportunityId;
    String startToken;
    int pathCount;
    double bestYield;
    List<String> routes;
    Instant discoveredAt;
}
