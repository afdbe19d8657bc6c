package com.dexarb.event;

import com.dexarb.core.GraphView;
import com.dexarb.domain.ArbitragePath;
import com.dexarb.domain.ExecutionOutcome;
import com.dexarb.domain.Token;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Outbound events for dashboards and metrics. Listeners are never called back into the engine.
 */
@Component
@RequiredArgsConstructor
public class EngineEventPublisher {

    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public void discovered(String opportunityId, Token startToken, List<ArbitragePath> paths) {
        publisher.publishEvent(new OpportunityDiscoveredEvent(
                opportunityId,
                startToken.getAddress(),
                paths.size(),
                paths.stream().mapToDouble(ArbitragePath::getPathYield).max().orElse(0.0),
                paths.stream().map(ArbitragePath::describe).toList(),
                clock.instant()));
    }

    public void executed(ExecutionOutcome outcome) {
        publisher.publishEvent(new OpportunityExecutedEvent(outcome));
    }

    public void graphStats(GraphView view) {
        publisher.publishEvent(new GraphStatsEvent(
                view.nodeCount(), view.edgeCount(), view.freshEdgeCount(), view.capturedAt()));
    }
}
