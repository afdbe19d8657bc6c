package com.dexarb.event;

import com.dexarb.domain.ExecutionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Default sink: one structured log line per engine event.
 */
@Slf4j
@Component
public class EngineEventLogger {

    @EventListener
    public void onDiscovered(OpportunityDiscoveredEvent event) {
        log.info("event=opportunity_discovered id={} start={} paths={} bestYield={}",
                event.getOpportunityId(), event.getStartToken(), event.getPathCount(),
                String.format("%.6f", event.getBestYield()));
    }

    @EventListener
    public void onExecuted(OpportunityExecutedEvent event) {
        if (event.getStatus() == ExecutionState.INCLUDED) {
            log.info("💰 event=opportunity_executed id={} status={} profit={} block={}",
                    event.getOutcome().getOpportunityId(), event.getStatus(), event.getProfit(),
                    event.getOutcome().getIncludedBlock());
        } else {
            log.info("event=opportunity_executed id={} status={} reason={} profit={}",
                    event.getOutcome().getOpportunityId(), event.getStatus(),
                    event.getOutcome().getFailureReason(), event.getProfit());
        }
    }

    @EventListener
    public void onGraphStats(GraphStatsEvent event) {
        log.debug("event=graph_stats nodes={} edges={} fresh={}",
                event.getNodes(), event.getEdges(), event.getFreshEdges());
    }
}
