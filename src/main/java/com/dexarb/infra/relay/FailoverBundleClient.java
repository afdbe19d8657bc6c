package com.dexarb.infra.relay;

import com.dexarb.domain.Bundle;
import com.dexarb.domain.BundleStatus;
import com.dexarb.domain.SimulationResult;
import com.dexarb.domain.SubmissionHandle;
import com.dexarb.domain.TransactionRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Tries the primary relay first and moves on to the alternates when a relay fails transiently.
 * Status queries go back to whichever relay accepted the submission.
 */
@Slf4j
public class FailoverBundleClient implements BundleClient {

    private final Map<String, BundleClient> relays = new LinkedHashMap<>();

    public FailoverBundleClient(List<BundleClient> relays) {
        if (relays.isEmpty()) {
            throw new IllegalArgumentException("At least one relay is required");
        }
        for (BundleClient relay : relays) {
            if (this.relays.putIfAbsent(relay.name(), relay) != null) {
                throw new IllegalArgumentException("Duplicate relay name " + relay.name());
            }
        }
    }

    @Override
    public String name() {
        return "failover" + relays.keySet();
    }

    @Override
    public Bundle build(List<TransactionRequest> transactions, long targetBlock, double nativeToProfitRate) {
        return primary().build(transactions, targetBlock, nativeToProfitRate);
    }

    @Override
    public SimulationResult simulate(Bundle bundle) {
        return withFailover("simulate", relay -> relay.simulate(bundle));
    }

    @Override
    public SubmissionHandle submit(Bundle bundle) {
        return withFailover("submit", relay -> relay.submit(bundle));
    }

    @Override
    public BundleStatus status(SubmissionHandle handle) {
        BundleClient relay = relays.get(handle.getRelay());
        if (relay == null) {
            relay = primary();
        }
        return relay.status(handle);
    }

    private <T> T withFailover(String operation, Function<BundleClient, T> action) {
        TransientRelayException last = null;
        for (BundleClient relay : relays.values()) {
            try {
                return action.apply(relay);
            } catch (TransientRelayException e) {
                log.warn("[RELAY] {} failed on {}: {}. Trying next relay.", operation, relay.name(), e.getMessage());
                last = e;
            }
        }
        throw last;
    }

    private BundleClient primary() {
        return relays.values().iterator().next();
    }
}
