package com.dexarb.infra.relay;

import com.dexarb.domain.Bundle;
import com.dexarb.domain.BundleStatus;
import com.dexarb.domain.SimulationResult;
import com.dexarb.domain.SubmissionHandle;
import com.dexarb.domain.TransactionRequest;

import java.util.List;

/**
 * Private bundle relay. Transactions handed to a client are never broadcast publicly.
 * <p>
 * Callers must {@link #simulate} a bundle, and see it succeed above their profit threshold,
 * before {@link #submit} is called.
 */
public interface BundleClient {

    String name();

    default Bundle build(List<TransactionRequest> transactions, long targetBlock) {
        return build(transactions, targetBlock, 1.0);
    }

    /**
     * @param nativeToProfitRate profit-token units per native token, used to net gas fees out of
     *                           the simulated profit
     */
    Bundle build(List<TransactionRequest> transactions, long targetBlock, double nativeToProfitRate);

    /**
     * @throws TransientRelayException if the relay could not answer
     */
    SimulationResult simulate(Bundle bundle);

    /**
     * @throws TransientRelayException if the relay could not answer
     * @throws RelayException          if the relay refused the bundle
     */
    SubmissionHandle submit(Bundle bundle);

    BundleStatus status(SubmissionHandle handle);
}
