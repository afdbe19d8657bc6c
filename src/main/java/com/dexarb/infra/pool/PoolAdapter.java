package com.dexarb.infra.pool;

import com.dexarb.domain.PoolDescriptor;
import com.dexarb.domain.PoolStateUpdate;

import java.util.function.Consumer;

/**
 * Source of reserve updates for one family of venues. Delivery is push-based and at-least-once;
 * consumers deduplicate by block number.
 */
public interface PoolAdapter {

    boolean supports(String venue);

    Subscription subscribe(PoolDescriptor pool, Consumer<PoolStateUpdate> listener);

    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
