package com.dexarb.infra.pool;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.PoolDescriptor;
import com.dexarb.domain.PoolStateUpdate;
import com.dexarb.infra.ChainAccessException;
import com.dexarb.infra.Web3Service;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint112;
import org.web3j.abi.datatypes.generated.Uint32;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Polls {@code getReserves()} on Uniswap V2 style pairs once per poll interval and pushes the
 * result to subscribers.
 */
@Slf4j
@Component
public class UniswapV2PoolAdapter implements PoolAdapter {

    private static final Function GET_RESERVES = new Function(
            "getReserves",
            Collections.emptyList(),
            Arrays.asList(
                    new TypeReference<Uint112>() {
                    },
                    new TypeReference<Uint112>() {
                    },
                    new TypeReference<Uint32>() {
                    }));

    private final Web3Service web3Service;
    private final Set<String> venues;
    private final long pollIntervalMs;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "pool-poller");
        t.setDaemon(true);
        return t;
    });

    public UniswapV2PoolAdapter(Web3Service web3Service, ArbProperties properties) {
        this.web3Service = web3Service;
        this.venues = Set.copyOf(properties.getChain().getConstantProductVenues().stream()
                .map(v -> v.toLowerCase(Locale.ROOT))
                .toList());
        this.pollIntervalMs = properties.getChain().getPollInterval().toMillis();
    }

    @Override
    public boolean supports(String venue) {
        return venue != null && venues.contains(venue.toLowerCase(Locale.ROOT));
    }

    @Override
    public Subscription subscribe(PoolDescriptor pool, Consumer<PoolStateUpdate> listener) {
        Poller poller = new Poller(pool, listener);
        poller.future = scheduler.scheduleWithFixedDelay(poller::poll, 0, pollIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Polling {} pool {} ({}/{})", pool.getVenue(), pool.getAddress(), pool.getToken0(), pool.getToken1());
        return () -> poller.future.cancel(false);
    }

    /**
     * Reads the pool once and returns the update, or null if the call produced nothing usable.
     */
    PoolStateUpdate read(PoolDescriptor pool) {
        long block = web3Service.currentBlockNumber();
        String raw = web3Service.call(pool.getAddress(), FunctionEncoder.encode(GET_RESERVES));
        if (raw == null || raw.equals("0x")) {
            // no code at the address: the pair was removed or never existed
            return PoolStateUpdate.builder().pool(pool).feeBps(pool.getFeeBps()).blockNumber(block).delisted(true).build();
        }
        @SuppressWarnings("rawtypes")
        List<Type> decoded = FunctionReturnDecoder.decode(raw, GET_RESERVES.getOutputParameters());
        if (decoded.size() < 2) {
            return null;
        }
        return PoolStateUpdate.builder()
                .pool(pool)
                .reserve0((BigInteger) decoded.get(0).getValue())
                .reserve1((BigInteger) decoded.get(1).getValue())
                .feeBps(pool.getFeeBps())
                .blockNumber(block)
                .build();
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    private final class Poller {
        private final PoolDescriptor pool;
        private final Consumer<PoolStateUpdate> listener;
        private volatile ScheduledFuture<?> future;

        Poller(PoolDescriptor pool, Consumer<PoolStateUpdate> listener) {
            this.pool = pool;
            this.listener = listener;
        }

        void poll() {
            try {
                PoolStateUpdate update = read(pool);
                if (update != null) {
                    listener.accept(update);
                }
            } catch (ChainAccessException e) {
                log.warn("Reserve poll failed for {}: {}", pool.getAddress(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected error polling {}", pool.getAddress(), e);
            }
        }
    }
}
