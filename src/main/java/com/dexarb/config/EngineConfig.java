package com.dexarb.config;

import com.dexarb.core.PathGroupingPolicy;
import com.dexarb.core.StartTokenGroupingPolicy;
import com.dexarb.core.TokenSetGroupingPolicy;
import com.dexarb.infra.Web3Service;
import com.dexarb.infra.flashloan.AaveFlashLoanProvider;
import com.dexarb.infra.flashloan.BalancerFlashLoanProvider;
import com.dexarb.infra.flashloan.FlashLoanProvider;
import com.dexarb.infra.flashloan.FlashLoanRouter;
import com.dexarb.infra.relay.BundleClient;
import com.dexarb.infra.relay.FailoverBundleClient;
import com.dexarb.infra.relay.RelayBundleClient;
import com.dexarb.infra.relay.RelayRequestSigner;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionSpec;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Web3j web3j(ArbProperties properties) {
        return Web3j.build(new HttpService(properties.getChain().getRpcUrl()));
    }

    @Bean
    public OkHttpClient relayHttpClient() {
        return new OkHttpClient.Builder()
                .connectionSpecs(Arrays.asList(ConnectionSpec.MODERN_TLS, ConnectionSpec.CLEARTEXT))
                .connectTimeout(2, TimeUnit.SECONDS)
                .readTimeout(5, TimeUnit.SECONDS)
                .retryOnConnectionFailure(false)
                .build();
    }

    @Bean
    public RelayRequestSigner relayRequestSigner(ArbProperties properties) {
        return new RelayRequestSigner(properties.getRelay().getSigningKey());
    }

    @Bean
    public BundleClient bundleClient(ArbProperties properties, OkHttpClient relayHttpClient, ObjectMapper objectMapper,
                                     RelayRequestSigner signer, Web3Service web3Service) {
        ArbProperties.RelayProperties relay = properties.getRelay();
        // a url listed twice is one relay
        Set<String> urls = new LinkedHashSet<>();
        urls.add(relay.getUrl());
        urls.addAll(relay.getAlternateUrls());

        List<BundleClient> clients = new ArrayList<>();
        for (String url : urls) {
            clients.add(new RelayBundleClient(RelayBundleClient.nameFor(url), url, relayHttpClient, objectMapper, signer,
                    web3Service, relay.getSimulationTimeout(), relay.getSubmitTimeout(),
                    properties.getBlocksIntoFuture()));
        }
        log.info("[RELAY] Bundle relays: {}", urls);
        return clients.size() == 1 ? clients.get(0) : new FailoverBundleClient(clients);
    }

    @Bean
    public FlashLoanRouter flashLoanRouter(ArbProperties properties) {
        String executor = properties.getChain().getExecutorAddress();
        long overhead = properties.getGas().getFlashLoanGasOverhead();
        List<FlashLoanProvider> providers = new ArrayList<>();
        if (properties.getCapital().isFlashLoanEnabled()) {
            for (String name : properties.getCapital().getFlashLoanProviders()) {
                switch (name.toLowerCase(Locale.ROOT)) {
                    case "aave" -> providers.add(new AaveFlashLoanProvider(executor, overhead));
                    case "balancer" -> providers.add(new BalancerFlashLoanProvider(executor, overhead));
                    default -> log.warn("Unknown flash loan provider '{}' ignored", name);
                }
            }
        }
        return new FlashLoanRouter(providers);
    }

    @Bean
    public PathGroupingPolicy pathGroupingPolicy(ArbProperties properties) {
        int maxPaths = properties.getAllocation().getMaxPathsPerGroup();
        return switch (properties.getAllocation().getGrouping()) {
            case START_TOKEN -> new StartTokenGroupingPolicy(maxPaths);
            case TOKEN_SET -> new TokenSetGroupingPolicy(maxPaths);
        };
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService executionExecutor(ArbProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getMaxConcurrentExecutions(), r -> {
            Thread t = new Thread(r, "execution-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
