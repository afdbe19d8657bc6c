package com.dexarb.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "arb")
@Data
@Validated
public class ArbProperties {

    @Min(2)
    private int maxHops = 3;

    @Positive
    private int maxResults = 20;

    // in start-token units, compared against simulated net profit
    @PositiveOrZero
    private double minProfitThreshold = 0.001;

    @Positive
    private int maxConcurrentExecutions = 2;

    @Positive
    private int blocksIntoFuture = 2;

    @Positive
    private int maxWaitBlocks = 5;

    @DecimalMin("1.0")
    private double gasPriceMultiplier = 1.2;

    @Positive
    private int monteCarloTrials = 500;

    private List<String> startTokens = new ArrayList<>();

    @Valid
    private GraphProperties graph = new GraphProperties();

    @Valid
    private DiscoveryProperties discovery = new DiscoveryProperties();

    @Valid
    private AllocationProperties allocation = new AllocationProperties();

    @Valid
    private CapitalProperties capital = new CapitalProperties();

    @Valid
    private RelayProperties relay = new RelayProperties();

    @Valid
    private ChainProperties chain = new ChainProperties();

    @Valid
    private GasProperties gas = new GasProperties();

    @Valid
    private List<TokenProperties> tokens = new ArrayList<>();

    @Valid
    private List<PoolProperties> pools = new ArrayList<>();

    @Data
    public static class GraphProperties {
        // edges older than this are skipped by discovery
        private Duration poolTtl = Duration.ofSeconds(60);

        // pools not refreshed for this long are removed from the graph
        private Duration pruneAfter = Duration.ofMinutes(10);
    }

    @Data
    public static class DiscoveryProperties {
        @Positive
        private long intervalMs = 2000;

        @Positive
        private int beamWidth = 16;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double maxPoolImpact = 0.1;

        @PositiveOrZero
        private double tieTolerance = 1e-4;

        // weight sums above -minWeightGain are treated as break-even
        @PositiveOrZero
        private double minWeightGain = 1e-9;
    }

    @Data
    public static class AllocationProperties {
        private GroupingPolicy grouping = GroupingPolicy.START_TOKEN;

        @Positive
        private int maxPathsPerGroup = 5;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minAllocationFraction = 0.05;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double hillClimbStepFraction = 0.02;

        @Positive
        private int maxHillClimbIterations = 400;

        // flat start-token overhead per funded path, on top of the estimated gas
        @PositiveOrZero
        private double gasCostPerPath = 0.0;

        private Long randomSeed;
    }

    public enum GroupingPolicy {
        START_TOKEN, TOKEN_SET
    }

    @Data
    public static class CapitalProperties {
        private boolean flashLoanEnabled = true;

        // extra capital the optimizer may assume is borrowable, start-token units
        @PositiveOrZero
        private double flashLoanCapacity = 100.0;

        private List<String> flashLoanProviders = new ArrayList<>(List.of("aave", "balancer"));
    }

    @Data
    public static class RelayProperties {
        private String url = "https://relay.flashbots.net";

        private List<String> alternateUrls = new ArrayList<>();

        // dedicated reputation key, never the trading key
        private String signingKey = "";

        private Duration simulationTimeout = Duration.ofSeconds(3);

        private Duration submitTimeout = Duration.ofSeconds(3);

        @Min(0)
        private int maxSubmitRetries = 3;

        private Duration retryBackoff = Duration.ofMillis(200);
    }

    @Data
    public static class ChainProperties {
        private String rpcUrl = "http://localhost:8545";

        @Positive
        private long chainId = 1;

        private String tradingKey = "";

        private String executorAddress = "0x0000000000000000000000000000000000000000";

        private String wrappedNativeAddress = "0xc02aaa39b223fe8d0a0e5c4f27ead9083c756cc2";

        private Duration pollInterval = Duration.ofSeconds(2);

        private List<String> constantProductVenues = new ArrayList<>(List.of("uniswap_v2", "sushiswap"));
    }

    @Data
    public static class GasProperties {
        @PositiveOrZero
        private double priorityFeeGwei = 2.0;

        @PositiveOrZero
        private double maxPriorityFeeGwei = 5.0;

        @Positive
        private long baseGas = 21_000;

        @Positive
        private long swapGasPerHop = 150_000;

        @Positive
        private long flashLoanGasOverhead = 120_000;

        // start-token units per 1 native token, used when the graph has no direct quote
        @PositiveOrZero
        private double nativeTokenFallbackRate = 0.0;
    }

    @Data
    public static class TokenProperties {
        private String address;
        private String symbol;
        @Min(0)
        private int decimals = 18;
    }

    @Data
    public static class PoolProperties {
        private String address;
        private String venue;
        private String token0;
        private String token1;
        @Min(0)
        private int feeBps = 30;
    }
}
