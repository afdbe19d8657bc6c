package com.dexarb.infra.relay;

import com.dexarb.domain.Bundle;
import com.dexarb.domain.BundleStatus;
import com.dexarb.domain.SimulationResult;
import com.dexarb.domain.SubmissionHandle;
import com.dexarb.domain.Token;
import com.dexarb.domain.TransactionRequest;
import com.dexarb.infra.ChainAccessException;
import com.dexarb.infra.Web3Service;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC client for a Flashbots-compatible bundle relay.
 */
@Slf4j
public class RelayBundleClient implements BundleClient {

    private static final MediaType JSON = MediaType.parse("application/json");
    private static final BigDecimal WEI_PER_NATIVE = BigDecimal.TEN.pow(18);

    private final String name;
    private final String url;
    private final OkHttpClient simulationClient;
    private final OkHttpClient submitClient;
    private final ObjectMapper objectMapper;
    private final RelayRequestSigner signer;
    private final Web3Service web3Service;
    private final int blocksIntoFuture;
    private final AtomicLong requestIds = new AtomicLong();

    public RelayBundleClient(String name, String url, OkHttpClient httpClient, ObjectMapper objectMapper,
                             RelayRequestSigner signer, Web3Service web3Service,
                             Duration simulationTimeout, Duration submitTimeout, int blocksIntoFuture) {
        this.name = name;
        this.url = url;
        this.simulationClient = httpClient.newBuilder().callTimeout(simulationTimeout).build();
        this.submitClient = httpClient.newBuilder().callTimeout(submitTimeout).build();
        this.objectMapper = objectMapper;
        this.signer = signer;
        this.web3Service = web3Service;
        this.blocksIntoFuture = blocksIntoFuture;
    }

    /**
     * Relay name derived from its endpoint: host, port when explicit, and path. Two endpoints on the
     * same host stay distinguishable.
     */
    public static String nameFor(String url) {
        URI uri = URI.create(url);
        String path = uri.getPath() == null ? "" : uri.getPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String authority = uri.getPort() < 0 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
        return authority + path;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Bundle build(List<TransactionRequest> transactions, long targetBlock, double nativeToProfitRate) {
        if (transactions == null || transactions.isEmpty()) {
            throw new IllegalArgumentException("A bundle needs at least one transaction");
        }
        return Bundle.builder()
                .id(UUID.randomUUID().toString())
                .transactions(List.copyOf(transactions))
                .targetBlock(targetBlock)
                .nativeToProfitRate(nativeToProfitRate)
                .build();
    }

    @Override
    public SimulationResult simulate(Bundle bundle) {
        requireSigned(bundle);
        ObjectNode params = objectMapper.createObjectNode();
        params.set("txs", rawTransactions(bundle));
        params.put("blockNumber", Numeric.encodeQuantity(BigInteger.valueOf(bundle.getTargetBlock())));
        params.put("stateBlockNumber", "latest");

        JsonNode result;
        try {
            result = call(simulationClient, "eth_callBundle", params);
        } catch (TransientRelayException e) {
            throw e;
        } catch (RelayException e) {
            log.info("[RELAY] {} rejected simulation of bundle {}: {}", name, bundle.getId(), e.getMessage());
            return SimulationResult.failed(e.getMessage());
        }
        return parseSimulation(bundle, result);
    }

    @Override
    public SubmissionHandle submit(Bundle bundle) {
        requireSigned(bundle);
        String bundleHash = null;
        long first = bundle.getTargetBlock();
        long last = first + Math.max(1, blocksIntoFuture) - 1;

        // the relay keys bundles by block, so the same bundle is sent once for every block in the window
        for (long block = first; block <= last; block++) {
            ObjectNode params = objectMapper.createObjectNode();
            params.set("txs", rawTransactions(bundle));
            params.put("blockNumber", Numeric.encodeQuantity(BigInteger.valueOf(block)));
            JsonNode result = call(submitClient, "eth_sendBundle", params);
            if (bundleHash == null && result != null && result.hasNonNull("bundleHash")) {
                bundleHash = result.get("bundleHash").asText();
            }
        }

        List<String> txHashes = bundle.getTransactions().stream().map(TransactionRequest::getHash).toList();
        log.info("[RELAY] Bundle {} sent to {} for blocks {}..{} (hash {})", bundle.getId(), name, first, last, bundleHash);
        return SubmissionHandle.builder()
                .bundleHash(bundleHash)
                .relay(name)
                .firstTargetBlock(first)
                .lastTargetBlock(last)
                .transactionHashes(txHashes)
                .build();
    }

    @Override
    public BundleStatus status(SubmissionHandle handle) {
        if (!handle.getTransactionHashes().isEmpty()) {
            try {
                Optional<Long> mined = web3Service.receiptBlock(handle.getTransactionHashes().get(0));
                if (mined.isPresent()) {
                    return BundleStatus.included(mined.get());
                }
            } catch (ChainAccessException e) {
                log.warn("[RELAY] Receipt lookup failed, falling back to relay stats: {}", e.getMessage());
            }
        }
        if (handle.getBundleHash() == null) {
            return BundleStatus.pending();
        }

        ObjectNode params = objectMapper.createObjectNode();
        params.put("bundleHash", handle.getBundleHash());
        params.put("blockNumber", Numeric.encodeQuantity(BigInteger.valueOf(handle.getFirstTargetBlock())));
        try {
            JsonNode stats = call(simulationClient, "flashbots_getBundleStatsV2", params);
            log.debug("[RELAY] Stats for {}: {}", handle.getBundleHash(), stats);
            return BundleStatus.pending();
        } catch (TransientRelayException e) {
            throw e;
        } catch (RelayException e) {
            return BundleStatus.rejected(e.getMessage());
        }
    }

    private SimulationResult parseSimulation(Bundle bundle, JsonNode result) {
        if (result == null || !result.has("results")) {
            return SimulationResult.failed("Relay returned no simulation results");
        }

        JsonNode results = result.get("results");
        Map<String, BigInteger> deltas = new HashMap<>();
        List<TransactionRequest> txs = bundle.getTransactions();
        for (int i = 0; i < results.size(); i++) {
            JsonNode txResult = results.get(i);
            String error = textOrNull(txResult, "error");
            if (error == null) {
                error = textOrNull(txResult, "revert");
            }
            if (error != null) {
                return SimulationResult.failed("Transaction " + i + " failed: " + error);
            }
            Token profitToken = i < txs.size() ? txs.get(i).getProfitToken() : null;
            String value = textOrNull(txResult, "value");
            if (profitToken != null && value != null && value.length() > 2) {
                deltas.merge(profitToken.getAddress(), Numeric.toBigInt(value), BigInteger::add);
            }
        }

        long gasUsed = result.path("totalGasUsed").asLong();
        BigInteger gasFees = parseBigInteger(result.path("gasFees").asText("0"));

        Token profitToken = bundle.profitToken();
        double profit = profitToken == null ? 0.0
                : profitToken.toUnits(deltas.getOrDefault(profitToken.getAddress(), BigInteger.ZERO));
        double gasInNative = new BigDecimal(gasFees).divide(WEI_PER_NATIVE).doubleValue();
        double netProfit = profit - gasInNative * bundle.getNativeToProfitRate();

        return SimulationResult.builder()
                .success(true)
                .balanceDeltas(Map.copyOf(deltas))
                .gasUsed(gasUsed)
                .gasFeesWei(gasFees)
                .netProfit(netProfit)
                .build();
    }

    /**
     * Sends one signed JSON-RPC request.
     *
     * @return the {@code result} node
     */
    JsonNode call(OkHttpClient client, String method, JsonNode params) {
        String body;
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("jsonrpc", "2.0");
            payload.put("id", requestIds.incrementAndGet());
            payload.put("method", method);
            ArrayNode paramArray = payload.putArray("params");
            paramArray.add(params);
            body = objectMapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new RelayException("Could not serialise " + method, e);
        }

        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(body, JSON))
                .header(RelayRequestSigner.HEADER, signer.sign(body))
                .header("Accept", "application/json")
                .build();

        try (Response response = client.newCall(request).execute()) {
            String responseBody = response.body() != null ? response.body().string() : "";
            if (response.code() == 429 || response.code() >= 500) {
                throw new TransientRelayException(name + " " + method + " returned HTTP " + response.code(), response.code());
            }
            if (!response.isSuccessful()) {
                throw new RelayException(name + " " + method + " returned HTTP " + response.code() + ": " + responseBody,
                        response.code());
            }
            JsonNode json = objectMapper.readTree(responseBody);
            JsonNode error = json.get("error");
            if (error != null && !error.isNull()) {
                throw new RelayException(name + " " + method + " error: " + error.path("message").asText(),
                        error.path("code").asInt());
            }
            return json.get("result");
        } catch (ConnectException | SocketTimeoutException e) {
            throw new RelayUnavailableException(name + " unreachable for " + method, e);
        } catch (InterruptedIOException e) {
            // OkHttp reports an expired call timeout this way
            throw new RelayUnavailableException(name + " timed out on " + method, e);
        } catch (IOException e) {
            throw new TransientRelayException(name + " I/O failure on " + method, e);
        }
    }

    private ArrayNode rawTransactions(Bundle bundle) {
        ArrayNode txs = objectMapper.createArrayNode();
        bundle.rawTransactions().forEach(txs::add);
        return txs;
    }

    private static void requireSigned(Bundle bundle) {
        List<Integer> unsigned = new ArrayList<>();
        for (int i = 0; i < bundle.getTransactions().size(); i++) {
            if (!bundle.getTransactions().get(i).isSigned()) {
                unsigned.add(i);
            }
        }
        if (!unsigned.isEmpty()) {
            throw new IllegalArgumentException("Bundle " + bundle.getId() + " has unsigned transactions at " + unsigned);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static BigInteger parseBigInteger(String text) {
        if (text.startsWith("0x")) {
            return Numeric.toBigInt(text);
        }
        return new BigInteger(text);
    }
}
