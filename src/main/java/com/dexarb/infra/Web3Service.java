package com.dexarb.infra;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.TransactionRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Thin web3j facade for everything the engine reads from or signs for the chain.
 * <p>
 * Without a trading key the service runs in watch-only mode: reads work, signing is refused.
 */
@Slf4j
@Service
public class Web3Service {

    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private final Web3j web3j;
    private final Credentials credentials;
    private final long chainId;

    public Web3Service(Web3j web3j, ArbProperties properties) {
        this.web3j = web3j;
        this.chainId = properties.getChain().getChainId();

        String privateKey = properties.getChain().getTradingKey();
        if (privateKey != null && !privateKey.isEmpty()) {
            try {
                this.credentials = Credentials.create(privateKey);
            } catch (RuntimeException e) {
                throw new SigningKeyUnavailableException("Trading key could not be loaded", e);
            }
            log.info("Wallet loaded: {}", credentials.getAddress());
        } else {
            this.credentials = null;
            log.warn("No trading key provided. Execution will be in WATCH-ONLY mode.");
        }
    }

    public boolean isWatchOnly() {
        return credentials == null;
    }

    public String walletAddress() {
        return credentials != null ? credentials.getAddress() : ZERO_ADDRESS;
    }

    public long currentBlockNumber() {
        try {
            return web3j.ethBlockNumber().send().getBlockNumber().longValueExact();
        } catch (IOException e) {
            throw new ChainAccessException("eth_blockNumber failed", e);
        }
    }

    public BigInteger baseFeePerGas() {
        try {
            EthBlock.Block block = web3j.ethGetBlockByNumber(DefaultBlockParameterName.LATEST, false)
                    .send()
                    .getBlock();
            if (block == null || block.getBaseFeePerGas() == null) {
                throw new ChainAccessException("Latest block carries no base fee");
            }
            return block.getBaseFeePerGas();
        } catch (IOException e) {
            throw new ChainAccessException("eth_getBlockByNumber failed", e);
        }
    }

    public BigInteger pendingNonce() {
        requireCredentials("read the pending nonce");
        try {
            return web3j.ethGetTransactionCount(credentials.getAddress(), DefaultBlockParameterName.PENDING)
                    .send()
                    .getTransactionCount();
        } catch (IOException e) {
            throw new ChainAccessException("eth_getTransactionCount failed", e);
        }
    }

    /** ERC-20 balance of the trading wallet in raw units; zero in watch-only mode. */
    public BigInteger tokenBalance(String tokenAddress) {
        if (credentials == null) {
            return BigInteger.ZERO;
        }
        Function balanceOf = new Function(
                "balanceOf",
                List.of(new Address(credentials.getAddress())),
                List.of(new TypeReference<Uint256>() {
                }));
        String result = call(tokenAddress, FunctionEncoder.encode(balanceOf));
        @SuppressWarnings("rawtypes")
        List<Type> decoded = FunctionReturnDecoder.decode(result, balanceOf.getOutputParameters());
        if (decoded.isEmpty()) {
            return BigInteger.ZERO;
        }
        return (BigInteger) decoded.get(0).getValue();
    }

    /** Block that mined {@code txHash}, if a receipt exists yet. */
    public Optional<Long> receiptBlock(String txHash) {
        try {
            Optional<TransactionReceipt> receipt = web3j.ethGetTransactionReceipt(txHash).send().getTransactionReceipt();
            return receipt.map(r -> r.getBlockNumber().longValueExact());
        } catch (IOException e) {
            throw new ChainAccessException("eth_getTransactionReceipt failed for " + txHash, e);
        }
    }

    public String call(String to, String data) {
        try {
            EthCall response = web3j.ethCall(
                            Transaction.createEthCallTransaction(walletAddress(), to, data),
                            DefaultBlockParameterName.LATEST)
                    .send();
            if (response.hasError()) {
                throw new ChainAccessException("eth_call to " + to + " failed: " + response.getError().getMessage());
            }
            if (response.isReverted()) {
                throw new ChainAccessException("eth_call to " + to + " reverted: " + response.getRevertReason());
            }
            return response.getValue();
        } catch (IOException e) {
            throw new ChainAccessException("eth_call to " + to + " failed", e);
        }
    }

    /**
     * Signs an EIP-1559 transaction with the trading key. The nonce, gas limit and both fee caps
     * must already be set.
     */
    public TransactionRequest sign(TransactionRequest tx) {
        requireCredentials("sign transactions");
        RawTransaction raw = RawTransaction.createTransaction(
                chainId,
                tx.getNonce(),
                tx.getGasLimit(),
                tx.getTo(),
                tx.getValue(),
                tx.getData(),
                tx.getMaxPriorityFeePerGas(),
                tx.getMaxFeePerGas());
        try {
            byte[] signed = TransactionEncoder.signMessage(raw, credentials);
            String signedHex = Numeric.toHexString(signed);
            return tx.toBuilder()
                    .signedRaw(signedHex)
                    .hash(Hash.sha3(signedHex))
                    .build();
        } catch (RuntimeException e) {
            throw new SigningKeyUnavailableException("Signing with the trading key failed", e);
        }
    }

    private void requireCredentials(String action) {
        if (credentials == null) {
            throw new IllegalStateException("Cannot " + action + " in WATCH-ONLY mode");
        }
    }
}
