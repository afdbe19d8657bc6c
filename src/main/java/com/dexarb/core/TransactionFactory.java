package com.dexarb.core;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.ArbitragePath;
import com.dexarb.domain.PoolEdge;
import com.dexarb.domain.Token;
import com.dexarb.domain.TransactionRequest;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Encodes executor contract calls. One call swaps through every pool of a cycle and reverts
 * unless at least {@code minAmountOut} of the start token comes back; its return value is the
 * realised profit in raw start-token units.
 */
@Component
public class TransactionFactory {

    static final String EXECUTE_ARBITRAGE = "executeArbitrage";

    private final String executorAddress;
    private final long baseGas;
    private final long swapGasPerHop;

    public TransactionFactory(ArbProperties properties) {
        this.executorAddress = properties.getChain().getExecutorAddress();
        this.baseGas = properties.getGas().getBaseGas();
        this.swapGasPerHop = properties.getGas().getSwapGasPerHop();
    }

    public TransactionRequest arbitrageCall(ArbitragePath path, double amountIn, double minAmountOut) {
        Token start = path.startToken();
        List<Address> pools = path.getPools().stream()
                .map(PoolEdge::getPoolAddress)
                .map(Address::new)
                .toList();
        List<Address> tokens = path.getTokens().stream()
                .map(Token::getAddress)
                .map(Address::new)
                .toList();

        // executeArbitrage(address[] pools, address[] tokens, uint256 amountIn, uint256 minAmountOut)
        Function function = new Function(
                EXECUTE_ARBITRAGE,
                Arrays.asList(
                        new DynamicArray<>(Address.class, pools),
                        new DynamicArray<>(Address.class, tokens),
                        new Uint256(start.toRaw(amountIn)),
                        new Uint256(start.toRaw(minAmountOut))),
                Collections.emptyList());

        return TransactionRequest.builder()
                .to(executorAddress)
                .data(FunctionEncoder.encode(function))
                .gasLimit(BigInteger.valueOf(baseGas + swapGasPerHop * path.hops()))
                .profitToken(start)
                .build();
    }
}
