package com.dexarb.infra.flashloan;

import com.dexarb.domain.Token;
import com.dexarb.domain.TransactionRequest;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Flash loans routed through the arbitrage executor contract: the executor takes the loan from
 * the lending venue, replays the wrapped calldata against itself in its callback and repays.
 */
public abstract class ExecutorFlashLoanProvider implements FlashLoanProvider {

    private final String executorAddress;
    private final long gasOverhead;

    protected ExecutorFlashLoanProvider(String executorAddress, long gasOverhead) {
        this.executorAddress = executorAddress;
        this.gasOverhead = gasOverhead;
    }

    /** Executor entry point, e.g. {@code flashArbitrageAave(address,uint256,bytes[])}. */
    protected abstract String entryPoint();

    protected abstract int feeBps();

    @Override
    public double quoteFee(Token token, double amount) {
        return amount * feeBps() / 10_000.0;
    }

    @Override
    public TransactionRequest wrap(List<TransactionRequest> transactions, Token token, double amount) {
        if (transactions.isEmpty()) {
            throw new IllegalArgumentException("Nothing to wrap");
        }
        List<DynamicBytes> calls = new ArrayList<>();
        BigInteger gasLimit = BigInteger.valueOf(gasOverhead);
        for (TransactionRequest tx : transactions) {
            if (!executorAddress.equalsIgnoreCase(tx.getTo())) {
                throw new IllegalArgumentException("Only executor calls can be wrapped, got call to " + tx.getTo());
            }
            calls.add(new DynamicBytes(Numeric.hexStringToByteArray(tx.getData())));
            gasLimit = gasLimit.add(tx.getGasLimit());
        }

        Function function = new Function(
                entryPoint(),
                Arrays.asList(
                        new Address(token.getAddress()),
                        new Uint256(token.toRaw(amount)),
                        new DynamicArray<>(DynamicBytes.class, calls)),
                Collections.emptyList());

        return TransactionRequest.builder()
                .to(executorAddress)
                .data(FunctionEncoder.encode(function))
                .gasLimit(gasLimit)
                .profitToken(token)
                .build();
    }
}
