package com.dexarb.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.math.BigInteger;

/**
 * EIP-1559 transaction descriptor. {@code signedRaw} and {@code hash} are set once the
 * transaction has been signed with the trading key.
 */
@Value
@Builder(toBuilder = true)
public class TransactionRequest {
    String to;
    String data;
    @Builder.Default
    BigInteger value = BigInteger.ZERO;
    BigInteger gasLimit;
    @With
    BigInteger maxFeePerGas;
    @With
    BigInteger maxPriorityFeePerGas;
    BigInteger nonce;
    String signedRaw;
    String hash;
    // token whose balance the call's uint256 return value reports as profit
    Token profitToken;

    public boolean isSigned() {
        return signedRaw != null;
    }
}
