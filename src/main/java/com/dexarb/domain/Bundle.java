package com.dexarb.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Ordered, all-or-nothing group of transactions for one target block.
 */
@Value
@Builder(toBuilder = true)
public class Bundle {
    String id;
    List<TransactionRequest> transactions;
    long targetBlock;
    @Builder.Default
    double nativeToProfitRate = 1.0;

    public Bundle withTargetBlock(long block) {
        return toBuilder().targetBlock(block).build();
    }

    public TransactionRequest leadTransaction() {
        return transactions.get(0);
    }

    public Token profitToken() {
        return transactions.stream()
                .map(TransactionRequest::getProfitToken)
                .filter(t -> t != null)
                .findFirst()
                .orElse(null);
    }

    public List<String> rawTransactions() {
        return transactions.stream().map(TransactionRequest::getSignedRaw).toList();
    }
}
