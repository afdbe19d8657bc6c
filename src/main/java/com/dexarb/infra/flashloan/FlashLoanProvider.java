package com.dexarb.infra.flashloan;

import com.dexarb.domain.Token;
import com.dexarb.domain.TransactionRequest;

import java.util.List;

/**
 * A lending venue that can fund a whole bundle inside one atomic call.
 */
public interface FlashLoanProvider {

    String name();

    /** Fee charged for borrowing {@code amount}, in units of {@code token}. */
    double quoteFee(Token token, double amount);

    /**
     * Produces a single transaction that borrows {@code amount} of {@code token}, runs every
     * wrapped call in order and repays principal plus fee. Fee caps and nonce are left unset.
     */
    TransactionRequest wrap(List<TransactionRequest> transactions, Token token, double amount);
}
