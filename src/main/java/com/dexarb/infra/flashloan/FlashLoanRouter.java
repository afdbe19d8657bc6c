package com.dexarb.infra.flashloan;

import com.dexarb.domain.Token;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the cheapest enabled flash-loan provider for a borrow.
 */
@Slf4j
public class FlashLoanRouter {

    private final List<FlashLoanProvider> providers;

    public FlashLoanRouter(List<FlashLoanProvider> providers) {
        this.providers = List.copyOf(providers);
        log.info("Flash loan providers enabled: {}", providers.stream().map(FlashLoanProvider::name).toList());
    }

    public Optional<FlashLoanProvider> cheapest(Token token, double amount) {
        return providers.stream()
                .min(Comparator.comparingDouble(p -> p.quoteFee(token, amount)));
    }

    public boolean isEmpty() {
        return providers.isEmpty();
    }
}
