package com.skinarb.arb.core;

import com.skinarb.arb.config.ArbConfig;
import com.skinarb.arb.domain.DataUnavailableException;
import com.skinarb.arb.domain.Market;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Per-market commission lookup. An unconfigured market is an error, never a
 * zero commission.
 */
@Component
@RequiredArgsConstructor
public class CommissionSchedule {

    private final ArbConfig config;

    public ArbConfig.Commission forMarket(Market market) {
        ArbConfig.Commission commission = config.commissions().get(market);
        if (commission == null) {
            throw new DataUnavailableException("No commission schedule configured for " + market);
        }
        return commission;
    }
}
