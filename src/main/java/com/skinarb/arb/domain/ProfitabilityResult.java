package com.skinarb.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Best buy/sell combination for one item. When nothing qualifies the markets
 * are the sentinel defaults with zero profit, and {@link #outcome} tells
 * "no profit" apart from "could not decide".
 */
@Value
@Builder
public class ProfitabilityResult {

    public enum Outcome {
        PROFITABLE,
        NO_PROFIT,
        DATA_UNAVAILABLE
    }

    String itemName;
    Market buyMarket;
    Market sellMarket;
    BigDecimal profitPercent;
    int holdDays;
    Outcome outcome;
    List<Market> missingSaleStats; // sell markets skipped for lack of sale stats

    public boolean isProfitable() {
        return outcome == Outcome.PROFITABLE;
    }
}
