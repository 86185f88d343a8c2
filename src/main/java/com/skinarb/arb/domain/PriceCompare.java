package com.skinarb.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One directional comparison of an item between two markets: buy on
 * {@code buyQuote}'s market, sell on {@code sellQuote}'s.
 */
@Value
@Builder
public class PriceCompare {
    String itemName;
    int diffPercentBeforeComm;
    int diffPercentAfterComm;
    BigDecimal diffValueBeforeComm;
    BigDecimal diffValueAfterComm;
    Quote buyQuote;
    Quote sellQuote;

    public MarketPair getMarketPair() {
        return MarketPair.of(buyQuote.getMarket(), sellQuote.getMarket());
    }
}
