package com.skinarb.arb.domain;

import lombok.Value;

/** Directed (buy, sell) market combination. */
@Value(staticConstructor = "of")
public class MarketPair {
    Market buyMarket;
    Market sellMarket;

    public MarketPair reversed() {
        return MarketPair.of(sellMarket, buyMarket);
    }

    @Override
    public String toString() {
        return buyMarket + "->" + sellMarket;
    }
}
