package com.skinarb.arb.domain;

/**
 * Lifecycle state of one physical item instance.
 */
public enum ItemStatus {
    AVAILABLE,
    ON_SELL_OFFER_WAITING_BUYER,
    ON_SELL_OFFER_WAITING_TRADE_OFFER,
    ON_SELL_OFFER_WAITING_TRADE,
    SOLD,
    ON_BUY_OFFER_WAITING_SELLER,
    ON_BUY_OFFER_WAITING_TRADE_OFFER,
    ON_BUY_OFFER_WAITING_TRADE,
    BOUGHT,
    BOUGHT_VIA_ALTERNATE_FLOW,
    ERROR,
    ON_HOLD;

    public boolean isOnSellOffer() {
        return this == ON_SELL_OFFER_WAITING_BUYER
                || this == ON_SELL_OFFER_WAITING_TRADE_OFFER
                || this == ON_SELL_OFFER_WAITING_TRADE;
    }

    public boolean isOnBuyOffer() {
        return this == ON_BUY_OFFER_WAITING_SELLER
                || this == ON_BUY_OFFER_WAITING_TRADE_OFFER
                || this == ON_BUY_OFFER_WAITING_TRADE;
    }

    public boolean isTerminal() {
        return this == SOLD;
    }
}
