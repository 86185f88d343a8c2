package com.skinarb.arb.core;

import com.skinarb.arb.domain.ItemStatus;
import com.skinarb.arb.domain.ItemStatusChange;
import com.skinarb.arb.domain.Market;

import java.util.Optional;

import static com.skinarb.arb.domain.ItemStatus.*;

/**
 * The lifecycle transition table. Pure: no I/O, no state. An empty result
 * means the change is not defined from that status.
 */
public final class ItemStatusTransitions {

    private ItemStatusTransitions() {
    }

    public static Optional<ItemStatus> next(ItemStatus current, ItemStatusChange change) {
        switch (change.getType()) {
            case BUY_START:
                return when(current == ON_BUY_OFFER_WAITING_SELLER, ON_BUY_OFFER_WAITING_TRADE_OFFER);
            case BUY_SUCCESS:
                // LisSkins delivers through its own flow instead of a marketplace withdrawal
                return when(current.isOnBuyOffer(),
                        change.getMarket() == Market.LIS_SKINS ? BOUGHT_VIA_ALTERNATE_FLOW : BOUGHT);
            case BUY_FAILURE:
                return when(current.isOnBuyOffer(), ERROR);
            case WITHDRAWAL:
                return when(current == BOUGHT || current == BOUGHT_VIA_ALTERNATE_FLOW, ON_HOLD);
            case TRADE_LOCK_DONE:
                return when(current == ON_HOLD, AVAILABLE);
            case SELL_OFFER_CREATED:
                return when(current == AVAILABLE, ON_SELL_OFFER_WAITING_BUYER);
            case SELL_OFFER_REMOVED:
                return when(current == ON_SELL_OFFER_WAITING_BUYER, AVAILABLE);
            case SELL_OFFER_BOUGHT:
                return when(current == ON_SELL_OFFER_WAITING_BUYER, ON_SELL_OFFER_WAITING_TRADE_OFFER);
            case SELL_TRADE_SENT:
                return when(current == ON_SELL_OFFER_WAITING_TRADE_OFFER, ON_SELL_OFFER_WAITING_TRADE);
            case SELL_TRADE_CANCELED:
                return when(current == ON_SELL_OFFER_WAITING_TRADE_OFFER || current == ON_SELL_OFFER_WAITING_TRADE,
                        AVAILABLE);
            case SELL_SUCCESS:
                return when(current == ON_SELL_OFFER_WAITING_TRADE, SOLD);
            case SELL_ERROR:
                return when(current == ON_SELL_OFFER_WAITING_TRADE_OFFER || current == ON_SELL_OFFER_WAITING_TRADE,
                        ERROR);
            default:
                return Optional.empty();
        }
    }

    private static Optional<ItemStatus> when(boolean legal, ItemStatus target) {
        return legal ? Optional.of(target) : Optional.empty();
    }
}
