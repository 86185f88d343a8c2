package com.skinarb.arb.core;

import com.skinarb.arb.domain.ItemData;
import com.skinarb.arb.domain.ItemStatusChangeTicket;
import com.skinarb.arb.domain.Market;
import com.skinarb.arb.domain.PurchaseResult;

import java.math.BigDecimal;

/**
 * Trading operations of one market. These calls are not idempotent:
 * implementations send them once and let the caller reconcile an unknown
 * outcome through an inventory read.
 */
public interface MarketTradingGateway {

    Market market();

    /** Buy the cheapest listing at or below {@code maxPrice} with at most {@code maxHoldDays} of trade hold. */
    PurchaseResult buy(String itemName, BigDecimal maxPrice, int maxHoldDays);

    /** List the instance for sale; the returned ticket carries the listing id. */
    ItemStatusChangeTicket createSellOffer(String itemName, ItemData instance, BigDecimal price);
}
