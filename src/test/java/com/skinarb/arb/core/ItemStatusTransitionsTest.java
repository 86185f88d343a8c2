package com.skinarb.arb.core;

import com.skinarb.arb.domain.ItemStatus;
import com.skinarb.arb.domain.ItemStatusChange;
import com.skinarb.arb.domain.Market;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ItemStatusTransitionsTest {

    @Test
    void testBuyPath() {
        assertEquals(Optional.of(ItemStatus.ON_BUY_OFFER_WAITING_TRADE_OFFER), ItemStatusTransitions.next(
                ItemStatus.ON_BUY_OFFER_WAITING_SELLER, ItemStatusChange.buyStart(Market.DMARKET)));
        assertEquals(Optional.of(ItemStatus.BOUGHT), ItemStatusTransitions.next(
                ItemStatus.ON_BUY_OFFER_WAITING_TRADE_OFFER, ItemStatusChange.buySuccess(Market.DMARKET)));
        assertEquals(Optional.of(ItemStatus.BOUGHT_VIA_ALTERNATE_FLOW), ItemStatusTransitions.next(
                ItemStatus.ON_BUY_OFFER_WAITING_SELLER, ItemStatusChange.buySuccess(Market.LIS_SKINS)));
        assertEquals(Optional.of(ItemStatus.ON_HOLD), ItemStatusTransitions.next(
                ItemStatus.BOUGHT_VIA_ALTERNATE_FLOW, ItemStatusChange.withdrawal()));
        assertEquals(Optional.of(ItemStatus.AVAILABLE), ItemStatusTransitions.next(
                ItemStatus.ON_HOLD, ItemStatusChange.tradeLockDone()));
    }

    @Test
    void testSellPath() {
        assertEquals(Optional.of(ItemStatus.ON_SELL_OFFER_WAITING_BUYER), ItemStatusTransitions.next(
                ItemStatus.AVAILABLE, ItemStatusChange.sellOfferCreated(Market.MARKET_CSGO)));
        assertEquals(Optional.of(ItemStatus.ON_SELL_OFFER_WAITING_TRADE_OFFER), ItemStatusTransitions.next(
                ItemStatus.ON_SELL_OFFER_WAITING_BUYER, ItemStatusChange.sellOfferBought(Market.MARKET_CSGO)));
        assertEquals(Optional.of(ItemStatus.ON_SELL_OFFER_WAITING_TRADE), ItemStatusTransitions.next(
                ItemStatus.ON_SELL_OFFER_WAITING_TRADE_OFFER,
                ItemStatusChange.sellTradeSent(Market.MARKET_CSGO, 1716200000L)));
        assertEquals(Optional.of(ItemStatus.SOLD), ItemStatusTransitions.next(
                ItemStatus.ON_SELL_OFFER_WAITING_TRADE,
                ItemStatusChange.sellSuccess(Market.MARKET_CSGO, new BigDecimal("12.5"))));
    }

    @Test
    void testCancelAndErrorBranches() {
        assertEquals(Optional.of(ItemStatus.AVAILABLE), ItemStatusTransitions.next(
                ItemStatus.ON_SELL_OFFER_WAITING_BUYER, ItemStatusChange.sellOfferRemoved()));
        assertEquals(Optional.of(ItemStatus.AVAILABLE), ItemStatusTransitions.next(
                ItemStatus.ON_SELL_OFFER_WAITING_TRADE, ItemStatusChange.sellTradeCanceled()));
        assertEquals(Optional.of(ItemStatus.ERROR), ItemStatusTransitions.next(
                ItemStatus.ON_SELL_OFFER_WAITING_TRADE_OFFER, ItemStatusChange.sellError(1716200000L)));
        assertEquals(Optional.of(ItemStatus.ERROR), ItemStatusTransitions.next(
                ItemStatus.ON_BUY_OFFER_WAITING_TRADE, ItemStatusChange.buyFailure()));
    }

    @Test
    void testUndefinedTransitionsAreEmpty() {
        assertTrue(ItemStatusTransitions.next(ItemStatus.AVAILABLE, ItemStatusChange.tradeLockDone()).isEmpty());
        assertTrue(ItemStatusTransitions.next(ItemStatus.SOLD, ItemStatusChange.sellOfferRemoved()).isEmpty());
        assertTrue(ItemStatusTransitions.next(ItemStatus.ON_HOLD,
                ItemStatusChange.sellOfferCreated(Market.MARKET_CSGO)).isEmpty());
        assertTrue(ItemStatusTransitions.next(ItemStatus.BOUGHT, ItemStatusChange.buyFailure()).isEmpty());
        assertTrue(ItemStatusTransitions.next(ItemStatus.ON_SELL_OFFER_WAITING_BUYER,
                ItemStatusChange.sellError(1L)).isEmpty());
    }

    @Test
    void testErrorOnlyFromFailures() {
        for (ItemStatus from : ItemStatus.values()) {
            for (ItemStatusChange change : new ItemStatusChange[] {
                    ItemStatusChange.withdrawal(), ItemStatusChange.tradeLockDone(),
                    ItemStatusChange.buyStart(Market.DMARKET), ItemStatusChange.buySuccess(Market.DMARKET),
                    ItemStatusChange.sellOfferCreated(Market.DMARKET), ItemStatusChange.sellOfferRemoved(),
                    ItemStatusChange.sellOfferBought(Market.DMARKET), ItemStatusChange.sellTradeCanceled(),
                    ItemStatusChange.sellTradeSent(Market.DMARKET, 1L),
                    ItemStatusChange.sellSuccess(Market.DMARKET, BigDecimal.ONE) }) {
                assertNotEquals(Optional.of(ItemStatus.ERROR), ItemStatusTransitions.next(from, change),
                        from + " with " + change.getType());
            }
        }
    }
}
