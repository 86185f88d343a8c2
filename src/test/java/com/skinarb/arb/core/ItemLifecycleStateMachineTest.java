package com.skinarb.arb.core;

import com.skinarb.arb.config.ArbConfig;
import com.skinarb.arb.domain.DataUnavailableException;
import com.skinarb.arb.domain.InvalidTransitionException;
import com.skinarb.arb.domain.Item;
import com.skinarb.arb.domain.ItemData;
import com.skinarb.arb.domain.ItemHistory;
import com.skinarb.arb.domain.ItemStatus;
import com.skinarb.arb.domain.ItemStatusChange;
import com.skinarb.arb.domain.ItemStatusChangeTicket;
import com.skinarb.arb.domain.Market;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ItemLifecycleStateMachineTest {

    private static final String ITEM = "AK-47 | Redline (Field-Tested)";

    private ItemStore store;
    private InMemoryTicketLedger ledger;
    private ItemLifecycleStateMachine machine;

    @BeforeEach
    void setUp() {
        store = new ItemStore(ArbConfig.of(new ArbConfig.ConfigRoot()));
        ledger = new InMemoryTicketLedger();
        machine = new ItemLifecycleStateMachine(store, ledger);
    }

    private void register(String assetId, ItemStatus status) {
        assertTrue(machine.registerInstance(ITEM, ItemData.builder()
                .assetId(assetId)
                .status(status)
                .purchasePrice(new BigDecimal("10.00"))
                .minSalePrice(new BigDecimal("11.58"))
                .boughtMarket(Market.DMARKET)
                .build()));
    }

    private ItemStatus apply(String assetId, ItemStatusChange change) {
        return machine.applyTicket(ItemStatusChangeTicket.of(assetId, change));
    }

    @Test
    void testTradeLockDoneOnlyFromOnHold() {
        register("100", ItemStatus.ON_HOLD);

        assertEquals(ItemStatus.AVAILABLE, apply("100", ItemStatusChange.tradeLockDone()));

        InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                () -> apply("100", ItemStatusChange.tradeLockDone()));
        assertEquals(ItemStatus.AVAILABLE, e.getCurrentStatus());
        assertEquals(ItemStatus.AVAILABLE, machine.statusOf("100").orElseThrow());
        assertEquals(1, ledger.tickets("100").size());
    }

    @Test
    void testFullSellCycleMovesInstanceToHistory() {
        register("200", ItemStatus.AVAILABLE);

        apply("200", ItemStatusChange.sellOfferCreated(Market.MARKET_CSGO));
        apply("200", ItemStatusChange.sellOfferBought(Market.MARKET_CSGO));
        apply("200", ItemStatusChange.sellTradeSent(Market.MARKET_CSGO, 1716200000L));
        assertEquals(ItemStatus.SOLD,
                apply("200", ItemStatusChange.sellSuccess(Market.MARKET_CSGO, new BigDecimal("13.10"))));

        Item item = store.get(ITEM).orElseThrow();
        assertTrue(item.getInstances().isEmpty());
        assertEquals(0, item.getCount().getTotal());
        ItemHistory history = item.getHistory().get(0);
        assertEquals(new BigDecimal("13.10"), history.getPrice());
        assertEquals(new BigDecimal("10.00"), history.getPurchasePrice());
        assertEquals(Market.DMARKET, history.getBoughtMarket());
        assertEquals(Market.MARKET_CSGO, history.getSoldMarket());
        assertEquals(new BigDecimal("11.58"), history.getMinSalePrice());
        assertEquals("200", history.getAssetId());

        assertEquals(ItemStatus.SOLD, machine.statusOf("200").orElseThrow());
        assertThrows(InvalidTransitionException.class, () -> apply("200", ItemStatusChange.sellOfferRemoved()));
        // a sold asset cannot come back through inventory sync
        assertFalse(machine.registerInstance(ITEM, ItemData.builder().assetId("200").status(ItemStatus.AVAILABLE)
                .build()));
    }

    @Test
    void testListingIdRecordedAndCleared() {
        register("300", ItemStatus.AVAILABLE);

        machine.applyTicket(ItemStatusChangeTicket.builder()
                .assetId("300")
                .listingId(Market.MARKET_CSGO, "csgo-listing-1")
                .change(ItemStatusChange.sellOfferCreated(Market.MARKET_CSGO))
                .build());

        ItemData listed = store.findInstance("300").orElseThrow();
        assertTrue(listed.isListed());
        assertEquals("csgo-listing-1", listed.listingIdOn(Market.MARKET_CSGO));
        assertEquals(1, store.get(ITEM).orElseThrow().getCount().getOnOffer());

        apply("300", ItemStatusChange.sellOfferRemoved());

        ItemData unlisted = store.findInstance("300").orElseThrow();
        assertFalse(unlisted.isListed());
        assertNull(unlisted.listingIdOn(Market.MARKET_CSGO));
        assertEquals(1, store.get(ITEM).orElseThrow().getCount().getAvailable());
    }

    @Test
    void testRetiredAssetReleasesItsLock() {
        register("210", ItemStatus.ON_SELL_OFFER_WAITING_TRADE_OFFER);
        register("211", ItemStatus.AVAILABLE);
        apply("210", ItemStatusChange.sellTradeSent(Market.MARKET_CSGO, 1716200000L));
        assertEquals(2, machine.assetLockCount());

        apply("210", ItemStatusChange.sellSuccess(Market.MARKET_CSGO, new BigDecimal("12.00")));

        assertEquals(1, machine.assetLockCount());
        assertThrows(InvalidTransitionException.class, () -> apply("210", ItemStatusChange.sellOfferRemoved()));
        assertFalse(machine.registerInstance(ITEM, ItemData.builder().assetId("210")
                .status(ItemStatus.AVAILABLE).build()));
        assertEquals(1, machine.assetLockCount());
    }

    @Test
    void testRestartContinuesMatchingLog() {
        register("700", ItemStatus.BOUGHT);
        apply("700", ItemStatusChange.withdrawal());

        // same ledger, fresh in-memory state
        ItemStore restartedStore = new ItemStore(ArbConfig.of(new ArbConfig.ConfigRoot()));
        ItemLifecycleStateMachine restarted = new ItemLifecycleStateMachine(restartedStore, ledger);
        assertTrue(restarted.registerInstance(ITEM, ItemData.builder().assetId("700")
                .status(ItemStatus.ON_HOLD).build()));
        restarted.applyTicket(ItemStatusChangeTicket.of("700", ItemStatusChange.tradeLockDone()));

        assertEquals(ItemStatus.BOUGHT, ledger.initialStatus("700").orElseThrow());
        assertEquals(2, ledger.tickets("700").size());
        assertEquals(ItemStatus.AVAILABLE, restarted.replay("700"));
    }

    @Test
    void testRestartRebasesLogOnDifferentObservedStatus() {
        register("710", ItemStatus.BOUGHT);
        apply("710", ItemStatusChange.withdrawal());

        ItemStore restartedStore = new ItemStore(ArbConfig.of(new ArbConfig.ConfigRoot()));
        ItemLifecycleStateMachine restarted = new ItemLifecycleStateMachine(restartedStore, ledger);
        // the trade lock ran out while the engine was down
        assertTrue(restarted.registerInstance(ITEM, ItemData.builder().assetId("710")
                .status(ItemStatus.AVAILABLE).build()));
        ItemStatus live = restarted.applyTicket(ItemStatusChangeTicket.of("710",
                ItemStatusChange.sellOfferCreated(Market.MARKET_CSGO)));

        assertEquals(ItemStatus.ON_SELL_OFFER_WAITING_BUYER, live);
        assertEquals(live, restarted.replay("710"));
        assertEquals(ItemStatus.AVAILABLE, ledger.initialStatus("710").orElseThrow());
        assertEquals(1, ledger.tickets("710").size());
    }

    @Test
    void testSoldAssetStaysRetiredAcrossRestart() {
        register("720", ItemStatus.ON_SELL_OFFER_WAITING_TRADE);
        apply("720", ItemStatusChange.sellSuccess(Market.MARKET_CSGO, new BigDecimal("14.00")));

        ItemStore restartedStore = new ItemStore(ArbConfig.of(new ArbConfig.ConfigRoot()));
        ItemLifecycleStateMachine restarted = new ItemLifecycleStateMachine(restartedStore, ledger);

        assertEquals(ItemStatus.SOLD, restarted.statusOf("720").orElseThrow());
        assertFalse(restarted.registerInstance(ITEM, ItemData.builder().assetId("720")
                .status(ItemStatus.AVAILABLE).build()));
    }

    @Test
    void testUnknownAssetIsRejected() {
        assertThrows(DataUnavailableException.class, () -> apply("missing", ItemStatusChange.withdrawal()));
    }

    @Test
    void testReplayMatchesLiveStatus() {
        register("400", ItemStatus.ON_BUY_OFFER_WAITING_SELLER);

        apply("400", ItemStatusChange.buyStart(Market.LIS_SKINS));
        apply("400", ItemStatusChange.buySuccess(Market.LIS_SKINS));
        assertThrows(InvalidTransitionException.class, () -> apply("400", ItemStatusChange.tradeLockDone()));
        apply("400", ItemStatusChange.withdrawal());

        assertEquals(ItemStatus.ON_HOLD, machine.statusOf("400").orElseThrow());
        assertEquals(machine.statusOf("400").orElseThrow(), machine.replay("400"));
        assertEquals(3, ledger.tickets("400").size());
    }

    @Test
    void testConcurrentDuplicateTicketsApplyOnce() throws Exception {
        register("500", ItemStatus.ON_HOLD);
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger applied = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    apply("500", ItemStatusChange.tradeLockDone());
                    applied.incrementAndGet();
                } catch (InvalidTransitionException e) {
                    rejected.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(1, applied.get());
        assertEquals(threads - 1, rejected.get());
        assertEquals(ItemStatus.AVAILABLE, machine.statusOf("500").orElseThrow());
        assertEquals(1, ledger.tickets("500").size());
    }

    @Test
    void testParallelAssetsKeepCountsConsistent() throws Exception {
        int assets = 40;
        for (int i = 0; i < assets; i++) {
            register("6" + i, ItemStatus.BOUGHT);
        }
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < assets; i++) {
            String assetId = "6" + i;
            futures.add(pool.submit(() -> {
                apply(assetId, ItemStatusChange.withdrawal());
                apply(assetId, ItemStatusChange.tradeLockDone());
                apply(assetId, ItemStatusChange.sellOfferCreated(Market.MARKET_CSGO));
                return null;
            }));
        }
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        Item item = store.get(ITEM).orElseThrow();
        assertEquals(assets, item.getCount().getTotal());
        assertEquals(assets, item.getCount().getOnOffer());
        for (int i = 0; i < assets; i++) {
            assertEquals(ItemStatus.ON_SELL_OFFER_WAITING_BUYER, machine.replay("6" + i));
        }
    }
}
