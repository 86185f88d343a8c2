package com.skinarb.arb.core;

import com.skinarb.arb.config.ArbConfig;
import com.skinarb.arb.domain.ArbitrageOpportunity;
import com.skinarb.arb.domain.Item;
import com.skinarb.arb.domain.Market;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.skinarb.arb.core.QuoteFixtures.buyQuote;
import static com.skinarb.arb.core.QuoteFixtures.quote;
import static com.skinarb.arb.core.QuoteFixtures.sellQuote;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ArbitrageOrchestratorTest {

    private static final String REDLINE = "AK-47 | Redline (Field-Tested)";
    private static final String ASIIMOV = "AWP | Asiimov (Field-Tested)";

    private ItemStore store;
    private ExecutionEngine executionEngine;
    private ArbitrageOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        ArbConfig.ConfigRoot root = new ArbConfig.ConfigRoot();
        root.getCommissions().put(Market.DMARKET, ArbConfig.Commission.of(0, 5, 0));
        root.getCommissions().put(Market.BITSKINS, ArbConfig.Commission.of(0, 10, 0));
        root.getCommissions().put(Market.MARKET_CSGO, ArbConfig.Commission.of(0, 5, 0));
        ArbConfig config = ArbConfig.of(root);
        store = new ItemStore(config);
        executionEngine = mock(ExecutionEngine.class);
        orchestrator = new ArbitrageOrchestrator(store, new ArbitrageComparator(), new ProfitabilitySelector(config),
                new MaxBuyPriceCalculator(new CommissionSchedule(config)), executionEngine, config);
    }

    @Test
    void testProfitableItemBecomesOpportunity() {
        store.upsertQuote(REDLINE, buyQuote(Market.DMARKET, "100", "80"));
        store.upsertQuote(REDLINE, sellQuote(Market.MARKET_CSGO, "150"));

        List<ArbitrageOpportunity> opportunities = orchestrator.detect(store.snapshot());

        assertEquals(1, opportunities.size());
        ArbitrageOpportunity opp = opportunities.get(0);
        assertEquals(REDLINE, opp.getItemName());
        assertEquals(Market.DMARKET, opp.getBuyMarket());
        assertEquals(Market.MARKET_CSGO, opp.getSellMarket());
        assertEquals(7, opp.getHoldDays());
        // 150 / 1.1
        assertEquals(new BigDecimal("136.37"), opp.getMaxBuyPrice());
        assertEquals(new BigDecimal("150"), opp.getExpectedSellPrice());
    }

    @Test
    void testThinMarginIsIgnored() {
        // 5% profit, below the 10% margin
        store.upsertQuote(ASIIMOV, quote(Market.BITSKINS, "100", "0"));
        store.upsertQuote(ASIIMOV, sellQuote(Market.MARKET_CSGO, "105"));

        assertTrue(orchestrator.detect(store.snapshot()).isEmpty());
    }

    @Test
    void testItemsWithoutSaleStatsAreIgnored() {
        store.upsertQuote(ASIIMOV, quote(Market.BITSKINS, "10", "0"));
        store.upsertQuote(ASIIMOV, quote(Market.MARKET_CSGO, "30", "30"));

        assertTrue(orchestrator.detect(store.snapshot()).isEmpty());
    }

    @Test
    void testRunLoopExecutesEachOpportunity() {
        store.upsertQuote(REDLINE, quote(Market.DMARKET, "100", "0"));
        store.upsertQuote(REDLINE, sellQuote(Market.MARKET_CSGO, "150"));
        store.upsertQuote(ASIIMOV, quote(Market.BITSKINS, "50", "0"));
        store.upsertQuote(ASIIMOV, sellQuote(Market.MARKET_CSGO, "80"));
        when(executionEngine.execute(any())).thenThrow(new IllegalStateException("boom"))
                .thenReturn(ExecutionEngine.ExecutionState.COMPLETED);

        orchestrator.runLoop();

        verify(executionEngine, times(2)).execute(any());
    }

    @Test
    void testBrokenItemDoesNotAbortScan() {
        Item broken = mock(Item.class);
        when(broken.getName()).thenReturn("broken");
        when(broken.getQuotes()).thenThrow(new IllegalStateException("corrupt"));
        store.upsertQuote(REDLINE, quote(Market.DMARKET, "100", "0"));
        store.upsertQuote(REDLINE, sellQuote(Market.MARKET_CSGO, "150"));

        Map<String, Item> snapshot = new TreeMap<>(store.snapshot());
        snapshot.put("broken", broken);

        assertEquals(1, orchestrator.detect(snapshot).size());
    }

    @Test
    void testSellLoopDelegates() {
        when(executionEngine.offerAvailable()).thenReturn(2);

        orchestrator.sellLoop();

        verify(executionEngine).offerAvailable();
    }
}
