package com.skinarb.arb.core;

import com.skinarb.arb.config.ArbConfig;
import com.skinarb.arb.domain.ArbitrageOpportunity;
import com.skinarb.arb.domain.Item;
import com.skinarb.arb.domain.MarketPair;
import com.skinarb.arb.domain.PriceCompare;
import com.skinarb.arb.domain.ProfitabilityResult;
import com.skinarb.arb.domain.Quote;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
public class ArbitrageOrchestrator {

    private final ItemStore store;
    private final ArbitrageComparator comparator;
    private final ProfitabilitySelector selector;
    private final MaxBuyPriceCalculator maxBuyPriceCalculator;
    private final ExecutionEngine executionEngine;
    private final BigDecimal minProfitMargin;

    public ArbitrageOrchestrator(ItemStore store, ArbitrageComparator comparator, ProfitabilitySelector selector,
            MaxBuyPriceCalculator maxBuyPriceCalculator, ExecutionEngine executionEngine, ArbConfig config) {
        this.store = store;
        this.comparator = comparator;
        this.selector = selector;
        this.maxBuyPriceCalculator = maxBuyPriceCalculator;
        this.executionEngine = executionEngine;
        this.minProfitMargin = BigDecimal.valueOf(config.trading().getMinProfitMargin());
    }

    @Scheduled(fixedDelayString = "${arb.detect.interval-millis:5000}")
    public void runLoop() {
        Map<String, Item> snapshot = store.snapshot();
        log.info("Arb Detector Heartbeat: Scanning {} items...", snapshot.size());

        if (log.isDebugEnabled()) {
            Map<MarketPair, List<PriceCompare>> compares = comparator.compareAll(snapshot);
            compares.forEach((pair, list) -> list.stream()
                    .filter(c -> c.getDiffPercentAfterComm() > 0)
                    .forEach(c -> log.debug("{} {}: {}% after commission ({})", pair, c.getItemName(),
                            c.getDiffPercentAfterComm(), c.getDiffValueAfterComm())));
        }

        List<ArbitrageOpportunity> opportunities = detect(snapshot);
        if (!opportunities.isEmpty()) {
            log.info("Found {} opportunities", opportunities.size());
        }
        for (ArbitrageOpportunity opp : opportunities) {
            try {
                executionEngine.execute(opp);
            } catch (Exception e) {
                log.error("Failed to execute opportunity {}", opp.getId(), e);
            }
        }
    }

    @Scheduled(fixedDelayString = "${arb.sell.interval-millis:60000}")
    public void sellLoop() {
        try {
            int listed = executionEngine.offerAvailable();
            if (listed > 0) {
                log.info("Created {} sell offers", listed);
            }
        } catch (Exception e) {
            log.error("Error while listing available instances", e);
        }
    }

    public List<ArbitrageOpportunity> detect(Map<String, Item> snapshot) {
        List<ArbitrageOpportunity> opportunities = new ArrayList<>();
        for (Item item : snapshot.values()) {
            try {
                toOpportunity(item).ifPresent(opportunities::add);
            } catch (Exception e) {
                log.error("Error evaluating {}", item.getName(), e);
            }
        }
        return opportunities;
    }

    private Optional<ArbitrageOpportunity> toOpportunity(Item item) {
        ProfitabilityResult result = selector.mostProfitable(item.getQuotes(), item.getName());
        if (!result.isProfitable() || result.getProfitPercent().compareTo(minProfitMargin) < 0) {
            return Optional.empty();
        }
        Optional<Quote> sellQuote = item.quoteFor(result.getSellMarket());
        if (sellQuote.isEmpty() || !sellQuote.get().hasSaleStats()) {
            return Optional.empty();
        }
        BigDecimal expected = sellQuote.get().getSaleStats().getWeeklyAvgPriceWithCommission();
        BigDecimal maxBuy = maxBuyPriceCalculator.maxBuyPrice(expected, result.getBuyMarket(), minProfitMargin);
        if (maxBuy.signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(ArbitrageOpportunity.builder()
                .id(UUID.randomUUID().toString())
                .itemName(item.getName())
                .buyMarket(result.getBuyMarket())
                .sellMarket(result.getSellMarket())
                .holdDays(result.getHoldDays())
                .profitPercent(result.getProfitPercent())
                .expectedSellPrice(expected)
                .maxBuyPrice(maxBuy)
                .detectedAt(Instant.now())
                .build());
    }
}
