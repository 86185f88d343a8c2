package com.skinarb.arb.core;

import com.skinarb.arb.domain.Item;
import com.skinarb.arb.domain.MarketPair;
import com.skinarb.arb.domain.PriceCompare;
import com.skinarb.arb.domain.Quote;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Exploratory cross-market report: every item, every pair of its quotes, both
 * directions. No profitability filtering happens here.
 */
@Slf4j
@Service
public class ArbitrageComparator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public Map<MarketPair, List<PriceCompare>> compareAll(Map<String, Item> items) {
        Map<MarketPair, List<PriceCompare>> result = new LinkedHashMap<>();

        // Name order keeps the report stable between runs
        for (Map.Entry<String, Item> entry : new TreeMap<>(items).entrySet()) {
            List<Quote> quotes = entry.getValue().getQuotes();
            for (int i = 0; i < quotes.size(); i++) {
                for (int j = i + 1; j < quotes.size(); j++) {
                    // Commission and hold terms differ per market, so both directions are evaluated
                    compareDirected(entry.getKey(), quotes.get(i), quotes.get(j), result);
                    compareDirected(entry.getKey(), quotes.get(j), quotes.get(i), result);
                }
            }
        }

        log.debug("Compared {} items into {} market pairs", items.size(), result.size());
        return result;
    }

    private void compareDirected(String itemName, Quote buy, Quote sell,
            Map<MarketPair, List<PriceCompare>> result) {
        BigDecimal buyPrice = buy.getBuyPrice();
        if (buyPrice.signum() == 0) {
            log.warn("Skipping {} {}->{}: buy price is zero", itemName, buy.getMarket(), sell.getMarket());
            return;
        }

        BigDecimal sellPrice = sell.getSellPrice();
        BigDecimal sellPriceNet = sellPrice.subtract(
                sellPrice.multiply(BigDecimal.valueOf(sell.getCommissionPercent())).divide(HUNDRED));

        BigDecimal diffBefore = sellPrice.subtract(buyPrice);
        BigDecimal diffAfter = sellPriceNet.subtract(buyPrice);

        PriceCompare compare = PriceCompare.builder()
                .itemName(itemName)
                .diffPercentBeforeComm(truncatedPercent(diffBefore, buyPrice))
                .diffPercentAfterComm(truncatedPercent(diffAfter, buyPrice))
                .diffValueBeforeComm(diffBefore)
                .diffValueAfterComm(diffAfter)
                .buyQuote(buy)
                .sellQuote(sell)
                .build();

        result.computeIfAbsent(MarketPair.of(buy.getMarket(), sell.getMarket()), k -> new ArrayList<>())
                .add(compare);
    }

    private static int truncatedPercent(BigDecimal diff, BigDecimal base) {
        return diff.multiply(HUNDRED).divide(base, 0, RoundingMode.DOWN).intValue();
    }
}
