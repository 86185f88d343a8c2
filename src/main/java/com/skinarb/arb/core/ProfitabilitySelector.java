package com.skinarb.arb.core;

import com.skinarb.arb.config.ArbConfig;
import com.skinarb.arb.domain.HoldTier;
import com.skinarb.arb.domain.Market;
import com.skinarb.arb.domain.ProfitabilityResult;
import com.skinarb.arb.domain.Quote;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Picks the single best (buy market, sell market, trade hold) for an item.
 * <p>
 * Combinations are walked buy market first, sell market second, each in
 * configured order, and the running best only moves on strict improvement, so
 * ties resolve to the first combination in that order.
 */
@Slf4j
@Service
public class ProfitabilitySelector {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int RATIO_SCALE = 10;

    private final List<Market> buyMarkets;
    private final List<Market> sellMarkets;

    @Autowired
    public ProfitabilitySelector(ArbConfig config) {
        this(config.trading().getBuyMarkets(), config.trading().getSellMarkets());
    }

    public ProfitabilitySelector(List<Market> buyMarkets, List<Market> sellMarkets) {
        if (buyMarkets.isEmpty() || sellMarkets.isEmpty()) {
            throw new IllegalArgumentException("At least one buy and one sell market are required");
        }
        this.buyMarkets = List.copyOf(buyMarkets);
        this.sellMarkets = List.copyOf(sellMarkets);
    }

    public ProfitabilityResult mostProfitable(List<Quote> quotes, String itemName) {
        Market bestBuyMarket = buyMarkets.get(0);
        Market bestSellMarket = sellMarkets.get(0);
        BigDecimal bestProfit = BigDecimal.ZERO;
        int bestHoldDays = 0;
        boolean evaluated = false;
        boolean found = false;
        List<Market> missingSaleStats = new ArrayList<>();

        for (Market buyMarket : buyMarkets) {
            Quote buyQuote = findQuote(quotes, buyMarket);
            if (buyQuote == null) {
                continue;
            }
            for (Market sellMarket : sellMarkets) {
                Quote sellQuote = findQuote(quotes, sellMarket);
                if (sellQuote == null) {
                    continue;
                }
                if (!sellQuote.hasSaleStats()) {
                    if (!missingSaleStats.contains(sellMarket)) {
                        missingSaleStats.add(sellMarket);
                        log.warn("No sales data in sell market {} for item {}", sellMarket, itemName);
                    }
                    continue;
                }

                BestBuy bestBuy = bestBuyPrice(buyQuote);
                if (bestBuy.price.signum() == 0) {
                    log.warn("Skipping {} {}->{}: effective buy price is zero", itemName, buyMarket, sellMarket);
                    continue;
                }
                evaluated = true;

                BigDecimal avgSell = sellQuote.getSaleStats().getWeeklyAvgPriceWithCommission();
                BigDecimal profit = avgSell.divide(bestBuy.price, RATIO_SCALE, RoundingMode.HALF_UP)
                        .subtract(BigDecimal.ONE)
                        .multiply(HUNDRED);

                if (profit.compareTo(bestProfit) > 0) {
                    bestProfit = profit;
                    bestBuyMarket = buyMarket;
                    bestSellMarket = sellMarket;
                    bestHoldDays = bestBuy.tier.getDays();
                    found = true;
                }
            }
        }

        ProfitabilityResult.Outcome outcome;
        if (found) {
            outcome = ProfitabilityResult.Outcome.PROFITABLE;
        } else if (evaluated) {
            outcome = ProfitabilityResult.Outcome.NO_PROFIT;
        } else {
            outcome = ProfitabilityResult.Outcome.DATA_UNAVAILABLE;
        }

        return ProfitabilityResult.builder()
                .itemName(itemName)
                .buyMarket(bestBuyMarket)
                .sellMarket(bestSellMarket)
                .profitPercent(bestProfit)
                .holdDays(bestHoldDays)
                .outcome(outcome)
                .missingSaleStats(List.copyOf(missingSaleStats))
                .build();
    }

    /**
     * Cheapest premium-adjusted buy price across the hold tiers. Value and tier
     * are tracked together in one pass; tiers are visited shortest hold first
     * and only a strictly lower price replaces the current one.
     */
    private BestBuy bestBuyPrice(Quote buyQuote) {
        BestBuy best = null;
        for (HoldTier tier : HoldTier.values()) {
            BigDecimal effective = buyQuote.tierBuyPriceWithCommission(tier).multiply(tier.getPremium());
            if (best == null || effective.compareTo(best.price) < 0) {
                best = new BestBuy(tier, effective);
            }
        }
        return best;
    }

    private static Quote findQuote(List<Quote> quotes, Market market) {
        for (Quote quote : quotes) {
            if (quote.getMarket() == market) {
                return quote;
            }
        }
        return null;
    }

    private static final class BestBuy {
        private final HoldTier tier;
        private final BigDecimal price;

        private BestBuy(HoldTier tier, BigDecimal price) {
            this.tier = tier;
            this.price = price;
        }
    }
}
