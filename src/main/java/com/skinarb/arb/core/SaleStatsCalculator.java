package com.skinarb.arb.core;

import com.skinarb.arb.config.ArbConfig;
import com.skinarb.arb.domain.Market;
import com.skinarb.arb.domain.SaleHistoryEntry;
import com.skinarb.arb.domain.SaleStats;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;

/**
 * Aggregates a market's daily sale history (about a month of rows) into
 * count-weighted weekly and monthly averages.
 */
@Component
@RequiredArgsConstructor
public class SaleStatsCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final CommissionSchedule commissions;

    public SaleStats compute(String itemName, Market market, List<SaleHistoryEntry> history, LocalDate today) {
        LocalDate weekStart = today.minusDays(7);
        List<SaleHistoryEntry> weekly = history.stream()
                .filter(e -> e.getDate().isAfter(weekStart))
                .toList();

        int weeklyCount = totalCount(weekly);
        int monthlyCount = totalCount(history);
        BigDecimal weeklyAvg = weightedAverage(weekly, weeklyCount);
        BigDecimal monthlyAvg = weightedAverage(history, monthlyCount);

        ArbConfig.Commission commission = commissions.forMarket(market);
        BigDecimal weeklyAvgNet = weeklyAvg
                .multiply(BigDecimal.ONE.subtract(BigDecimal.valueOf(commission.totalSell()).divide(HUNDRED)))
                .setScale(market.getPriceScale(), RoundingMode.CEILING);

        BigDecimal change = BigDecimal.ZERO;
        if (monthlyAvg.signum() != 0) {
            change = weeklyAvg.divide(monthlyAvg, MathContext.DECIMAL64)
                    .subtract(BigDecimal.ONE)
                    .multiply(HUNDRED)
                    .setScale(2, RoundingMode.HALF_UP);
        }

        return SaleStats.builder()
                .itemName(itemName)
                .weeklyAvgPrice(weeklyAvg)
                .weeklyAvgPriceWithCommission(weeklyAvgNet)
                .weeklySaleCount(weeklyCount)
                .monthlyAvgPrice(monthlyAvg)
                .monthlySaleCount(monthlyCount)
                .weeklyPriceChangePercent(change)
                .build();
    }

    private static int totalCount(List<SaleHistoryEntry> entries) {
        int total = 0;
        for (SaleHistoryEntry entry : entries) {
            total += entry.getCount();
        }
        return total;
    }

    private static BigDecimal weightedAverage(List<SaleHistoryEntry> entries, int totalCount) {
        if (totalCount == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (SaleHistoryEntry entry : entries) {
            sum = sum.add(entry.getMinPrice().multiply(BigDecimal.valueOf(entry.getCount())));
        }
        return sum.divide(BigDecimal.valueOf(totalCount), 4, RoundingMode.HALF_UP);
    }
}
