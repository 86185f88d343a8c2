package com.skinarb.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Aggregated sale history of one item on one market. Recomputed periodically,
 * never mutated.
 */
@Value
@Builder(toBuilder = true)
public class SaleStats {
    String itemName;
    BigDecimal weeklyAvgPrice;
    BigDecimal weeklyAvgPriceWithCommission;
    int weeklySaleCount;
    BigDecimal monthlyAvgPrice;
    int monthlySaleCount;
    BigDecimal weeklyPriceChangePercent; // week over month
    @Builder.Default
    BigDecimal projectedPriceNextWeek = BigDecimal.ZERO;
}
