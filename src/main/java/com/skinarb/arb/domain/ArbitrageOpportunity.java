package com.skinarb.arb.domain;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
public class ArbitrageOpportunity {
    private String id;
    private String itemName;
    private Market buyMarket;
    private Market sellMarket;
    private int holdDays; // trade hold accepted on the buy side

    // Summary metrics
    private BigDecimal profitPercent;
    private BigDecimal expectedSellPrice; // weekly average, net of commission
    private BigDecimal maxBuyPrice;
    private Instant detectedAt;
}
