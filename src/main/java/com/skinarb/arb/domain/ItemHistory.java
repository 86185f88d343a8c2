package com.skinarb.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/** A completed round trip of one instance. */
@Value
@Builder
public class ItemHistory {
    String assetId;
    long unixSeconds;
    BigDecimal price;
    Market boughtMarket;
    Market soldMarket;
    BigDecimal purchasePrice;
    BigDecimal minSalePrice;
}
