package com.skinarb.arb.domain;

import lombok.Value;

import java.math.BigDecimal;

/** A single market listing as returned by a price search. */
@Value(staticConstructor = "of")
public class Listing {
    String itemName;
    BigDecimal price;
    int tradeHoldDays;
}
