package com.skinarb.arb.domain;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Daily aggregate of completed sales on one market. */
@Value(staticConstructor = "of")
public class SaleHistoryEntry {
    LocalDate date;
    BigDecimal minPrice;
    int count;
}
