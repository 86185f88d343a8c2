package com.skinarb.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/** Outcome of a buy: the new instance, what was paid, and the ticket that moves it on. */
@Value
@Builder
public class PurchaseResult {
    ItemData instance;
    BigDecimal price;
    ItemStatusChangeTicket ticket;
}
