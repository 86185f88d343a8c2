package com.skinarb.arb.core;

import com.skinarb.arb.domain.Market;
import com.skinarb.arb.domain.Quote;

/**
 * Latest price terms of an item on one market. Implementations own the
 * market's wire format and go through the resilient executor.
 */
public interface QuoteSource {

    Market market();

    /**
     * @throws QuoteFetchException classified as not found, transient or fatal
     */
    Quote fetch(String itemName);
}
