package com.skinarb.arb.core;

import com.skinarb.arb.domain.Market;
import com.skinarb.arb.domain.SaleStats;

public interface SaleStatsSource {

    Market market();

    SaleStats fetchSaleStats(String itemName);
}
