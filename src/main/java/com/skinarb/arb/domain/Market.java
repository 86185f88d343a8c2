package com.skinarb.arb.domain;

import java.math.BigDecimal;

/**
 * Marketplaces the engine quotes and trades on.
 * Declaration order is the canonical order used for quote lists and reports.
 */
public enum Market {
    STEAM(2, false),
    DMARKET(2, true),
    MARKET_CSGO(3, true), // quotes in thousandths
    BUFF(2, false),
    CS_MONEY(2, true),
    CS_FLOAT(2, true),
    BITSKINS(2, true),
    LIS_SKINS(2, false),
    WAXPEER(2, true);

    private final int priceScale;
    private final boolean proxied;

    Market(int priceScale, boolean proxied) {
        this.priceScale = priceScale;
        this.proxied = proxied;
    }

    /** Number of decimal places the market prices in. */
    public int getPriceScale() {
        return priceScale;
    }

    public BigDecimal getPriceGranularity() {
        return BigDecimal.ONE.movePointLeft(priceScale);
    }

    /** Whether outbound traffic to this market goes through the rotating proxy pool. */
    public boolean isProxied() {
        return proxied;
    }
}
