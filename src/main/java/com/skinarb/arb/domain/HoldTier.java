package com.skinarb.arb.domain;

import java.math.BigDecimal;

/**
 * Trade hold buckets in increasing hold duration, each with the premium that
 * prices in the capital locked while the item cannot be traded.
 */
public enum HoldTier {
    NONE(0, new BigDecimal("1.00")),
    TWO_DAYS(2, new BigDecimal("1.02")),
    FOUR_DAYS(4, new BigDecimal("1.04")),
    SEVEN_DAYS(7, new BigDecimal("1.07"));

    private final int days;
    private final BigDecimal premium;

    HoldTier(int days, BigDecimal premium) {
        this.days = days;
        this.premium = premium;
    }

    public int getDays() {
        return days;
    }

    public BigDecimal getPremium() {
        return premium;
    }

    /** Hold tiers that carry their own price, i.e. everything but {@link #NONE}. */
    public static HoldTier[] heldTiers() {
        return new HoldTier[] { TWO_DAYS, FOUR_DAYS, SEVEN_DAYS };
    }

    /** Bucket a listing's remaining trade hold into a tier. */
    public static HoldTier forHoldDays(int tradeHoldDays) {
        if (tradeHoldDays > 4) {
            return SEVEN_DAYS;
        } else if (tradeHoldDays > 2) {
            return FOUR_DAYS;
        } else if (tradeHoldDays >= 1) {
            return TWO_DAYS;
        }
        return NONE;
    }
}
