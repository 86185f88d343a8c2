package com.skinarb.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One market's latest buy/sell terms for an item.
 * <p>
 * Hold-tier prices are keyed by {@link HoldTier}; a missing or zero entry means
 * the tier is unknown and callers fall back to the immediate price.
 */
@Value
public class Quote {
    Market market;
    int commissionPercent;
    BigDecimal buyPrice;
    BigDecimal buyPriceWithCommission;
    Map<HoldTier, BigDecimal> buyPriceByHoldTier;
    Map<HoldTier, BigDecimal> buyPriceByHoldTierWithCommission;
    BigDecimal sellPrice;
    BigDecimal sellPriceWithCommission;
    SaleStats saleStats; // null until stats are fetched

    @Builder(toBuilder = true)
    private Quote(Market market, int commissionPercent, BigDecimal buyPrice, BigDecimal buyPriceWithCommission,
            Map<HoldTier, BigDecimal> buyPriceByHoldTier, Map<HoldTier, BigDecimal> buyPriceByHoldTierWithCommission,
            BigDecimal sellPrice, BigDecimal sellPriceWithCommission, SaleStats saleStats) {
        this.market = Objects.requireNonNull(market, "market");
        this.commissionPercent = commissionPercent;
        this.buyPrice = requireNonNegative("buyPrice", buyPrice);
        this.buyPriceWithCommission = requireNonNegative("buyPriceWithCommission", buyPriceWithCommission);
        this.buyPriceByHoldTier = copyTiers("buyPriceByHoldTier", buyPriceByHoldTier);
        this.buyPriceByHoldTierWithCommission = copyTiers("buyPriceByHoldTierWithCommission",
                buyPriceByHoldTierWithCommission);
        this.sellPrice = requireNonNegative("sellPrice", sellPrice);
        this.sellPriceWithCommission = requireNonNegative("sellPriceWithCommission", sellPriceWithCommission);
        this.saleStats = saleStats;
    }

    /** Raw buy price of the given tier, falling back to the immediate price when unknown. */
    public BigDecimal tierBuyPrice(HoldTier tier) {
        return resolveTier(buyPriceByHoldTier, tier, buyPrice);
    }

    /** Buy price with commission of the given tier, falling back to the immediate price when unknown. */
    public BigDecimal tierBuyPriceWithCommission(HoldTier tier) {
        return resolveTier(buyPriceByHoldTierWithCommission, tier, buyPriceWithCommission);
    }

    public boolean hasSaleStats() {
        return saleStats != null;
    }

    public Quote withSaleStats(SaleStats stats) {
        return toBuilder().saleStats(stats).build();
    }

    private static BigDecimal resolveTier(Map<HoldTier, BigDecimal> tiers, HoldTier tier, BigDecimal immediate) {
        if (tier == HoldTier.NONE) {
            return immediate;
        }
        BigDecimal price = tiers.get(tier);
        if (price == null || price.signum() == 0) {
            return immediate;
        }
        return price;
    }

    private static BigDecimal requireNonNegative(String field, BigDecimal value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException(field + " must not be negative: " + value);
        }
        return value;
    }

    private static Map<HoldTier, BigDecimal> copyTiers(String field, Map<HoldTier, BigDecimal> tiers) {
        Map<HoldTier, BigDecimal> copy = new EnumMap<>(HoldTier.class);
        if (tiers != null) {
            tiers.forEach((tier, price) -> copy.put(tier, requireNonNegative(field, price)));
        }
        copy.remove(HoldTier.NONE);
        return java.util.Collections.unmodifiableMap(copy);
    }
}
