package com.skinarb.arb.core;

import com.skinarb.arb.config.ArbConfig;
import com.skinarb.arb.domain.DataUnavailableException;
import com.skinarb.arb.domain.HoldTier;
import com.skinarb.arb.domain.Listing;
import com.skinarb.arb.domain.Market;
import com.skinarb.arb.domain.Quote;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a market's price search (cheapest first) into a {@link Quote}:
 * listings are bucketed by remaining trade hold, the cheapest of each bucket
 * wins, and commission-adjusted prices are derived from the market's schedule.
 */
@Component
@RequiredArgsConstructor
public class QuoteFactory {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final CommissionSchedule commissions;

    public Quote fromListings(String itemName, Market market, List<Listing> listingsCheapestFirst) {
        BigDecimal immediate = null;
        Map<HoldTier, BigDecimal> tiers = new EnumMap<>(HoldTier.class);

        for (Listing listing : listingsCheapestFirst) {
            if (!itemName.equals(listing.getItemName())) {
                continue; // searches match loosely, e.g. StatTrak variants
            }
            HoldTier tier = HoldTier.forHoldDays(listing.getTradeHoldDays());
            if (tier == HoldTier.NONE) {
                immediate = listing.getPrice();
                break;
            }
            tiers.putIfAbsent(tier, listing.getPrice());
        }

        if (immediate == null) {
            throw new DataUnavailableException(String.format(
                    "%s has no tradable listing of '%s' among %d results", market, itemName,
                    listingsCheapestFirst.size()));
        }
        // Tiers with no listing cheaper than the immediate one take the immediate price
        for (HoldTier tier : HoldTier.heldTiers()) {
            tiers.putIfAbsent(tier, immediate);
        }

        ArbConfig.Commission commission = commissions.forMarket(market);
        Map<HoldTier, BigDecimal> tiersWithCommission = new EnumMap<>(HoldTier.class);
        tiers.forEach((tier, price) -> tiersWithCommission.put(tier, withBuyCommission(price, commission, market)));

        BigDecimal sellWithCommission = immediate
                .multiply(BigDecimal.ONE.subtract(BigDecimal.valueOf(commission.totalSell()).divide(HUNDRED)))
                .setScale(market.getPriceScale(), RoundingMode.CEILING);

        return Quote.builder()
                .market(market)
                .commissionPercent(commission.totalSell())
                .buyPrice(immediate)
                .buyPriceWithCommission(withBuyCommission(immediate, commission, market))
                .buyPriceByHoldTier(tiers)
                .buyPriceByHoldTierWithCommission(tiersWithCommission)
                .sellPrice(immediate)
                .sellPriceWithCommission(sellWithCommission)
                .build();
    }

    private static BigDecimal withBuyCommission(BigDecimal price, ArbConfig.Commission commission, Market market) {
        BigDecimal keptShare = BigDecimal.valueOf(100 - commission.getBuy()).divide(HUNDRED);
        if (keptShare.signum() <= 0) {
            throw new DataUnavailableException(market + " buy commission of " + commission.getBuy() + "% is unusable");
        }
        return price.divide(keptShare, MathContext.DECIMAL64).setScale(market.getPriceScale(), RoundingMode.CEILING);
    }
}
