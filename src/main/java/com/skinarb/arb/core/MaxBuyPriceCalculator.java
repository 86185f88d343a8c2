package com.skinarb.arb.core;

import com.skinarb.arb.config.ArbConfig;
import com.skinarb.arb.domain.DataUnavailableException;
import com.skinarb.arb.domain.Market;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Inverts a target margin into price limits. Both functions return
 * {@link BigDecimal#ZERO} when they cannot decide, so a caller never trades
 * on an unknown commission.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MaxBuyPriceCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final CommissionSchedule commissions;

    /**
     * Highest price that may be paid on {@code buyMarket} while still earning
     * {@code minProfitMargin} percent against the commission-net average sell
     * price. Rounded up to the market's price granularity.
     */
    public BigDecimal maxBuyPrice(BigDecimal avgSellPriceWithCommission, Market buyMarket,
            BigDecimal minProfitMargin) {
        ArbConfig.Commission commission;
        try {
            commission = commissions.forMarket(buyMarket);
        } catch (DataUnavailableException e) {
            log.error("Cannot get the commissions for {}: {}", buyMarket, e.getMessage());
            return BigDecimal.ZERO;
        }
        if (avgSellPriceWithCommission == null || avgSellPriceWithCommission.signum() <= 0) {
            log.warn("No usable average sell price ({}) for max buy price on {}", avgSellPriceWithCommission,
                    buyMarket);
            return BigDecimal.ZERO;
        }
        BigDecimal marginFactor = BigDecimal.ONE.add(minProfitMargin.divide(HUNDRED, MathContext.DECIMAL64));
        if (marginFactor.signum() <= 0) {
            log.error("Margin {}% leaves no positive divisor for {}", minProfitMargin, buyMarket);
            return BigDecimal.ZERO;
        }

        BigDecimal raw = avgSellPriceWithCommission.divide(marginFactor, MathContext.DECIMAL64);
        BigDecimal net = raw.subtract(raw.multiply(percent(commission.getBuy())));
        return net.setScale(buyMarket.getPriceScale(), RoundingMode.CEILING);
    }

    /**
     * Lowest listing price on {@code sellMarket} that returns
     * {@code minProfitMargin} percent over {@code purchasePrice} once the
     * market's sale commissions are taken.
     */
    public BigDecimal minSellPrice(BigDecimal purchasePrice, Market sellMarket, BigDecimal minProfitMargin) {
        ArbConfig.Commission commission;
        try {
            commission = commissions.forMarket(sellMarket);
        } catch (DataUnavailableException e) {
            log.error("Cannot get the commissions for {}: {}", sellMarket, e.getMessage());
            return BigDecimal.ZERO;
        }
        BigDecimal keptShare = BigDecimal.ONE.subtract(percent(commission.totalSell()));
        if (purchasePrice == null || purchasePrice.signum() <= 0 || keptShare.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal target = purchasePrice.multiply(BigDecimal.ONE.add(minProfitMargin.divide(HUNDRED,
                MathContext.DECIMAL64)));
        return target.divide(keptShare, MathContext.DECIMAL64)
                .setScale(sellMarket.getPriceScale(), RoundingMode.CEILING);
    }

    private static BigDecimal percent(int value) {
        return BigDecimal.valueOf(value).movePointLeft(2);
    }
}
