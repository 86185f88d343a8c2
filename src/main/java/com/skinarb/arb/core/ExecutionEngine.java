package com.skinarb.arb.core;

import com.skinarb.arb.config.ArbConfig;
import com.skinarb.arb.domain.ArbitrageException;
import com.skinarb.arb.domain.ArbitrageOpportunity;
import com.skinarb.arb.domain.Item;
import com.skinarb.arb.domain.ItemData;
import com.skinarb.arb.domain.ItemStatus;
import com.skinarb.arb.domain.ItemStatusChangeTicket;
import com.skinarb.arb.domain.Market;
import com.skinarb.arb.domain.PurchaseResult;
import com.skinarb.arb.domain.Quote;
import com.skinarb.arb.infra.NetworkFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns opportunities into buys and available instances into sell offers.
 * Every status change goes through the {@link ItemLifecycleStateMachine}.
 * Markets without a {@link MarketTradingGateway} are watched only.
 */
@Slf4j
@Service
public class ExecutionEngine {

    public enum ExecutionState {
        PRE_FLIGHT_CHECK,
        BUY_SUBMITTED,
        COMPLETED,
        SKIPPED,
        RECONCILING,
        FAILED
    }

    private final Map<Market, MarketTradingGateway> gateways = new EnumMap<>(Market.class);
    private final ItemStore store;
    private final ItemLifecycleStateMachine stateMachine;
    private final InventorySynchronizer inventorySynchronizer;
    private final MaxBuyPriceCalculator maxBuyPriceCalculator;
    private final List<Market> sellMarkets;
    private final BigDecimal minProfitMargin;

    public ExecutionEngine(List<MarketTradingGateway> gateways, ItemStore store,
            ItemLifecycleStateMachine stateMachine, InventorySynchronizer inventorySynchronizer,
            MaxBuyPriceCalculator maxBuyPriceCalculator, ArbConfig config) {
        gateways.forEach(g -> this.gateways.put(g.market(), g));
        this.store = store;
        this.stateMachine = stateMachine;
        this.inventorySynchronizer = inventorySynchronizer;
        this.maxBuyPriceCalculator = maxBuyPriceCalculator;
        this.sellMarkets = List.copyOf(config.trading().getSellMarkets());
        this.minProfitMargin = BigDecimal.valueOf(config.trading().getMinProfitMargin());
        if (this.gateways.isEmpty()) {
            log.warn("No trading gateways registered. Running in WATCH-ONLY mode.");
        } else {
            log.info("Trading enabled on {}", this.gateways.keySet());
        }
    }

    public ExecutionState execute(ArbitrageOpportunity opp) {
        ExecutionState state = ExecutionState.PRE_FLIGHT_CHECK;
        log.info("[EXECUTION] {} | {} {}->{} profit {}% max buy {}", opp.getId(), opp.getItemName(),
                opp.getBuyMarket(), opp.getSellMarket(), opp.getProfitPercent(), opp.getMaxBuyPrice());

        MarketTradingGateway gateway = gateways.get(opp.getBuyMarket());
        if (gateway == null) {
            log.info("[WATCH-ONLY] No gateway for {}, not buying {}", opp.getBuyMarket(), opp.getItemName());
            return ExecutionState.SKIPPED;
        }
        Optional<Item> item = store.get(opp.getItemName());
        if (item.isPresent() && !item.get().getCount().hasRoomForMore()) {
            log.info("[EXECUTION] {} already at max count {}", opp.getItemName(),
                    item.get().getCount().getMaxCount());
            return ExecutionState.SKIPPED;
        }
        if (opp.getMaxBuyPrice() == null || opp.getMaxBuyPrice().signum() <= 0) {
            log.warn("[EXECUTION] No usable max buy price for {}", opp.getItemName());
            return ExecutionState.SKIPPED;
        }

        try {
            state = ExecutionState.BUY_SUBMITTED;
            PurchaseResult result = gateway.buy(opp.getItemName(), opp.getMaxBuyPrice(), opp.getHoldDays());
            if (result == null) {
                log.info("[EXECUTION] No listing of {} on {} at or below {}", opp.getItemName(),
                        opp.getBuyMarket(), opp.getMaxBuyPrice());
                return ExecutionState.SKIPPED;
            }
            recordPurchase(opp, result);
            state = ExecutionState.COMPLETED;
            log.info("[EXECUTION] Bought {} on {} for {}", opp.getItemName(), opp.getBuyMarket(), result.getPrice());
        } catch (NetworkFailureException e) {
            if (e.isOutcomeUnknown()) {
                log.warn("[EXECUTION] Buy of {} on {} has an unknown outcome, reconciling inventory",
                        opp.getItemName(), opp.getBuyMarket());
                inventorySynchronizer.synchronize();
                state = ExecutionState.RECONCILING;
            } else {
                log.error("[EXECUTION] Buy of {} on {} failed during state {}", opp.getItemName(),
                        opp.getBuyMarket(), state, e);
                state = ExecutionState.FAILED;
            }
        } catch (ArbitrageException e) {
            log.error("[EXECUTION] Buy of {} on {} failed during state {}", opp.getItemName(), opp.getBuyMarket(),
                    state, e);
            state = ExecutionState.FAILED;
        }
        return state;
    }

    private void recordPurchase(ArbitrageOpportunity opp, PurchaseResult result) {
        ItemData instance = result.getInstance().toBuilder()
                .status(ItemStatus.ON_BUY_OFFER_WAITING_SELLER)
                .market(opp.getBuyMarket())
                .boughtMarket(opp.getBuyMarket())
                .purchasePrice(result.getPrice())
                .minSalePrice(maxBuyPriceCalculator.minSellPrice(result.getPrice(), opp.getSellMarket(),
                        minProfitMargin))
                .build();
        if (!stateMachine.registerInstance(opp.getItemName(), instance)) {
            log.warn("[EXECUTION] Asset {} of {} is already tracked, leaving its status to inventory reconciliation",
                    instance.getAssetId(), opp.getItemName());
            return;
        }
        if (result.getTicket() != null) {
            stateMachine.applyTicket(instance.getAssetId(), result.getTicket());
        }
    }

    /**
     * List every available, unlisted instance on the first configured sell
     * market that has a gateway.
     *
     * @return number of sell offers created
     */
    public int offerAvailable() {
        Optional<MarketTradingGateway> gateway = sellMarkets.stream()
                .map(gateways::get)
                .filter(Objects::nonNull)
                .findFirst();
        if (gateway.isEmpty()) {
            log.debug("[WATCH-ONLY] No gateway for sell markets {}", sellMarkets);
            return 0;
        }

        int created = 0;
        for (Item item : store.snapshot().values()) {
            for (ItemData instance : item.getInstances()) {
                if (instance.getStatus() != ItemStatus.AVAILABLE || instance.isListed()) {
                    continue;
                }
                try {
                    if (createSellOffer(gateway.get(), item, instance)) {
                        created++;
                    }
                } catch (ArbitrageException e) {
                    log.error("[EXECUTION] Sell offer for {} asset {} failed", item.getName(),
                            instance.getAssetId(), e);
                }
            }
        }
        return created;
    }

    private boolean createSellOffer(MarketTradingGateway gateway, Item item, ItemData instance) {
        BigDecimal price = sellPrice(item, instance, gateway.market());
        if (price.signum() <= 0) {
            log.warn("[EXECUTION] No sell price for {} on {}", item.getName(), gateway.market());
            return false;
        }
        ItemStatusChangeTicket ticket = gateway.createSellOffer(item.getName(), instance, price);
        stateMachine.applyTicket(instance.getAssetId(), ticket);
        log.info("[EXECUTION] Listed {} asset {} on {} for {}", item.getName(), instance.getAssetId(),
                gateway.market(), price);
        return true;
    }

    BigDecimal sellPrice(Item item, ItemData instance, Market sellMarket) {
        BigDecimal reference = item.quoteFor(sellMarket)
                .map(ExecutionEngine::referencePrice)
                .orElse(BigDecimal.ZERO);
        BigDecimal floor = instance.getPurchasePrice() == null ? BigDecimal.ZERO
                : maxBuyPriceCalculator.minSellPrice(instance.getPurchasePrice(), sellMarket, minProfitMargin);
        return reference.max(floor);
    }

    private static BigDecimal referencePrice(Quote quote) {
        if (quote.hasSaleStats() && quote.getSaleStats().getWeeklyAvgPrice().signum() > 0) {
            return quote.getSaleStats().getWeeklyAvgPrice();
        }
        return quote.getSellPrice();
    }
}
