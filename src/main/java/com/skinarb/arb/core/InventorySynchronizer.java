package com.skinarb.arb.core;

import com.skinarb.arb.config.ArbConfig;
import com.skinarb.arb.domain.ArbitrageException;
import com.skinarb.arb.domain.InvalidTransitionException;
import com.skinarb.arb.domain.ItemData;
import com.skinarb.arb.domain.ItemStatus;
import com.skinarb.arb.domain.ItemStatusChange;
import com.skinarb.arb.domain.ItemStatusChangeTicket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reconciles tracked instances with what the account actually holds: new
 * assets are registered, withdrawn purchases are moved to {@code ON_HOLD} and
 * instances whose trade lock expired get a {@code TRADE_LOCK_DONE} ticket.
 * Also the follow-up read after a non-idempotent call with an unknown outcome.
 */
@Slf4j
@Service
public class InventorySynchronizer {

    private final List<InventorySource> inventorySources;
    private final ItemLifecycleStateMachine stateMachine;
    private final ItemStore store;
    private final String account;

    public InventorySynchronizer(List<InventorySource> inventorySources, ItemLifecycleStateMachine stateMachine,
            ItemStore store, ArbConfig config) {
        this.inventorySources = inventorySources;
        this.stateMachine = stateMachine;
        this.store = store;
        this.account = config.trading().getAccount();
    }

    /** @return tickets applied during this pass */
    @Scheduled(fixedDelayString = "${arb.inventory.interval-millis:60000}")
    public synchronized List<ItemStatusChangeTicket> synchronize() {
        List<ItemStatusChangeTicket> applied = new ArrayList<>();
        for (InventorySource source : inventorySources) {
            Map<String, List<ItemData>> inventory;
            try {
                inventory = source.listInstances(account);
            } catch (ArbitrageException e) {
                log.warn("Inventory read from {} failed: {}", source.getClass().getSimpleName(), e.getMessage());
                continue;
            }
            int registered = 0;
            for (Map.Entry<String, List<ItemData>> entry : inventory.entrySet()) {
                for (ItemData observed : entry.getValue()) {
                    if (reconcile(entry.getKey(), observed, applied)) {
                        registered++;
                    }
                }
            }
            log.info("Inventory sync: {} item types, {} new instances, {} tickets applied", inventory.size(),
                    registered, applied.size());
        }
        return applied;
    }

    private boolean reconcile(String itemName, ItemData observed, List<ItemStatusChangeTicket> applied) {
        Optional<ItemData> known = store.findInstance(observed.getAssetId());
        if (known.isEmpty()) {
            return stateMachine.registerInstance(itemName, observed);
        }

        ItemStatus status = known.get().getStatus();
        boolean tradable = observed.getStatus() == ItemStatus.AVAILABLE;
        if (status == ItemStatus.BOUGHT || status == ItemStatus.BOUGHT_VIA_ALTERNATE_FLOW) {
            apply(observed.getAssetId(), ItemStatusChange.withdrawal(), applied);
            status = ItemStatus.ON_HOLD;
        }
        if (status == ItemStatus.ON_HOLD && tradable) {
            apply(observed.getAssetId(), ItemStatusChange.tradeLockDone(), applied);
        }
        return false;
    }

    private void apply(String assetId, ItemStatusChange change, List<ItemStatusChangeTicket> applied) {
        ItemStatusChangeTicket ticket = ItemStatusChangeTicket.of(assetId, change);
        try {
            stateMachine.applyTicket(ticket);
            applied.add(ticket);
        } catch (InvalidTransitionException e) {
            log.warn("Inventory reconciliation rejected: {}", e.getMessage());
        }
    }
}
