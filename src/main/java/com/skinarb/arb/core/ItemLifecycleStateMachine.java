package com.skinarb.arb.core;

import com.skinarb.arb.domain.DataUnavailableException;
import com.skinarb.arb.domain.InvalidTransitionException;
import com.skinarb.arb.domain.Item;
import com.skinarb.arb.domain.ItemData;
import com.skinarb.arb.domain.ItemHistory;
import com.skinarb.arb.domain.ItemStatus;
import com.skinarb.arb.domain.ItemStatusChange;
import com.skinarb.arb.domain.ItemStatusChangeTicket;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns every instance's status. Tickets for one asset are applied one at a
 * time in arrival order (fair per-asset lock); different assets proceed in
 * parallel. A rejected ticket leaves both the instance and the ledger as they
 * were. Retired assets are known from the ledger alone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ItemLifecycleStateMachine {

    private final ItemStore store;
    private final TicketLedger ledger;

    private final ConcurrentHashMap<String, ReentrantLock> assetLocks = new ConcurrentHashMap<>();

    /**
     * Start tracking an instance in the status it was observed in. An asset
     * that already has a ticket log (from before a restart) continues it when
     * the log replays to the observed status, otherwise the log is rebased.
     *
     * @return false when the asset is already tracked or was retired
     */
    public boolean registerInstance(String itemName, ItemData data) {
        String assetId = data.getAssetId();
        ReentrantLock lock = lockFor(assetId);
        lock.lock();
        try {
            if (store.itemNameOf(assetId).isEmpty() && retiredStatus(assetId).isPresent()) {
                assetLocks.remove(assetId, lock);
                return false;
            }
            if (!store.registerInstance(itemName, data)) {
                return false;
            }
            baseline(assetId, data.getStatus());
            log.info("[LIFECYCLE] Tracking {} asset {} as {}", itemName, assetId, data.getStatus());
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void baseline(String assetId, ItemStatus observed) {
        if (ledger.initialStatus(assetId).isEmpty()) {
            ledger.open(assetId, observed);
            return;
        }
        Optional<ItemStatus> logged = loggedStatus(assetId);
        if (logged.isPresent() && logged.get() == observed) {
            return;
        }
        log.info("[LIFECYCLE] Asset {} logged as {} but observed {}, rebasing its ticket log", assetId,
                logged.map(Enum::name).orElse("unreplayable"), observed);
        ledger.rebase(assetId, observed);
    }

    public ItemStatus applyTicket(ItemStatusChangeTicket ticket) {
        return applyTicket(ticket.getAssetId(), ticket);
    }

    /**
     * Apply one ticket.
     *
     * @return the asset's new status
     * @throws InvalidTransitionException when the change is not defined from the current status
     * @throws DataUnavailableException   when the asset is not tracked
     */
    public ItemStatus applyTicket(String assetId, ItemStatusChangeTicket ticket) {
        ItemStatusChange change = ticket.getChange();
        ReentrantLock lock = lockFor(assetId);
        lock.lock();
        try {
            Optional<String> tracked = store.itemNameOf(assetId);
            if (tracked.isEmpty()) {
                assetLocks.remove(assetId, lock);
                Optional<ItemStatus> retiredStatus = retiredStatus(assetId);
                if (retiredStatus.isPresent()) {
                    throw new InvalidTransitionException(assetId, retiredStatus.get(), change.getType());
                }
                throw new DataUnavailableException("Unknown asset " + assetId);
            }
            String itemName = tracked.get();
            ItemData current = store.findInstance(assetId)
                    .orElseThrow(() -> new DataUnavailableException("Unknown asset " + assetId));

            ItemStatus from = current.getStatus();
            ItemStatus to = ItemStatusTransitions.next(from, change)
                    .orElseThrow(() -> new InvalidTransitionException(assetId, from, change.getType()));

            ledger.append(assetId, ticket);
            store.mutate(itemName, item -> {
                applyEffects(item, assetId, ticket, to);
                return to;
            });

            if (to.isTerminal()) {
                // the ledger remembers retired assets, the lock is no longer needed
                store.releaseAsset(assetId);
                assetLocks.remove(assetId, lock);
            }
            log.info("[LIFECYCLE] {} asset {}: {} --{}--> {}", itemName, assetId, from, change.getType(), to);
            return to;
        } finally {
            lock.unlock();
        }
    }

    /** Current status of a tracked or retired asset. */
    public Optional<ItemStatus> statusOf(String assetId) {
        Optional<ItemStatus> live = store.findInstance(assetId).map(ItemData::getStatus);
        return live.isPresent() ? live : retiredStatus(assetId);
    }

    /**
     * Fold the asset's ticket log from its current baseline through the
     * transition table.
     */
    public ItemStatus replay(String assetId) {
        ItemStatus status = ledger.initialStatus(assetId)
                .orElseThrow(() -> new DataUnavailableException("No ticket log for asset " + assetId));
        for (ItemStatusChangeTicket ticket : ledger.tickets(assetId)) {
            ItemStatus from = status;
            status = ItemStatusTransitions.next(from, ticket.getChange())
                    .orElseThrow(() -> new InvalidTransitionException(assetId, from, ticket.getChange().getType()));
        }
        return status;
    }

    private Optional<ItemStatus> retiredStatus(String assetId) {
        return loggedStatus(assetId).filter(ItemStatus::isTerminal);
    }

    private Optional<ItemStatus> loggedStatus(String assetId) {
        if (ledger.initialStatus(assetId).isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(replay(assetId));
        } catch (InvalidTransitionException e) {
            log.warn("[LIFECYCLE] Ticket log of asset {} does not replay: {}", assetId, e.getMessage());
            return Optional.empty();
        }
    }

    int assetLockCount() {
        return assetLocks.size();
    }

    private void applyEffects(Item item, String assetId, ItemStatusChangeTicket ticket, ItemStatus to) {
        ItemStatusChange change = ticket.getChange();
        ItemData data = item.findInstance(assetId)
                .orElseThrow(() -> new IllegalStateException("Asset " + assetId + " vanished from " + item.getName()));
        data.setStatus(to);

        switch (change.getType()) {
            case BUY_START:
            case BUY_SUCCESS:
                data.setBoughtMarket(change.getMarket());
                break;
            case SELL_OFFER_CREATED:
                data.getListingIds().putAll(ticket.getListingIds());
                data.setListingMarket(change.getMarket());
                break;
            case SELL_OFFER_REMOVED:
            case SELL_TRADE_CANCELED:
                if (data.getListingMarket() != null) {
                    data.getListingIds().remove(data.getListingMarket());
                }
                data.setListingMarket(null);
                break;
            case SELL_TRADE_SENT:
            case SELL_ERROR:
                data.setTimestampUnix(change.getTimestamp());
                break;
            case SELL_SUCCESS:
                item.getHistory().add(ItemHistory.builder()
                        .assetId(assetId)
                        .unixSeconds(Instant.now().getEpochSecond())
                        .price(change.getPrice())
                        .boughtMarket(data.getBoughtMarket())
                        .soldMarket(change.getMarket())
                        .purchasePrice(data.getPurchasePrice())
                        .minSalePrice(data.getMinSalePrice())
                        .build());
                item.getInstances().remove(data);
                break;
            default:
                break;
        }
        item.reconcileCounts();
    }

    private ReentrantLock lockFor(String assetId) {
        return assetLocks.computeIfAbsent(assetId, k -> new ReentrantLock(true));
    }
}
