package com.skinarb.arb.core;

import com.skinarb.arb.domain.ItemStatus;
import com.skinarb.arb.domain.ItemStatusChangeTicket;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryTicketLedger implements TicketLedger {

    private final ConcurrentHashMap<String, AssetLog> logs = new ConcurrentHashMap<>();

    @Override
    public void open(String assetId, ItemStatus initialStatus) {
        logs.putIfAbsent(assetId, new AssetLog(initialStatus));
    }

    @Override
    public void rebase(String assetId, ItemStatus observedStatus) {
        logs.put(assetId, new AssetLog(observedStatus));
    }

    @Override
    public void append(String assetId, ItemStatusChangeTicket ticket) {
        AssetLog log = logs.get(assetId);
        if (log == null) {
            throw new IllegalStateException("Ticket log for asset " + assetId + " was never opened");
        }
        synchronized (log) {
            log.tickets.add(ticket);
        }
    }

    @Override
    public Optional<ItemStatus> initialStatus(String assetId) {
        AssetLog log = logs.get(assetId);
        return log == null ? Optional.empty() : Optional.of(log.initialStatus);
    }

    @Override
    public List<ItemStatusChangeTicket> tickets(String assetId) {
        AssetLog log = logs.get(assetId);
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            return List.copyOf(log.tickets);
        }
    }

    @Override
    public Set<String> assetIds() {
        return Set.copyOf(logs.keySet());
    }

    private static final class AssetLog {
        private final ItemStatus initialStatus;
        private final List<ItemStatusChangeTicket> tickets = new ArrayList<>();

        private AssetLog(ItemStatus initialStatus) {
            this.initialStatus = initialStatus;
        }
    }
}
