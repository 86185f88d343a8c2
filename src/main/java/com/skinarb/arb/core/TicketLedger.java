package com.skinarb.arb.core;

import com.skinarb.arb.domain.ItemStatus;
import com.skinarb.arb.domain.ItemStatusChangeTicket;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only, per-asset ordered log of applied tickets. Replaying an asset's
 * tickets from its opening status yields its current status.
 */
public interface TicketLedger {

    /** Start the asset's log with the status it was first observed in. No-op if already open. */
    void open(String assetId, ItemStatus initialStatus);

    /**
     * Restart the asset's log from a freshly observed status, opening it if
     * absent. Replay starts from the latest baseline; earlier tickets no
     * longer count towards the current status.
     */
    void rebase(String assetId, ItemStatus observedStatus);

    void append(String assetId, ItemStatusChangeTicket ticket);

    /** Status the current baseline of the asset's log starts from. */
    Optional<ItemStatus> initialStatus(String assetId);

    /** Tickets applied since the current baseline, in application order. */
    List<ItemStatusChangeTicket> tickets(String assetId);

    Set<String> assetIds();
}
