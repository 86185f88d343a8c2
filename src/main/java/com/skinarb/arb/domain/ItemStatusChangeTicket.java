package com.skinarb.arb.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable request to move one asset through its lifecycle. Tickets are the
 * only way an {@link ItemData}'s status changes.
 */
@Value
@Builder
@Jacksonized
public class ItemStatusChangeTicket {
    @Builder.Default
    String ticketId = UUID.randomUUID().toString();
    String assetId;
    @Singular
    Map<Market, String> listingIds; // marketplace-side ids known when the ticket was raised
    ItemStatusChange change;
    @Builder.Default
    Instant createdAt = Instant.now();

    public static ItemStatusChangeTicket of(String assetId, ItemStatusChange change) {
        return ItemStatusChangeTicket.builder().assetId(assetId).change(change).build();
    }
}
