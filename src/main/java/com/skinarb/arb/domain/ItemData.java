package com.skinarb.arb.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * One physical instance of an item. Its {@link #status} is owned by the
 * lifecycle state machine; nothing else writes it after registration.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ItemData {
    private String assetId;
    private String tradeOfferId;
    private String classId;
    private String instanceId;
    private Market market; // where the instance currently sits
    private ItemStatus status;
    @Builder.Default
    private Map<Market, String> listingIds = new EnumMap<>(Market.class);
    private Market listingMarket; // null when not listed
    private Long timestampUnix;
    private Market boughtMarket;
    private BigDecimal purchasePrice;
    private BigDecimal minSalePrice; // lowest price that still meets the margin, null when unknown

    public boolean isListed() {
        return listingMarket != null;
    }

    public String listingIdOn(Market market) {
        return listingIds == null ? null : listingIds.get(market);
    }

    public ItemData copy() {
        Map<Market, String> ids = new EnumMap<>(Market.class);
        if (listingIds != null) {
            ids.putAll(listingIds);
        }
        return toBuilder().listingIds(ids).build();
    }
}
