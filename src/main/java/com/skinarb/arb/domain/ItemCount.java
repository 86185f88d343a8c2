package com.skinarb.arb.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collection;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ItemCount {
    private int total;
    private int available;
    private int onOffer;
    private int onHold;
    private int inFlight; // buy offers, bought-not-withdrawn, error
    private int maxCount;

    /** Recount from the live instances; {@code total} always equals the sum of the buckets. */
    public static ItemCount of(Collection<ItemData> instances, int maxCount) {
        ItemCount count = new ItemCount();
        count.setMaxCount(maxCount);
        for (ItemData data : instances) {
            ItemStatus status = data.getStatus();
            if (status == ItemStatus.AVAILABLE) {
                count.available++;
            } else if (status.isOnSellOffer()) {
                count.onOffer++;
            } else if (status == ItemStatus.ON_HOLD) {
                count.onHold++;
            } else {
                count.inFlight++;
            }
        }
        count.total = count.available + count.onOffer + count.onHold + count.inFlight;
        return count;
    }

    /** Instances counting against the max-count cap. */
    public boolean hasRoomForMore() {
        return maxCount <= 0 || total < maxCount;
    }
}
