package com.skinarb.arb.core;

import com.skinarb.arb.domain.ItemData;

import java.util.List;
import java.util.Map;

/**
 * Instances currently held by an account, keyed by item name. Pagination is
 * the implementation's business; the result is the complete inventory.
 * Tradable instances are reported {@code AVAILABLE}, trade-locked ones {@code ON_HOLD}.
 */
public interface InventorySource {

    Map<String, List<ItemData>> listInstances(String account);
}
