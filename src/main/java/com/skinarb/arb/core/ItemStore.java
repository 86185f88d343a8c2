package com.skinarb.arb.core;

import com.skinarb.arb.config.ArbConfig;
import com.skinarb.arb.domain.Item;
import com.skinarb.arb.domain.ItemData;
import com.skinarb.arb.domain.Market;
import com.skinarb.arb.domain.Quote;
import com.skinarb.arb.domain.SaleStats;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Shared item-name keyed state. Every write runs inside the key's
 * {@link ConcurrentHashMap#compute}, so two markets updating the same item
 * never interleave; readers only ever get copies.
 * <p>
 * Callbacks passed to {@link #mutate} run under the key's lock and must not
 * block on I/O or touch other keys.
 */
@Component
public class ItemStore {

    private final ConcurrentHashMap<String, Item> items = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> itemNameByAsset = new ConcurrentHashMap<>();
    private final ArbConfig config;

    public ItemStore(ArbConfig config) {
        this.config = config;
    }

    public void upsertQuote(String itemName, Quote quote) {
        items.compute(itemName, (name, item) -> {
            Item target = item != null ? item : newItem(name);
            // Sale stats refresh on a slower cycle than prices, keep the last known ones
            Quote incoming = quote;
            if (!incoming.hasSaleStats()) {
                Optional<Quote> previous = target.quoteFor(quote.getMarket());
                if (previous.isPresent() && previous.get().hasSaleStats()) {
                    incoming = incoming.withSaleStats(previous.get().getSaleStats());
                }
            }
            target.putQuote(incoming);
            return target;
        });
    }

    /** Attach sale stats to the market's current quote; false when there is no quote yet. */
    public boolean attachSaleStats(String itemName, Market market, SaleStats stats) {
        boolean[] attached = new boolean[1];
        items.computeIfPresent(itemName, (name, item) -> {
            item.quoteFor(market).ifPresent(q -> {
                item.putQuote(q.withSaleStats(stats));
                attached[0] = true;
            });
            return item;
        });
        return attached[0];
    }

    /** Register a newly observed instance; false when the asset is already known. */
    public boolean registerInstance(String itemName, ItemData data) {
        if (itemNameByAsset.putIfAbsent(data.getAssetId(), itemName) != null) {
            return false;
        }
        items.compute(itemName, (name, item) -> {
            Item target = item != null ? item : newItem(name);
            target.getInstances().add(data.copy());
            target.reconcileCounts();
            return target;
        });
        return true;
    }

    /** Runs {@code mutation} on the live item under its key lock. */
    public <T> Optional<T> mutate(String itemName, Function<Item, T> mutation) {
        Object[] result = new Object[1];
        items.computeIfPresent(itemName, (name, item) -> {
            result[0] = mutation.apply(item);
            return item;
        });
        @SuppressWarnings("unchecked")
        T value = (T) result[0];
        return Optional.ofNullable(value);
    }

    /** Forget the asset index entry of a retired instance. */
    void releaseAsset(String assetId) {
        itemNameByAsset.remove(assetId);
    }

    public Optional<String> itemNameOf(String assetId) {
        return Optional.ofNullable(itemNameByAsset.get(assetId));
    }

    public Optional<ItemData> findInstance(String assetId) {
        return itemNameOf(assetId)
                .flatMap(name -> mutate(name, item -> item.findInstance(assetId).map(ItemData::copy).orElse(null)));
    }

    public Optional<Item> get(String itemName) {
        return mutate(itemName, Item::copy);
    }

    /** Register an item name with no quotes yet so it is polled. */
    public void track(String itemName) {
        items.computeIfAbsent(itemName, this::newItem);
    }

    public Set<String> itemNames() {
        return Set.copyOf(items.keySet());
    }

    /**
     * Per-item consistent copy of the whole store, name ordered. Each item is
     * copied under its own key lock, so no item is observed half-updated.
     */
    public Map<String, Item> snapshot() {
        Map<String, Item> snapshot = new TreeMap<>();
        for (String name : items.keySet()) {
            get(name).ifPresent(item -> snapshot.put(name, item));
        }
        return snapshot;
    }

    private Item newItem(String name) {
        Item item = new Item(name);
        item.getCount().setMaxCount(config.maxCountFor(name));
        return item;
    }
}
