package com.skinarb.arb.domain;

import lombok.Data;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A tradable good identified by its market hash name, with the latest quote per
 * market, the physical instances held and the completed trades.
 * <p>
 * Instances of this class are mutated only inside {@code ItemStore}'s per-key
 * compute; everything else works on {@link #copy()}s.
 */
@Data
public class Item {
    private final String name;
    private ItemCount count = new ItemCount();
    private List<Quote> quotes = List.of(); // immutable, replaced wholesale
    private List<ItemData> instances = new ArrayList<>();
    private List<ItemHistory> history = new ArrayList<>();

    public Optional<Quote> quoteFor(Market market) {
        return quotes.stream().filter(q -> q.getMarket() == market).findFirst();
    }

    /** Replace this market's quote, keeping quotes in market declaration order. */
    public void putQuote(Quote quote) {
        List<Quote> updated = new ArrayList<>(quotes.size() + 1);
        for (Quote existing : quotes) {
            if (existing.getMarket() != quote.getMarket()) {
                updated.add(existing);
            }
        }
        updated.add(quote);
        updated.sort(Comparator.comparing(Quote::getMarket));
        this.quotes = List.copyOf(updated);
    }

    public Optional<ItemData> findInstance(String assetId) {
        return instances.stream().filter(d -> assetId.equals(d.getAssetId())).findFirst();
    }

    public void reconcileCounts() {
        this.count = ItemCount.of(instances, count.getMaxCount());
    }

    public Item copy() {
        Item copy = new Item(name);
        copy.count = count.toBuilder().build();
        copy.quotes = quotes;
        List<ItemData> instanceCopies = new ArrayList<>(instances.size());
        for (ItemData data : instances) {
            instanceCopies.add(data.copy());
        }
        copy.instances = instanceCopies;
        copy.history = new ArrayList<>(history);
        return copy;
    }
}
