package com.skinarb.arb.core;

import com.skinarb.arb.config.ArbConfig;
import com.skinarb.arb.domain.ArbitrageException;
import com.skinarb.arb.domain.Quote;
import com.skinarb.arb.domain.SaleStats;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Polls every market in parallel, one task per {@link QuoteSource}, and writes
 * the quotes into the {@link ItemStore}. Network waits happen outside any
 * store lock; only the final upsert touches the item.
 */
@Slf4j
@Service
public class QuoteIngestor {

    private final List<QuoteSource> quoteSources;
    private final List<SaleStatsSource> saleStatsSources;
    private final ItemStore store;
    private final ExecutorService executor;

    public QuoteIngestor(List<QuoteSource> quoteSources, List<SaleStatsSource> saleStatsSources, ItemStore store,
            ArbConfig config) {
        this.quoteSources = quoteSources;
        this.saleStatsSources = saleStatsSources;
        this.store = store;
        this.executor = Executors.newFixedThreadPool(Math.max(1, quoteSources.size() + saleStatsSources.size()));
        config.watchlist().forEach(store::track);
    }

    @Scheduled(fixedDelayString = "${arb.ingest.interval-millis:10000}")
    public void ingestQuotes() {
        if (quoteSources.isEmpty()) {
            log.debug("No quote sources registered, nothing to ingest");
            return;
        }
        Collection<String> itemNames = new TreeSet<>(store.itemNames());
        log.info("Starting quote ingestion for {} items on {} markets...", itemNames.size(), quoteSources.size());

        List<Future<?>> tasks = new ArrayList<>();
        for (QuoteSource source : quoteSources) {
            tasks.add(executor.submit(() -> pollMarket(source, itemNames)));
        }
        awaitAll(tasks);
        log.info("Quote ingestion complete");
    }

    @Scheduled(fixedDelayString = "${arb.sale-stats.interval-millis:3600000}")
    public void refreshSaleStats() {
        if (saleStatsSources.isEmpty()) {
            return;
        }
        Collection<String> itemNames = new TreeSet<>(store.itemNames());
        List<Future<?>> tasks = new ArrayList<>();
        for (SaleStatsSource source : saleStatsSources) {
            tasks.add(executor.submit(() -> pollSaleStats(source, itemNames)));
        }
        awaitAll(tasks);
    }

    void pollMarket(QuoteSource source, Collection<String> itemNames) {
        int updated = 0;
        for (String itemName : itemNames) {
            try {
                Quote quote = source.fetch(itemName);
                store.upsertQuote(itemName, quote);
                updated++;
            } catch (QuoteFetchException e) {
                if (e.getKind() == QuoteFetchException.Kind.FATAL) {
                    log.error("[{}] Fatal quote failure, skipping the rest of this pass: {}", source.market(),
                            e.getMessage());
                    break;
                } else if (e.getKind() == QuoteFetchException.Kind.TRANSIENT) {
                    log.warn("[{}] {}", source.market(), e.getMessage());
                } else {
                    log.debug("[{}] {}", source.market(), e.getMessage());
                }
            } catch (ArbitrageException e) {
                log.warn("[{}] Failed to fetch quote for {}: {}", source.market(), itemName, e.getMessage());
            }
        }
        log.debug("[{}] Updated {}/{} quotes", source.market(), updated, itemNames.size());
    }

    void pollSaleStats(SaleStatsSource source, Collection<String> itemNames) {
        for (String itemName : itemNames) {
            try {
                SaleStats stats = source.fetchSaleStats(itemName);
                if (!store.attachSaleStats(itemName, source.market(), stats)) {
                    log.debug("[{}] No quote yet to attach sale stats of {}", source.market(), itemName);
                }
            } catch (ArbitrageException e) {
                log.warn("[{}] Failed to fetch sale stats for {}: {}", source.market(), itemName, e.getMessage());
            }
        }
    }

    private void awaitAll(List<Future<?>> tasks) {
        for (Future<?> task : tasks) {
            try {
                task.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ExecutionException e) {
                log.error("Market polling task failed", e.getCause());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
