package com.skinarb.arb.infra;

import com.skinarb.arb.config.ArbConfig;
import com.skinarb.arb.domain.Market;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin over the shared proxy pool with an independent cursor per market.
 * Marketplaces rate limit by IP, so each market walks the whole pool before
 * reusing an address.
 */
@Slf4j
@Component
public class ProxyRotator {

    private final List<ProxyEndpoint> pool;
    private final Map<Market, AtomicInteger> cursors = new EnumMap<>(Market.class);

    @Autowired
    public ProxyRotator(ArbConfig config) {
        this(parsePool(config.proxies()));
    }

    public ProxyRotator(List<ProxyEndpoint> pool) {
        this.pool = Collections.unmodifiableList(new ArrayList<>(pool));
        for (Market market : Market.values()) {
            cursors.put(market, new AtomicInteger());
        }
        log.info("Proxy pool ready with {} endpoints", this.pool.size());
    }

    /**
     * Next endpoint for the market, or empty when the market is reached directly
     * or no pool is configured.
     */
    public Optional<ProxyEndpoint> next(Market market) {
        if (!market.isProxied() || pool.isEmpty()) {
            return Optional.empty();
        }
        int size = pool.size();
        int index = cursors.get(market).getAndUpdate(i -> (i + 1) % size);
        return Optional.of(pool.get(index));
    }

    public int poolSize() {
        return pool.size();
    }

    private static List<ProxyEndpoint> parsePool(ArbConfig.Proxies proxies) {
        List<ProxyEndpoint> endpoints = new ArrayList<>();
        for (String address : proxies.getEndpoints()) {
            endpoints.add(ProxyEndpoint.parse(address, proxies.getUsername(), proxies.getPassword()));
        }
        return endpoints;
    }
}
