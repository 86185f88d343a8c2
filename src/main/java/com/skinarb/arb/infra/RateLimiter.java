package com.skinarb.arb.infra;

import com.skinarb.arb.domain.Market;

import java.util.concurrent.TimeUnit;

/**
 * Spaces requests to one market evenly at the configured rate. A caller
 * reserves the next free slot under the lock and sleeps outside it; idle time
 * earns no burst credit. A non-positive rate disables limiting.
 */
public class RateLimiter {

    private final Market market;
    private final long intervalNanos;
    private long nextFreeNanos = System.nanoTime();

    public RateLimiter(Market market, double permitsPerSecond) {
        this.market = market;
        this.intervalNanos = permitsPerSecond > 0 ? (long) (TimeUnit.SECONDS.toNanos(1) / permitsPerSecond) : 0;
    }

    /**
     * Blocks until this caller's slot comes up.
     *
     * @throws NetworkFailureException when interrupted while waiting; the request must not be sent
     */
    public void acquire() {
        if (intervalNanos == 0) {
            return;
        }
        long waitNanos = reserve(System.nanoTime());
        if (waitNanos <= 0) {
            return;
        }
        try {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkFailureException(NetworkFailureException.Kind.TRANSIENT, market,
                    "Interrupted while waiting for a " + market + " request slot", e);
        }
    }

    private synchronized long reserve(long now) {
        long slot = Math.max(nextFreeNanos, now);
        nextFreeNanos = slot + intervalNanos;
        return slot - now;
    }
}
