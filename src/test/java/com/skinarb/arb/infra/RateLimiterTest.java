package com.skinarb.arb.infra;

import com.skinarb.arb.domain.Market;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    @Test
    void testRequestsAreSpacedAtConfiguredRate() {
        RateLimiter limiter = new RateLimiter(Market.DMARKET, 20.0);

        long start = System.nanoTime();
        for (int i = 0; i < 5; i++) {
            limiter.acquire();
        }
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        // first slot is free, the next four are 50ms apart
        assertTrue(elapsedMillis >= 180, "elapsed " + elapsedMillis + "ms");
    }

    @Test
    void testIdleTimeEarnsNoBurst() throws Exception {
        RateLimiter limiter = new RateLimiter(Market.BITSKINS, 10.0);
        limiter.acquire();
        Thread.sleep(300);

        long start = System.nanoTime();
        limiter.acquire();
        limiter.acquire();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(elapsedMillis >= 90, "elapsed " + elapsedMillis + "ms");
    }

    @Test
    void testDisabledLimiterNeverWaits() {
        RateLimiter limiter = new RateLimiter(Market.STEAM, 0);

        long start = System.nanoTime();
        Thread.currentThread().interrupt();
        try {
            for (int i = 0; i < 1000; i++) {
                limiter.acquire();
            }
        } finally {
            Thread.interrupted();
        }

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 1000);
    }

    @Test
    void testInterruptedWaitFailsForItsMarket() {
        RateLimiter limiter = new RateLimiter(Market.CS_FLOAT, 1.0);
        limiter.acquire();

        Thread.currentThread().interrupt();
        NetworkFailureException e = assertThrows(NetworkFailureException.class, limiter::acquire);

        assertEquals(Market.CS_FLOAT, e.getTarget());
        assertTrue(e.isTransient());
        // interrupt status is kept for the caller
        assertTrue(Thread.interrupted());
    }
}
