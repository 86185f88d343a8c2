package com.skinarb.arb.infra;

import com.skinarb.arb.domain.Market;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Every market-facing call goes through here: rate limit, next proxy of the
 * market's rotation, bounded timeout, and retry of transport failures only.
 * <p>
 * A received response is never retried, whatever its status. Idempotent reads
 * use {@link #read}; buys, withdrawals and trade accepts use
 * {@link #submitOnce} and reconcile ambiguous failures themselves.
 */
@Slf4j
@Component
public class ResilientRequestExecutor {

    private final Transport transport;
    private final ProxyRotator proxyRotator;
    private final Duration defaultTimeout;
    private final int defaultRetries;
    private final Duration backoffUnit;
    private final Map<Market, RateLimiter> rateLimiters = new EnumMap<>(Market.class);

    public ResilientRequestExecutor(Transport transport,
            ProxyRotator proxyRotator,
            @Value("${arb.http.timeout-seconds:10}") long timeoutSeconds,
            @Value("${arb.http.max-retries:3}") int defaultRetries,
            @Value("${arb.http.backoff-millis:1000}") long backoffMillis,
            @Value("${arb.http.permits-per-second:4.0}") double permitsPerSecond) {
        this.transport = transport;
        this.proxyRotator = proxyRotator;
        this.defaultTimeout = Duration.ofSeconds(timeoutSeconds);
        this.defaultRetries = defaultRetries;
        this.backoffUnit = Duration.ofMillis(backoffMillis);
        for (Market market : Market.values()) {
            rateLimiters.put(market, new RateLimiter(market, permitsPerSecond));
        }
    }

    /** Idempotent call (search, read, price lookup) with the configured retries. */
    public TransportResponse read(Market target, TransportRequest request) {
        return execute(target, request, defaultPolicy(target), defaultTimeout, defaultRetries);
    }

    /** Non-idempotent call (buy, withdraw, accept trade): exactly one attempt. */
    public TransportResponse submitOnce(Market target, TransportRequest request) {
        return execute(target, request, defaultPolicy(target), defaultTimeout, 0);
    }

    public TransportResponse execute(Market target, TransportRequest request, EgressPolicy egressPolicy,
            Duration timeout, int maxRetries) {
        IOException lastError = null;
        for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
            rateLimiters.get(target).acquire();
            ProxyEndpoint proxy = egressPolicy == EgressPolicy.ROTATING_PROXY
                    ? proxyRotator.next(target).orElse(null)
                    : null;
            try {
                return transport.send(request, proxy, timeout);
            } catch (IOException e) {
                lastError = e;
                log.warn("[{}] attempt {}/{} {} {} via {} failed: {}", target, attempt, maxRetries + 1,
                        request.getMethod(), request.getUrl(), proxy != null ? proxy.address() : "direct",
                        e.toString());
                if (attempt <= maxRetries) {
                    backoff(target, attempt);
                }
            }
        }
        throw new NetworkFailureException(NetworkFailureException.Kind.TRANSIENT, target,
                String.format("%s %s to %s failed after %d attempt(s)", request.getMethod(), request.getUrl(),
                        target, maxRetries + 1),
                lastError);
    }

    private EgressPolicy defaultPolicy(Market target) {
        return target.isProxied() ? EgressPolicy.ROTATING_PROXY : EgressPolicy.DIRECT;
    }

    // Linear: the n-th retry waits n backoff units
    private void backoff(Market target, int attempt) {
        long waitMillis = backoffUnit.toMillis() * attempt;
        if (waitMillis <= 0) {
            return;
        }
        try {
            Thread.sleep(waitMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkFailureException(NetworkFailureException.Kind.TRANSIENT, target,
                    "Interrupted while backing off", e);
        }
    }
}
