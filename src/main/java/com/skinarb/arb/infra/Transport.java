package com.skinarb.arb.infra;

import java.io.IOException;
import java.time.Duration;

/**
 * Sends one request, once. Any received response is returned whatever its
 * status; only transport failures and timeouts throw.
 */
public interface Transport {

    TransportResponse send(TransportRequest request, ProxyEndpoint proxy, Duration timeout) throws IOException;
}
