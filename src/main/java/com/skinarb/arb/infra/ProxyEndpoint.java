package com.skinarb.arb.infra;

import lombok.ToString;
import lombok.Value;

@Value
public class ProxyEndpoint {
    String host;
    int port;
    String username;
    @ToString.Exclude
    String password;

    /** Parses a {@code host:port} entry of the proxy pool. */
    public static ProxyEndpoint parse(String address, String username, String password) {
        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new IllegalArgumentException("Proxy address must be host:port, got '" + address + "'");
        }
        String host = address.substring(0, colon).trim();
        int port = Integer.parseInt(address.substring(colon + 1).trim());
        return new ProxyEndpoint(host, port, username, password);
    }

    public boolean hasCredentials() {
        return username != null && !username.isEmpty();
    }

    public String address() {
        return host + ":" + port;
    }
}
