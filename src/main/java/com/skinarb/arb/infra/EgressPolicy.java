package com.skinarb.arb.infra;

public enum EgressPolicy {
    /** Next endpoint of the market's round-robin over the proxy pool. */
    ROTATING_PROXY,
    DIRECT
}
