package com.skinarb.arb.domain;

/** Root of the engine's failures. Every subclass names the item, market or asset it concerns. */
public class ArbitrageException extends RuntimeException {

    public ArbitrageException(String message) {
        super(message);
    }

    public ArbitrageException(String message, Throwable cause) {
        super(message, cause);
    }
}
