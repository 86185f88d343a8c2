package com.skinarb.arb.domain;

/**
 * Input needed for a decision is missing (quote, sale stats, commission
 * schedule). Means "cannot decide", never "zero".
 */
public class DataUnavailableException extends ArbitrageException {

    public DataUnavailableException(String message) {
        super(message);
    }
}
