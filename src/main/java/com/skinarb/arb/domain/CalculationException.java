package com.skinarb.arb.domain;

/** Arithmetic that would produce garbage, e.g. dividing by a zero buy price. */
public class CalculationException extends ArbitrageException {

    public CalculationException(String message) {
        super(message);
    }
}
