package com.skinarb.arb.core;

import com.skinarb.arb.domain.ArbitrageException;
import com.skinarb.arb.domain.Market;
import lombok.Getter;

@Getter
public class QuoteFetchException extends ArbitrageException {

    public enum Kind {
        NOT_FOUND,
        TRANSIENT,
        FATAL
    }

    private final Kind kind;
    private final Market market;
    private final String itemName;

    public QuoteFetchException(Kind kind, Market market, String itemName, String message, Throwable cause) {
        super(String.format("%s quote for '%s': %s", market, itemName, message), cause);
        this.kind = kind;
        this.market = market;
        this.itemName = itemName;
    }
}
