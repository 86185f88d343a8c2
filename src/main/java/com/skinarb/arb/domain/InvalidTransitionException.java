package com.skinarb.arb.domain;

import lombok.Getter;

/**
 * A ticket was applied to an asset in a state where its change is not defined.
 * The asset is left untouched.
 */
@Getter
public class InvalidTransitionException extends ArbitrageException {

    private final String assetId;
    private final ItemStatus currentStatus;
    private final ItemStatusChange.Type change;

    public InvalidTransitionException(String assetId, ItemStatus currentStatus, ItemStatusChange.Type change) {
        super(String.format("Asset %s: %s is not allowed from %s", assetId, change, currentStatus));
        this.assetId = assetId;
        this.currentStatus = currentStatus;
        this.change = change;
    }
}
