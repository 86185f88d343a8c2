package com.skinarb.arb.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A lifecycle event. The {@link Type} tag decides which payload fields are set;
 * the constructor rejects any other combination, so instances are always
 * well-formed whether built from a factory or read back from the ticket log.
 */
@Value
public class ItemStatusChange {

    public enum Type {
        WITHDRAWAL(false, false, false),
        TRADE_LOCK_DONE(false, false, false),
        BUY_START(true, false, false),
        BUY_SUCCESS(true, false, false),
        BUY_FAILURE(false, false, false),
        SELL_OFFER_CREATED(true, false, false),
        SELL_OFFER_REMOVED(false, false, false),
        SELL_OFFER_BOUGHT(true, false, false),
        SELL_TRADE_CANCELED(false, false, false),
        SELL_TRADE_SENT(true, true, false),
        SELL_SUCCESS(true, false, true),
        SELL_ERROR(false, true, false);

        private final boolean carriesMarket;
        private final boolean carriesTimestamp;
        private final boolean carriesPrice;

        Type(boolean carriesMarket, boolean carriesTimestamp, boolean carriesPrice) {
            this.carriesMarket = carriesMarket;
            this.carriesTimestamp = carriesTimestamp;
            this.carriesPrice = carriesPrice;
        }
    }

    Type type;
    Market market;
    Long timestamp; // unix seconds
    BigDecimal price;

    @Builder
    @Jacksonized
    private ItemStatusChange(Type type, Market market, Long timestamp, BigDecimal price) {
        this.type = Objects.requireNonNull(type, "type");
        requirePayload("market", market, type.carriesMarket);
        requirePayload("timestamp", timestamp, type.carriesTimestamp);
        requirePayload("price", price, type.carriesPrice);
        this.market = market;
        this.timestamp = timestamp;
        this.price = price;
    }

    private void requirePayload(String field, Object value, boolean expected) {
        if (expected && value == null) {
            throw new IllegalArgumentException(type + " requires " + field);
        }
        if (!expected && value != null) {
            throw new IllegalArgumentException(type + " does not carry " + field);
        }
    }

    public static ItemStatusChange withdrawal() {
        return new ItemStatusChange(Type.WITHDRAWAL, null, null, null);
    }

    public static ItemStatusChange tradeLockDone() {
        return new ItemStatusChange(Type.TRADE_LOCK_DONE, null, null, null);
    }

    public static ItemStatusChange buyStart(Market market) {
        return new ItemStatusChange(Type.BUY_START, market, null, null);
    }

    public static ItemStatusChange buySuccess(Market market) {
        return new ItemStatusChange(Type.BUY_SUCCESS, market, null, null);
    }

    public static ItemStatusChange buyFailure() {
        return new ItemStatusChange(Type.BUY_FAILURE, null, null, null);
    }

    public static ItemStatusChange sellOfferCreated(Market market) {
        return new ItemStatusChange(Type.SELL_OFFER_CREATED, market, null, null);
    }

    public static ItemStatusChange sellOfferRemoved() {
        return new ItemStatusChange(Type.SELL_OFFER_REMOVED, null, null, null);
    }

    public static ItemStatusChange sellOfferBought(Market market) {
        return new ItemStatusChange(Type.SELL_OFFER_BOUGHT, market, null, null);
    }

    public static ItemStatusChange sellTradeCanceled() {
        return new ItemStatusChange(Type.SELL_TRADE_CANCELED, null, null, null);
    }

    public static ItemStatusChange sellTradeSent(Market market, long timestamp) {
        return new ItemStatusChange(Type.SELL_TRADE_SENT, market, timestamp, null);
    }

    public static ItemStatusChange sellSuccess(Market market, BigDecimal realizedPrice) {
        return new ItemStatusChange(Type.SELL_SUCCESS, market, null, realizedPrice);
    }

    public static ItemStatusChange sellError(long timestamp) {
        return new ItemStatusChange(Type.SELL_ERROR, null, timestamp, null);
    }
}
