package com.skinarb.arb.infra;

import com.skinarb.arb.domain.ArbitrageException;
import com.skinarb.arb.domain.Market;
import lombok.Getter;

/**
 * An upstream call failed. {@link Kind#TRANSIENT} failures have already been
 * retried as far as the caller allowed; {@link Kind#FATAL} ones must not be.
 */
@Getter
public class NetworkFailureException extends ArbitrageException {

    public enum Kind {
        TRANSIENT,
        FATAL
    }

    private final Kind kind;
    private final Market target;
    private final int statusCode; // 0 when no response was received

    public NetworkFailureException(Kind kind, Market target, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.target = target;
        this.statusCode = 0;
    }

    public NetworkFailureException(Kind kind, Market target, int statusCode, String message) {
        super(message);
        this.kind = kind;
        this.target = target;
        this.statusCode = statusCode;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }

    /** True when no response arrived, so a non-idempotent call may or may not have happened. */
    public boolean isOutcomeUnknown() {
        return statusCode == 0;
    }
}
