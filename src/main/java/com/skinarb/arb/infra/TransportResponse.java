package com.skinarb.arb.infra;

import com.skinarb.arb.domain.Market;
import lombok.Value;

@Value
public class TransportResponse {
    int code;
    String message;
    String body;

    public boolean isSuccessful() {
        return code >= 200 && code < 300;
    }

    /**
     * Returns this response when it is 2xx, otherwise classifies it: 429 and
     * 5xx are transient, every other status (auth rejected, not found, bad
     * request) is fatal.
     */
    public TransportResponse requireSuccess(Market target) {
        if (isSuccessful()) {
            return this;
        }
        NetworkFailureException.Kind kind = (code == 429 || code >= 500)
                ? NetworkFailureException.Kind.TRANSIENT
                : NetworkFailureException.Kind.FATAL;
        throw new NetworkFailureException(kind, target, code,
                String.format("%s answered %d %s", target, code, message));
    }
}
