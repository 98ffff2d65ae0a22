package io.gamestate.core.protocol;

import java.util.Objects;

/**
 * Recoverable error value returned (never thrown) by the store.
 * Serializes to JSON with Jackson.
 */
public record StoreError(String code, String message, ErrorContext context) {

    public static final String TRANSACTION_FAILED = "TRANSACTION_FAILED";

    public StoreError {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(context, "context");
    }

    public static StoreError of(String code, String message, ErrorContext context) {
        return new StoreError(code, message, context);
    }

    @Override
    public String toString() {
        return "ERR[" + code + "]: " + message;
    }
}
