package com.creditledger.result;

import java.util.NoSuchElementException;

/**
 * Outcome of a ledger operation: either a value or a {@link LendingError}.
 *
 * Every mutating operation validates its preconditions up front and returns
 * the FIRST violated one. A failed result means nothing was written.
 *
 * Immutable record. Exactly one of value / error is set.
 */
public record LendingResult<T>(
    T value,              // Present on success
    LendingError error,   // Present on failure
    String message        // Human-readable detail for the failure
) {
    public LendingResult {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of value or error must be set");
        }
    }

    public static <T> LendingResult<T> ok(T value) {
        return new LendingResult<>(value, null, null);
    }

    public static <T> LendingResult<T> failure(LendingError error, String message) {
        return new LendingResult<>(null, error, message);
    }

    public boolean isOk() {
        return error == null;
    }

    public T getOrThrow() {
        if (!isOk()) {
            throw new NoSuchElementException(error + ": " + message);
        }
        return value;
    }
}
