package me.baddcamden.runnersheet.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a ledger mutation. A failed result carries the untouched input value alongside the
 * reason, so callers can keep working with {@link #value()} either way.
 *
 * @param value   the updated value on success, the unchanged input on failure
 * @param success whether the mutation was applied
 * @param reason  failure message; {@code null} on success
 * @param <T>     value type
 */
public record Result<T>(T value, boolean success, String reason) {

    public Result {
        Objects.requireNonNull(value, "value");
        if (!success && (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException("A failed result needs a reason");
        }
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(value, true, null);
    }

    public static <T> Result<T> failure(T unchanged, String reason) {
        return new Result<>(unchanged, false, reason);
    }

    public boolean isFailure() {
        return !success;
    }

    public Optional<String> error() {
        return Optional.ofNullable(reason);
    }
}
