package org.iceforge.hoard.result;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a store operation: either a value or a classified error.
 *
 * @param <T> value type on success
 */
public record OperationResult<T>(T value, ErrorKind error, String message) {

    public OperationResult {
        if (error == null && message != null) {
            throw new IllegalArgumentException("message without error kind");
        }
    }

    public static <T> OperationResult<T> ok(T value) {
        return new OperationResult<>(value, null, null);
    }

    public static <T> OperationResult<T> failure(ErrorKind error, String message) {
        return new OperationResult<>(null, Objects.requireNonNull(error, "error"),
                Objects.requireNonNullElse(message, error.wireName()));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<T> asOptional() {
        return Optional.ofNullable(value);
    }

    /** Re-types a failure so it can be propagated from a differently-typed operation. */
    public <U> OperationResult<U> propagate() {
        if (isSuccess()) {
            throw new IllegalStateException("cannot propagate a successful result");
        }
        return new OperationResult<>(null, error, message);
    }

    public <U> OperationResult<U> map(Function<? super T, ? extends U> fn) {
        return isSuccess() ? ok(fn.apply(value)) : propagate();
    }

    public T orElseThrow() {
        if (!isSuccess()) {
            throw new IllegalStateException(error.wireName() + ": " + message);
        }
        return value;
    }
}
