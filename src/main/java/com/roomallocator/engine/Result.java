package com.roomallocator.engine;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an engine operation: either a value or an {@link AllocationError}
 * with a human readable message.
 *
 * @param <T> type of the success value
 */
public final class Result<T> {
    private final T value;
    private final AllocationError error;
    private final String message;

    private Result(T value, AllocationError error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> Result<T> failure(AllocationError error, String message) {
        return new Result<>(null, Objects.requireNonNull(error, "error"), message);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws NoSuchElementException if this is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new NoSuchElementException("No value present: " + error + " " + message);
        }
        return value;
    }

    public AllocationError getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return failure(error, message);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "Result{success, value=" + value + '}'
                : "Result{" + error + ", message='" + message + "'}";
    }
}
