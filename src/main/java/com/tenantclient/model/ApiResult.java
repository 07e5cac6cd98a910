package com.tenantclient.model;

import java.util.function.Function;

/**
 * Either a successful value or a {@link ClassifiedError}. This is what crosses the client's public
 * boundary: classified failures are returned, never thrown.
 *
 * @param value The success value; {@code null} for failures.
 * @param error The classified error; {@code null} for successes.
 * @param <T>   The success type.
 */
public record ApiResult<T>(T value, ClassifiedError error) {

    public static <T> ApiResult<T> success(T value) {
        return new ApiResult<>(value, null);
    }

    public static <T> ApiResult<T> failure(ClassifiedError error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new ApiResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getOrThrow() {
        if (error != null) {
            throw new IllegalStateException("Result is a failure: " + error.kind() + " (" + error.message() + ")");
        }
        return value;
    }

    public <R> ApiResult<R> map(Function<? super T, ? extends R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(error);
    }
}
