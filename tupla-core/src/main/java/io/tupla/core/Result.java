package io.tupla.core;

import java.util.function.Function;

/**
 * Two-variant outcome of a table operation: a value, or a {@link TableError}.
 * <p>
 * The engine never throws for an expected failure; callers that prefer exceptions use
 * {@link #orElseThrow(String)}, which is what every {@code ...OrThrow} facade method does.
 *
 * @param <T> the success value type
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(TableError error) {
        return new Err<>(error);
    }

    static <T> Result<T> err(ErrorReason reason) {
        return new Err<>(TableError.of(reason));
    }

    boolean isOk();

    default boolean isErr() {
        return !isOk();
    }

    /**
     * @return the success value
     * @throws IllegalStateException if this is an error
     */
    T value();

    /**
     * @return the error
     * @throws IllegalStateException if this is a success
     */
    TableError error();

    default <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Ok<T> ok) {
            return new Ok<>(mapper.apply(ok.value()));
        }
        return new Err<>(error());
    }

    default <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
        if (this instanceof Ok<T> ok) {
            return mapper.apply(ok.value());
        }
        return new Err<>(error());
    }

    default T orElse(T fallback) {
        return isOk() ? value() : fallback;
    }

    /**
     * Unwrap the value or raise.
     *
     * @param operation operation name used in the exception message
     * @return the success value
     * @throws TuplaException carrying the error
     */
    default T orElseThrow(String operation) {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        throw new TuplaException(operation, error());
    }

    record Ok<T>(T value) implements Result<T> {
        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public TableError error() {
            throw new IllegalStateException("result is ok: " + value);
        }
    }

    record Err<T>(TableError error) implements Result<T> {
        public Err {
            if (error == null) {
                throw new IllegalArgumentException("error required");
            }
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("result is an error: " + error.describe());
        }
    }
}
