package com.patientregistry.common;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a registry operation: either a value or an error message, never both.
 * <p>
 * The hierarchy is sealed, so {@link #fold(Function, Function)} is the single
 * place callers have to handle both cases.
 *
 * @param <T> type of the success value
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    /**
     * Successful outcome.
     */
    record Ok<T>(T value) implements Result<T> {

        @Override
        public <R> R fold(Function<? super T, ? extends R> onOk,
                          Function<? super Err<T>, ? extends R> onErr) {
            return onOk.apply(value);
        }
    }

    /**
     * Failed outcome with a human-readable message.
     */
    record Err<T>(ErrorKind kind, String message) implements Result<T> {

        public Err {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onOk,
                          Function<? super Err<T>, ? extends R> onErr) {
            return onErr.apply(this);
        }

        /**
         * Re-type this error for a result of a different value type.
         */
        public <U> Err<U> retype() {
            return new Err<>(kind, message);
        }
    }

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(ErrorKind kind, String message) {
        return new Err<>(kind, message);
    }

    static <T> Result<T> validation(String message) {
        return err(ErrorKind.VALIDATION, message);
    }

    static <T> Result<T> notFound(String message) {
        return err(ErrorKind.NOT_FOUND, message);
    }

    static <T> Result<T> conflict(String message) {
        return err(ErrorKind.CONFLICT, message);
    }

    static <T> Result<T> internal(String message) {
        return err(ErrorKind.INTERNAL, message);
    }

    /**
     * Apply {@code onOk} to the value or {@code onErr} to the error.
     */
    <R> R fold(Function<? super T, ? extends R> onOk, Function<? super Err<T>, ? extends R> onErr);

    default boolean isOk() {
        return this.<Boolean>fold(value -> true, err -> false);
    }

    default Optional<T> toOptional() {
        return this.<Optional<T>>fold(Optional::ofNullable, err -> Optional.empty());
    }

    default Optional<Err<T>> error() {
        return this.<Optional<Err<T>>>fold(value -> Optional.empty(), Optional::of);
    }

    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        return this.<Result<U>>fold(value -> Result.<U>ok(mapper.apply(value)), err -> err.<U>retype());
    }
}
