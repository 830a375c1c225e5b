package com.tasklane;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Success-or-error value returned by operations that report failure without throwing,
 * such as {@link ActorHandle#send(Task)}.
 *
 * @param <T> the success value type
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    /**
     * Successful result containing a value.
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public Optional<Throwable> failureCause() {
            return Optional.empty();
        }
    }

    /**
     * Failed result containing an error.
     */
    record Failure<T>(Throwable error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            if (error instanceof RuntimeException) {
                throw (RuntimeException) error;
            }
            throw new ActorException("Operation failed", error);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public Optional<Throwable> failureCause() {
            return Optional.of(error);
        }
    }

    boolean isSuccess();

    T getOrThrow();

    T getOrElse(T defaultValue);

    Optional<Throwable> failureCause();

    default <U> Result<U> map(Function<T, U> fn) {
        if (this instanceof Success) {
            try {
                return new Success<>(fn.apply(((Success<T>) this).value()));
            } catch (Exception e) {
                return new Failure<>(e);
            }
        }
        return new Failure<>(((Failure<T>) this).error());
    }

    default void ifSuccess(Consumer<T> consumer) {
        if (this instanceof Success) {
            consumer.accept(((Success<T>) this).value());
        }
    }

    default void ifFailure(Consumer<Throwable> consumer) {
        if (this instanceof Failure) {
            consumer.accept(((Failure<T>) this).error());
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Throwable error) {
        return new Failure<>(error);
    }
}
