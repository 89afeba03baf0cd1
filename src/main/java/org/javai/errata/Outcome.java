package org.javai.errata;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Represents the outcome of an operation that may fail.
 * Either {@link Ok} containing a successful value, or {@link Fail} containing an {@link ErrorKind}.
 *
 * <p>{@link #flatMap(Function)} is the short-circuiting bind: once an outcome has failed, no
 * further mapper runs and the original kind is carried through unchanged.
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome containing a value.
     *
     * @param value the successful value
     */
    record Ok<T>(T value) implements Outcome<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
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
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.ofNullable(value);
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            Objects.requireNonNull(mapper);
            return Objects.requireNonNull(mapper.apply(value), "mapper must not return null");
        }

        @Override
        public Outcome<T> recover(Function<? super ErrorKind, ? extends T> recovery) {
            return this;
        }

        @Override
        public Outcome<T> recoverWith(Function<? super ErrorKind, ? extends Outcome<T>> recovery) {
            return this;
        }
    }

    /**
     * A failed outcome containing the failure's kind.
     *
     * @param kind the failure
     */
    record Fail<T>(ErrorKind kind) implements Outcome<T> {

        /**
         * Canonical constructor with validation.
         */
        public Fail {
            Objects.requireNonNull(kind, "kind must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        @Override
        public T getOrThrow() {
            throw new OutcomeFailedException(kind);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.empty();
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(kind);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            return new Fail<>(kind);
        }

        @Override
        public Outcome<T> recover(Function<? super ErrorKind, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(kind));
        }

        @Override
        public Outcome<T> recoverWith(Function<? super ErrorKind, ? extends Outcome<T>> recovery) {
            Objects.requireNonNull(recovery);
            return Objects.requireNonNull(recovery.apply(kind), "recovery must not return null");
        }
    }

    // Query methods
    boolean isOk();
    boolean isFail();

    // Value extraction
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    /**
     * Drops the failure, keeping only the value if there is one.
     *
     * @return the value, or empty for a failure or a null value
     */
    Optional<T> toOptional();

    // Transformations
    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);
    <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper);

    // Recovery
    Outcome<T> recover(Function<? super ErrorKind, ? extends T> recovery);
    Outcome<T> recoverWith(Function<? super ErrorKind, ? extends Outcome<T>> recovery);

    // Static factories
    static Outcome<Void> ok() {
        return new Ok<>(null);
    }

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(ErrorKind kind) {
        return new Fail<>(kind);
    }

    /**
     * Lifts an optional value into an outcome, failing with the supplied kind when it is empty.
     *
     * @param optional the possibly-absent value
     * @param whenEmpty supplies the failure for an empty optional
     * @param <T> The type of the value
     * @return Ok with the value, or Fail with the supplied kind
     */
    static <T> Outcome<T> fromOptional(Optional<T> optional, Supplier<? extends ErrorKind> whenEmpty) {
        Objects.requireNonNull(optional, "optional must not be null");
        Objects.requireNonNull(whenEmpty, "whenEmpty must not be null");
        return optional.<Outcome<T>>map(Outcome::ok).orElseGet(() -> fail(whenEmpty.get()));
    }
}
