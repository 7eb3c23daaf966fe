package org.javai.casebook;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Represents the outcome of guarded work.
 * Either {@link Ok} containing a value, or {@link Fail} containing the classified {@link Fault}.
 *
 * <p>{@link org.javai.casebook.guard.FailureGuard#call} produces outcomes at function
 * boundaries where a returned error reads better than a callback. A failed outcome
 * produced by a guard also carries the {@link FailureRecord} it was recovered from.
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
        public Optional<Fault> fault() {
            return Optional.empty();
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public Outcome<T> recover(Function<? super Fault, ? extends T> recovery) {
            return this;
        }
    }

    /**
     * A failed outcome.
     *
     * @param classified the fault after classification
     * @param record the captured failure, empty when the outcome was built directly
     */
    record Fail<T>(Fault classified, Optional<FailureRecord> record) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(classified, "classified must not be null");
            Objects.requireNonNull(record, "record must not be null, use Optional.empty()");
        }

        public Fail(Fault classified) {
            this(classified, Optional.empty());
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
            throw new OutcomeFailedException(classified, record.orElse(null));
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
        public Optional<Fault> fault() {
            return Optional.of(classified);
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(classified, record);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            return new Fail<>(classified, record);
        }

        @Override
        public Outcome<T> recover(Function<? super Fault, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(classified));
        }

        /**
         * Whether the recovered failure was reported by a delegated operation.
         * Outcomes built without a record count as detected.
         */
        public boolean detected() {
            return record.map(FailureRecord::detected).orElse(true);
        }
    }

    // Query methods
    boolean isOk();
    boolean isFail();

    /**
     * Returns the classified fault of a failed outcome.
     */
    Optional<Fault> fault();

    // Value extraction
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    // Transformations
    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);
    <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper);

    // Recovery
    Outcome<T> recover(Function<? super Fault, ? extends T> recovery);

    // Static factories
    static Outcome<Void> ok() {
        return new Ok<>(null);
    }

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Fault fault) {
        return new Fail<>(fault);
    }

    static <T> Outcome<T> fail(Fault classified, FailureRecord record) {
        return new Fail<>(classified, Optional.of(record));
    }
}
