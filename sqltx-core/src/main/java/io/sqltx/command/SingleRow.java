package io.sqltx.command;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of a single-row command: {@link Present} with the mapped row, or {@link Absent}
 * when the query returned no rows. More than one row never produces a {@code SingleRow};
 * it fails with {@link io.sqltx.CardinalityViolationException}.
 *
 * @param <T> the row type
 */
public sealed interface SingleRow<T> permits SingleRow.Present, SingleRow.Absent {

    static <T> SingleRow<T> of(T value) {
        return new Present<>(value);
    }

    static <T> SingleRow<T> absent() {
        return new Absent<>();
    }

    default boolean isPresent() {
        return this instanceof Present;
    }

    /**
     * @throws NoSuchElementException if no row was returned
     */
    default T orElseThrow() {
        if (this instanceof Present<T> present) {
            return present.value();
        }
        throw new NoSuchElementException("No row");
    }

    default T orElse(T other) {
        return this instanceof Present<T> present ? present.value() : other;
    }

    default Optional<T> toOptional() {
        return this instanceof Present<T> present ? Optional.of(present.value()) : Optional.empty();
    }

    default <U> SingleRow<U> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (this instanceof Present<T> present) {
            return new Present<>(mapper.apply(present.value()));
        }
        return new Absent<>();
    }

    /**
     * Exactly one row was returned.
     *
     * @param value the mapped row (never null)
     */
    record Present<T>(T value) implements SingleRow<T> {
        public Present {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * No row was returned.
     */
    record Absent<T>() implements SingleRow<T> {
    }
}
