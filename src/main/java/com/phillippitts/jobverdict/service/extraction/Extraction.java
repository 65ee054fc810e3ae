package com.phillippitts.jobverdict.service.extraction;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Tagged result of parsing one piece of information out of free LLM text: either found with a value,
 * or not found. Parsers return this instead of throwing so callers own the retry and fallback policy.
 *
 * @param <T> type of the extracted value
 */
public final class Extraction<T> {

    private final T value;

    private Extraction(T value) {
        this.value = value;
    }

    public static <T> Extraction<T> found(T value) {
        return new Extraction<>(Objects.requireNonNull(value, "found value must not be null"));
    }

    public static <T> Extraction<T> notFound() {
        return new Extraction<>(null);
    }

    public boolean isFound() {
        return value != null;
    }

    /**
     * @throws NoSuchElementException if nothing was found
     */
    public T value() {
        if (value == null) {
            throw new NoSuchElementException("Nothing was extracted");
        }
        return value;
    }

    public T orElse(T other) {
        return value != null ? value : other;
    }

    public <R> Extraction<R> map(Function<? super T, ? extends R> mapper) {
        return value == null ? notFound() : found(mapper.apply(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Extraction<?> other && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value == null ? "NotFound" : "Found[" + value + "]";
    }
}
