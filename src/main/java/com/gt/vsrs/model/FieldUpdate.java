package com.gt.vsrs.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * A single field of a partial update: either left unchanged or set to a value.
 * An empty string is a legitimate value, not a marker for "unchanged".
 */
public final class FieldUpdate<T> {

    private final boolean set;
    private final T value;

    private FieldUpdate(boolean set, T value) {
        this.set = set;
        this.value = value;
    }

    public static <T> FieldUpdate<T> unchanged() {
        return new FieldUpdate<>(false, null);
    }

    public static <T> FieldUpdate<T> set(T value) {
        return new FieldUpdate<>(true, value);
    }

    // Absent request fields arrive as null
    public static <T> FieldUpdate<T> ofNullable(T value) {
        return value == null ? unchanged() : set(value);
    }

    public boolean isSet() {
        return set;
    }

    public T getValue() {
        if (!set) {
            throw new IllegalStateException("Field is unchanged");
        }
        return value;
    }

    public T orElse(T currentValue) {
        return set ? value : currentValue;
    }

    public <R> FieldUpdate<R> map(Function<T, R> mapper) {
        return set ? set(mapper.apply(value)) : unchanged();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldUpdate<?> other)) return false;
        return set == other.set && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(set, value);
    }

    @Override
    public String toString() {
        return set ? "set(" + value + ")" : "unchanged";
    }
}
