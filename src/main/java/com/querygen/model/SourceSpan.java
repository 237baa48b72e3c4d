package com.querygen.model;

import java.util.function.Function;

import lombok.NonNull;
import lombok.Value;

/**
 * A parsed value together with the byte offsets it was read from.
 *
 * Offsets are 0-based byte indices into the module's source text (UTF-8).
 * Produced by the parser; validators and the diagnostic renderer only read it.
 */
@Value
public class SourceSpan<T> {
    int start;
    int end;
    @NonNull
    T value;

    public SourceSpan(int start, int end, @NonNull T value) {
        if (start < 0 || start > end) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
        this.value = value;
    }

    public static <T> SourceSpan<T> of(int start, int end, T value) {
        return new SourceSpan<>(start, end, value);
    }

    /**
     * Same offsets, transformed value.
     */
    public <R> SourceSpan<R> map(Function<? super T, ? extends R> mapper) {
        return new SourceSpan<>(start, end, mapper.apply(value));
    }
}
