package com.rsparser.ast;

import com.rsparser.token.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * A sequence of values with interleaved separators. {@code separators.size()} is either
 * {@code values.size() - 1} or, when a trailing separator was written, {@code values.size()}.
 */
public record Punctuated<T>(List<T> values, List<Span> separators) {

    public Punctuated {
        values = List.copyOf(values);
        separators = List.copyOf(separators);
        boolean consistent = values.isEmpty()
            ? separators.isEmpty()
            : separators.size() == values.size() || separators.size() == values.size() - 1;
        if (!consistent) {
            throw new IllegalArgumentException(
                "inconsistent separators: " + values.size() + " values, " + separators.size() + " separators");
        }
    }

    public static <T> Punctuated<T> empty() {
        return new Punctuated<>(List.of(), List.of());
    }

    /**
     * Values joined by synthesized separators, without a trailing separator.
     */
    @SafeVarargs
    public static <T> Punctuated<T> of(T... values) {
        List<Span> separators = new ArrayList<>();
        for (int i = 1; i < values.length; i++) {
            separators.add(Span.CALL_SITE);
        }
        return new Punctuated<>(List.of(values), separators);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public T get(int index) {
        return values.get(index);
    }

    public T last() {
        return values.isEmpty() ? null : values.get(values.size() - 1);
    }

    public boolean trailingSeparator() {
        return !values.isEmpty() && separators.size() == values.size();
    }

    /**
     * True when nothing more can be appended without first writing a separator.
     */
    public boolean emptyOrTrailing() {
        return values.isEmpty() || trailingSeparator();
    }

    public static final class Builder<T> {
        private final List<T> values = new ArrayList<>();
        private final List<Span> separators = new ArrayList<>();

        public Builder<T> value(T value) {
            values.add(value);
            return this;
        }

        public Builder<T> separator(Span span) {
            separators.add(span);
            return this;
        }

        public boolean isEmpty() {
            return values.isEmpty();
        }

        public Punctuated<T> build() {
            return new Punctuated<>(values, separators);
        }
    }
}
