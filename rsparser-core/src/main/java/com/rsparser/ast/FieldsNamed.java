package com.rsparser.ast;

import com.rsparser.token.Span;

/**
 * {@code { a: A, b: B }}
 */
public record FieldsNamed(Span brace, Punctuated<Field> named) implements Fields {
}
