package com.rsparser.ast;

import com.rsparser.token.Span;

/**
 * {@code (A, B)}
 */
public record FieldsUnnamed(Span paren, Punctuated<Field> unnamed) implements Fields {
}
