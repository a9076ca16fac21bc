package com.rsparser.ast;

import com.rsparser.token.Span;

import java.util.List;

/**
 * The {@code ...} of a C-variadic function, optionally named as in {@code args: ...}.
 *
 * @param comma a separator written after the dots
 */
public record Variadic(List<Attribute> attrs, Pat pat, Span colon, Span dots, Span comma) {
}
