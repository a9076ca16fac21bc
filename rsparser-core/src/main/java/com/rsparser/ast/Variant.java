package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

/**
 * An enum variant with an optional explicit discriminant.
 */
public record Variant(List<Attribute> attrs, Ident ident, Fields fields, Span eq, Expr discriminant) {
}
