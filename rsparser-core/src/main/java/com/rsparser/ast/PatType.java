package com.rsparser.ast;

import com.rsparser.token.Span;

import java.util.List;

/**
 * {@code pattern: Type}
 */
public record PatType(List<Attribute> attrs, Pat pat, Span colon, Type ty) implements FnArg {
}
