package com.rsparser.ast;

import com.rsparser.token.Span;

import java.util.List;

/**
 * The {@code self} parameter of a method, without a written type.
 */
public record Receiver(List<Attribute> attrs, Reference reference, Span selfToken) implements FnArg {
}
