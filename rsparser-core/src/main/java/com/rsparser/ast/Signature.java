package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

/**
 * A function header: qualifiers, name, generics, parameters and return type. The where clause
 * lives in {@code generics} and is printed after the return type.
 *
 * @param variadic the trailing {@code ...} of a C-variadic function; it is never also part of
 *                 {@code inputs}
 */
public record Signature(
    Span constness,
    Span asyncness,
    Span unsafety,
    Abi abi,
    Span fnToken,
    Ident ident,
    Generics generics,
    Span paren,
    Punctuated<FnArg> inputs,
    Variadic variadic,
    ReturnType output
) implements Node {

    /**
     * The method receiver: a {@link Receiver}, or a typed first parameter whose pattern is
     * {@code self}, as in {@code self: Box<Self>}. Null for free functions.
     */
    public FnArg receiver() {
        FnArg first = inputs.isEmpty() ? null : inputs.get(0);
        if (first instanceof Receiver) {
            return first;
        }
        if (first instanceof PatType typed && typed.pat().bindsSelf()) {
            return first;
        }
        return null;
    }
}
