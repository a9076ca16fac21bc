package com.rsparser.ast;

import com.rsparser.token.Span;
import com.rsparser.token.TokenStream;

/**
 * Arguments of a path segment. Generic arguments are kept as opaque tokens.
 */
public sealed interface PathArguments permits
    PathArguments.None,
    PathArguments.AngleBracketed,
    PathArguments.Parenthesized {

    record None() implements PathArguments {
    }

    /**
     * {@code <K, V>} or the turbofish {@code ::<K, V>}.
     */
    record AngleBracketed(Span colon2, Span lt, TokenStream args, Span gt) implements PathArguments {
    }

    /**
     * {@code (A, B) -> C}, as in {@code Fn(A, B) -> C}.
     */
    record Parenthesized(Span paren, TokenStream inputs, ReturnType output) implements PathArguments {
    }
}
