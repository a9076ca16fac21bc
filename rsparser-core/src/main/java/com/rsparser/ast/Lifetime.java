package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

/**
 * {@code 'a}
 */
public record Lifetime(Span apostrophe, Ident ident) {

    @Override
    public String toString() {
        return "'" + ident.name();
    }
}
