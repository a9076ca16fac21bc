package com.rsparser.ast;

import com.rsparser.token.TokenStream;

/**
 * An expression, kept as the bounded token span it was written as.
 */
public record Expr(TokenStream tokens) {

    @Override
    public String toString() {
        return tokens.toString();
    }
}
