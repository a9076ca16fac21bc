package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.TokenStream;

/**
 * A pattern, kept as the bounded token span it was written as.
 */
public record Pat(TokenStream tokens) {

    /**
     * Whether this pattern binds {@code self}, optionally as {@code mut self}.
     */
    public boolean bindsSelf() {
        int size = tokens.size();
        if (size == 1) {
            return isIdent(0, "self");
        }
        return size == 2 && isIdent(0, "mut") && isIdent(1, "self");
    }

    private boolean isIdent(int index, String name) {
        return tokens.get(index) instanceof Ident ident && ident.name().equals(name);
    }

    @Override
    public String toString() {
        return tokens.toString();
    }
}
