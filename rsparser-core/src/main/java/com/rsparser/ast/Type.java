package com.rsparser.ast;

import com.rsparser.token.Punct;
import com.rsparser.token.TokenStream;
import com.rsparser.token.TokenTree;

/**
 * A type, kept as the bounded token span it was written as.
 */
public record Type(TokenStream tokens) {

    /**
     * Whether this is exactly the three dots of a variadic parameter.
     */
    public boolean variadicDots() {
        if (tokens.size() != 3) return false;
        for (TokenTree tree : tokens.trees()) {
            if (!(tree instanceof Punct punct) || punct.ch() != '.') return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return tokens.toString();
    }
}
