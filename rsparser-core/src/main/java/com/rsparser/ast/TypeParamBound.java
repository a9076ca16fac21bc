package com.rsparser.ast;

import com.rsparser.token.TokenStream;

/**
 * A trait or lifetime bound, kept as opaque tokens.
 */
public record TypeParamBound(TokenStream tokens) {

    @Override
    public String toString() {
        return tokens.toString();
    }
}
