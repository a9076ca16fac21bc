package com.rsparser.ast;

import com.rsparser.token.TokenStream;

import java.util.List;

/**
 * Tokens of an item form this library does not model, kept so they print back unchanged.
 * Attributes are part of the tokens.
 */
public record ItemVerbatim(TokenStream tokens) implements Item {

    @Override
    public List<Attribute> attrs() {
        return List.of();
    }

    @Override
    public ItemVerbatim withAttrs(List<Attribute> attrs) {
        throw new AssertionError("verbatim items carry their attributes as tokens");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitVerbatim(this);
    }
}
