package com.rsparser.ast;

import com.rsparser.token.TokenStream;

import java.util.List;

public record TraitItemVerbatim(TokenStream tokens) implements TraitItem {

    @Override
    public List<Attribute> attrs() {
        return List.of();
    }

    @Override
    public TraitItemVerbatim withAttrs(List<Attribute> attrs) {
        throw new AssertionError("verbatim members carry their attributes as tokens");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitVerbatim(this);
    }
}
