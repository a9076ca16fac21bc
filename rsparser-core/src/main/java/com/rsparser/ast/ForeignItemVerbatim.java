package com.rsparser.ast;

import com.rsparser.token.TokenStream;

import java.util.List;

public record ForeignItemVerbatim(TokenStream tokens) implements ForeignItem {

    @Override
    public List<Attribute> attrs() {
        return List.of();
    }

    @Override
    public ForeignItemVerbatim withAttrs(List<Attribute> attrs) {
        throw new AssertionError("verbatim members carry their attributes as tokens");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitVerbatim(this);
    }
}
