package com.rsparser.ast;

import com.rsparser.token.TokenStream;

import java.util.List;

public record ImplItemVerbatim(TokenStream tokens) implements ImplItem {

    @Override
    public List<Attribute> attrs() {
        return List.of();
    }

    @Override
    public ImplItemVerbatim withAttrs(List<Attribute> attrs) {
        throw new AssertionError("verbatim members carry their attributes as tokens");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitVerbatim(this);
    }
}
