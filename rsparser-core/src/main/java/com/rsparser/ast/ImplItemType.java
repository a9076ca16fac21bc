package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

public record ImplItemType(
    List<Attribute> attrs,
    Visibility vis,
    Span defaultness,
    Span typeToken,
    Ident ident,
    Generics generics,
    Span eq,
    Type ty,
    Span semi
) implements ImplItem {

    @Override
    public ImplItemType withAttrs(List<Attribute> attrs) {
        return new ImplItemType(attrs, vis, defaultness, typeToken, ident, generics, eq, ty, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitType(this);
    }
}
