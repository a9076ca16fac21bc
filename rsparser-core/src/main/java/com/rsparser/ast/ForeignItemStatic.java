package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

public record ForeignItemStatic(
    List<Attribute> attrs,
    Visibility vis,
    Span staticToken,
    Span mutability,
    Ident ident,
    Span colon,
    Type ty,
    Span semi
) implements ForeignItem {

    @Override
    public ForeignItemStatic withAttrs(List<Attribute> attrs) {
        return new ForeignItemStatic(attrs, vis, staticToken, mutability, ident, colon, ty, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStatic(this);
    }
}
