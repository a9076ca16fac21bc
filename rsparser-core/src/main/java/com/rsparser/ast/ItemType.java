package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

/**
 * {@code type Name<T> = Type;}
 */
public record ItemType(
    List<Attribute> attrs,
    Visibility vis,
    Span typeToken,
    Ident ident,
    Generics generics,
    Span eq,
    Type ty,
    Span semi
) implements Item {

    @Override
    public ItemType withAttrs(List<Attribute> attrs) {
        return new ItemType(attrs, vis, typeToken, ident, generics, eq, ty, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitType(this);
    }
}
