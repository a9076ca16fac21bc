package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

/**
 * {@code static mut NAME: Type = expr;}
 */
public record ItemStatic(
    List<Attribute> attrs,
    Visibility vis,
    Span staticToken,
    Span mutability,
    Ident ident,
    Span colon,
    Type ty,
    Span eq,
    Expr expr,
    Span semi
) implements Item {

    @Override
    public ItemStatic withAttrs(List<Attribute> attrs) {
        return new ItemStatic(attrs, vis, staticToken, mutability, ident, colon, ty, eq, expr, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStatic(this);
    }
}
