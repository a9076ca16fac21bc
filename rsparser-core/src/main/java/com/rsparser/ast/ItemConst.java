package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

/**
 * {@code const NAME: Type = expr;}. The name may be {@code _}.
 */
public record ItemConst(
    List<Attribute> attrs,
    Visibility vis,
    Span constToken,
    Ident ident,
    Span colon,
    Type ty,
    Span eq,
    Expr expr,
    Span semi
) implements Item {

    @Override
    public ItemConst withAttrs(List<Attribute> attrs) {
        return new ItemConst(attrs, vis, constToken, ident, colon, ty, eq, expr, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitConst(this);
    }
}
