package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

public record ImplItemConst(
    List<Attribute> attrs,
    Visibility vis,
    Span defaultness,
    Span constToken,
    Ident ident,
    Span colon,
    Type ty,
    Span eq,
    Expr expr,
    Span semi
) implements ImplItem {

    @Override
    public ImplItemConst withAttrs(List<Attribute> attrs) {
        return new ImplItemConst(attrs, vis, defaultness, constToken, ident, colon, ty, eq, expr, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitConst(this);
    }
}
