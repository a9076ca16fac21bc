package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

/**
 * {@code const NAME: Type;} or {@code const NAME: Type = default;}
 */
public record TraitItemConst(
    List<Attribute> attrs,
    Span constToken,
    Ident ident,
    Span colon,
    Type ty,
    Span eq,
    Expr defaultValue,
    Span semi
) implements TraitItem {

    @Override
    public TraitItemConst withAttrs(List<Attribute> attrs) {
        return new TraitItemConst(attrs, constToken, ident, colon, ty, eq, defaultValue, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitConst(this);
    }
}
