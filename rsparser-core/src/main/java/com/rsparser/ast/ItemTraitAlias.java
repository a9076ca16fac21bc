package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

/**
 * {@code trait Name<T> = Bound + Other;}
 */
public record ItemTraitAlias(
    List<Attribute> attrs,
    Visibility vis,
    Span traitToken,
    Ident ident,
    Generics generics,
    Span eq,
    Punctuated<TypeParamBound> bounds,
    Span semi
) implements Item {

    @Override
    public ItemTraitAlias withAttrs(List<Attribute> attrs) {
        return new ItemTraitAlias(attrs, vis, traitToken, ident, generics, eq, bounds, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitTraitAlias(this);
    }
}
