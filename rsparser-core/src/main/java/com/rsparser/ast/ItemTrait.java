package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

/**
 * {@code unsafe auto trait Name<T>: Super { ... }}
 */
public record ItemTrait(
    List<Attribute> attrs,
    Visibility vis,
    Span unsafety,
    Span autoToken,
    Span traitToken,
    Ident ident,
    Generics generics,
    Span colon,
    Punctuated<TypeParamBound> supertraits,
    Span brace,
    List<TraitItem> items
) implements Item {

    @Override
    public ItemTrait withAttrs(List<Attribute> attrs) {
        return new ItemTrait(attrs, vis, unsafety, autoToken, traitToken, ident, generics, colon, supertraits, brace, items);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitTrait(this);
    }
}
