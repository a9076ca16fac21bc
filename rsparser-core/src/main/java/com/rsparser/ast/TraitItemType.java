package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

/**
 * {@code type Assoc<T>: Bounds where ... = Default;}
 */
public record TraitItemType(
    List<Attribute> attrs,
    Span typeToken,
    Ident ident,
    Generics generics,
    Span colon,
    Punctuated<TypeParamBound> bounds,
    Span eq,
    Type defaultType,
    Span semi
) implements TraitItem {

    @Override
    public TraitItemType withAttrs(List<Attribute> attrs) {
        return new TraitItemType(attrs, typeToken, ident, generics, colon, bounds, eq, defaultType, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitType(this);
    }
}
