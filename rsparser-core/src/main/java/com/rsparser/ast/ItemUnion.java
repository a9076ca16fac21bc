package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

/**
 * A union. Only named fields are allowed.
 */
public record ItemUnion(
    List<Attribute> attrs,
    Visibility vis,
    Span unionToken,
    Ident ident,
    Generics generics,
    FieldsNamed fields
) implements Item {

    @Override
    public ItemUnion withAttrs(List<Attribute> attrs) {
        return new ItemUnion(attrs, vis, unionToken, ident, generics, fields);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUnion(this);
    }
}
