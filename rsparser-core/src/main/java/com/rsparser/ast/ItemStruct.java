package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

/**
 * A struct with named, positional or no fields. Positional and unit structs end with
 * {@code semi}; structs with named fields have none.
 */
public record ItemStruct(
    List<Attribute> attrs,
    Visibility vis,
    Span structToken,
    Ident ident,
    Generics generics,
    Fields fields,
    Span semi
) implements Item {

    @Override
    public ItemStruct withAttrs(List<Attribute> attrs) {
        return new ItemStruct(attrs, vis, structToken, ident, generics, fields, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStruct(this);
    }
}
