package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

/**
 * {@code enum Name<T> { A, B(T), C { x: T } }}
 */
public record ItemEnum(
    List<Attribute> attrs,
    Visibility vis,
    Span enumToken,
    Ident ident,
    Generics generics,
    Span brace,
    Punctuated<Variant> variants
) implements Item {

    @Override
    public ItemEnum withAttrs(List<Attribute> attrs) {
        return new ItemEnum(attrs, vis, enumToken, ident, generics, brace, variants);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitEnum(this);
    }
}
