package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

/**
 * {@code type Opaque;}
 */
public record ForeignItemType(
    List<Attribute> attrs,
    Visibility vis,
    Span typeToken,
    Ident ident,
    Span semi
) implements ForeignItem {

    @Override
    public ForeignItemType withAttrs(List<Attribute> attrs) {
        return new ForeignItemType(attrs, vis, typeToken, ident, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitType(this);
    }
}
