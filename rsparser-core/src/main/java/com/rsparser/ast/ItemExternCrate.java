package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

/**
 * {@code extern crate name as rename;}. The name may be {@code self}, the rename {@code _}.
 */
public record ItemExternCrate(
    List<Attribute> attrs,
    Visibility vis,
    Span externToken,
    Span crateToken,
    Ident ident,
    Span asToken,
    Ident rename,
    Span semi
) implements Item {

    @Override
    public ItemExternCrate withAttrs(List<Attribute> attrs) {
        return new ItemExternCrate(attrs, vis, externToken, crateToken, ident, asToken, rename, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitExternCrate(this);
    }
}
