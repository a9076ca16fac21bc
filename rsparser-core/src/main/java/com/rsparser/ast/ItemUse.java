package com.rsparser.ast;

import com.rsparser.token.Span;

import java.util.List;

/**
 * {@code use a::b::{c, d as e};}
 */
public record ItemUse(
    List<Attribute> attrs,
    Visibility vis,
    Span useToken,
    Span leadingColon,
    UseTree tree,
    Span semi
) implements Item {

    @Override
    public ItemUse withAttrs(List<Attribute> attrs) {
        return new ItemUse(attrs, vis, useToken, leadingColon, tree, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUse(this);
    }
}
