package com.rsparser.ast;

import com.rsparser.token.Span;

import java.util.List;

public record ForeignItemFn(
    List<Attribute> attrs,
    Visibility vis,
    Signature sig,
    Span semi
) implements ForeignItem {

    @Override
    public ForeignItemFn withAttrs(List<Attribute> attrs) {
        return new ForeignItemFn(attrs, vis, sig, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitFn(this);
    }
}
