package com.rsparser.ast;

import com.rsparser.token.Span;

import java.util.List;

public record ImplItemMethod(
    List<Attribute> attrs,
    Visibility vis,
    Span defaultness,
    Signature sig,
    Block block
) implements ImplItem {

    @Override
    public ImplItemMethod withAttrs(List<Attribute> attrs) {
        return new ImplItemMethod(attrs, vis, defaultness, sig, block);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMethod(this);
    }
}
