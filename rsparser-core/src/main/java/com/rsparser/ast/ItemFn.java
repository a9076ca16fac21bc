package com.rsparser.ast;

import java.util.List;

public record ItemFn(
    List<Attribute> attrs,
    Visibility vis,
    Signature sig,
    Block block
) implements Item {

    @Override
    public ItemFn withAttrs(List<Attribute> attrs) {
        return new ItemFn(attrs, vis, sig, block);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitFn(this);
    }
}
