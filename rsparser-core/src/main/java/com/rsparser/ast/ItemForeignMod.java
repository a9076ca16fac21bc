package com.rsparser.ast;

import com.rsparser.token.Span;

import java.util.List;

/**
 * {@code extern "C" { ... }}
 */
public record ItemForeignMod(
    List<Attribute> attrs,
    Abi abi,
    Span brace,
    List<ForeignItem> items
) implements Item {

    @Override
    public ItemForeignMod withAttrs(List<Attribute> attrs) {
        return new ItemForeignMod(attrs, abi, brace, items);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitForeignMod(this);
    }
}
