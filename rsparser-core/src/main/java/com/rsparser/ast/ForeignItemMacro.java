package com.rsparser.ast;

import com.rsparser.token.Span;

import java.util.List;

public record ForeignItemMacro(
    List<Attribute> attrs,
    Macro mac,
    Span semi
) implements ForeignItem {

    @Override
    public ForeignItemMacro withAttrs(List<Attribute> attrs) {
        return new ForeignItemMacro(attrs, mac, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMacro(this);
    }
}
