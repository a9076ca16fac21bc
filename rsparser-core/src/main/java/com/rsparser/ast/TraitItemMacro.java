package com.rsparser.ast;

import com.rsparser.token.Span;

import java.util.List;

public record TraitItemMacro(
    List<Attribute> attrs,
    Macro mac,
    Span semi
) implements TraitItem {

    @Override
    public TraitItemMacro withAttrs(List<Attribute> attrs) {
        return new TraitItemMacro(attrs, mac, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMacro(this);
    }
}
