package com.rsparser.ast;

import com.rsparser.token.Span;

import java.util.List;

public record ImplItemMacro(
    List<Attribute> attrs,
    Macro mac,
    Span semi
) implements ImplItem {

    @Override
    public ImplItemMacro withAttrs(List<Attribute> attrs) {
        return new ImplItemMacro(attrs, mac, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMacro(this);
    }
}
