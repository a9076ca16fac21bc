package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;
import com.rsparser.token.TokenStream;

import java.util.List;

/**
 * {@code macro name(args) { body }}, with the rules kept as opaque tokens.
 */
public record ItemMacro2(
    List<Attribute> attrs,
    Visibility vis,
    Span macroToken,
    Ident ident,
    TokenStream rules
) implements Item {

    @Override
    public ItemMacro2 withAttrs(List<Attribute> attrs) {
        return new ItemMacro2(attrs, vis, macroToken, ident, rules);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMacro2(this);
    }
}
