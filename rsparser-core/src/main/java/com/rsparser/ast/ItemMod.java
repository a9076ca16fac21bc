package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

/**
 * {@code mod name { ... }} or {@code mod name;}.
 *
 * @param content the items of an inline module, or null for {@code mod name;}
 */
public record ItemMod(
    List<Attribute> attrs,
    Visibility vis,
    Span modToken,
    Ident ident,
    Span brace,
    List<Item> content,
    Span semi
) implements Item {

    @Override
    public ItemMod withAttrs(List<Attribute> attrs) {
        return new ItemMod(attrs, vis, modToken, ident, brace, content, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMod(this);
    }
}
