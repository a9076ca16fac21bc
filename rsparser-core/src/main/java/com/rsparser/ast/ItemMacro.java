package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

/**
 * A macro invocation in item position, including {@code macro_rules! name { ... }}.
 *
 * @param ident the defined name for {@code macro_rules!}, otherwise null
 * @param semi required after parenthesized and bracketed invocations
 */
public record ItemMacro(
    List<Attribute> attrs,
    Ident ident,
    Macro mac,
    Span semi
) implements Item {

    @Override
    public ItemMacro withAttrs(List<Attribute> attrs) {
        return new ItemMacro(attrs, ident, mac, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMacro(this);
    }
}
