package com.rsparser.ast;

import com.rsparser.token.Span;
import com.rsparser.token.TokenStream;

import java.util.ArrayList;
import java.util.List;

/**
 * An attribute kept as the opaque tokens between its brackets.
 *
 * @param bang present only for inner attributes
 */
public record Attribute(
    AttrStyle style,
    Span pound,
    Span bang,
    Span bracket,
    TokenStream tokens
) {

    /**
     * Outer attributes followed by inner attributes, both in source order.
     */
    public static List<Attribute> concat(List<Attribute> outer, List<Attribute> inner) {
        if (inner.isEmpty()) return outer;
        List<Attribute> result = new ArrayList<>(outer);
        result.addAll(inner);
        return result;
    }
}
