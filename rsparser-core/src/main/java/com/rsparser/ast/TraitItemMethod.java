package com.rsparser.ast;

import com.rsparser.token.Span;

import java.util.List;

/**
 * A method declaration. Exactly one of {@code defaultBody} and {@code semi} is expected; when
 * both are null a {@code ;} is printed.
 */
public record TraitItemMethod(
    List<Attribute> attrs,
    Signature sig,
    Block defaultBody,
    Span semi
) implements TraitItem {

    @Override
    public TraitItemMethod withAttrs(List<Attribute> attrs) {
        return new TraitItemMethod(attrs, sig, defaultBody, semi);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMethod(this);
    }
}
