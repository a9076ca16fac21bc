package com.rsparser.ast;

import com.rsparser.token.Span;

import java.util.List;

/**
 * An inherent or trait implementation block.
 *
 * @param bang the {@code !} of a negative implementation
 * @param trait the implemented trait, or null for an inherent impl
 */
public record ItemImpl(
    List<Attribute> attrs,
    Span defaultness,
    Span unsafety,
    Span implToken,
    Generics generics,
    Span bang,
    Path trait,
    Span forToken,
    Type selfTy,
    Span brace,
    List<ImplItem> items
) implements Item {

    @Override
    public ItemImpl withAttrs(List<Attribute> attrs) {
        return new ItemImpl(attrs, defaultness, unsafety, implToken, generics, bang, trait, forToken, selfTy, brace, items);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitImpl(this);
    }
}
