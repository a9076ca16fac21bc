package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

public sealed interface GenericParam permits
    GenericParam.TypeParam,
    GenericParam.LifetimeParam,
    GenericParam.ConstParam {

    List<Attribute> attrs();

    /** {@code T: Bound + Other = Default} */
    record TypeParam(
        List<Attribute> attrs,
        Ident ident,
        Span colon,
        Punctuated<TypeParamBound> bounds,
        Span eq,
        Type defaultType
    ) implements GenericParam {
    }

    /** {@code 'a: 'b + 'c} */
    record LifetimeParam(
        List<Attribute> attrs,
        Lifetime lifetime,
        Span colon,
        Punctuated<Lifetime> bounds
    ) implements GenericParam {
    }

    /** {@code const N: usize = 3} */
    record ConstParam(
        List<Attribute> attrs,
        Span constToken,
        Ident ident,
        Span colon,
        Type ty,
        Span eq,
        Expr defaultValue
    ) implements GenericParam {
    }
}
