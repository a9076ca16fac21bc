package com.rsparser.ast;

import com.rsparser.token.Span;

/**
 * Generic parameters and the where clause that constrains them. The where clause is written in
 * a different place for every item kind, so it is printed by the owner.
 */
public record Generics(Span lt, Punctuated<GenericParam> params, Span gt, WhereClause whereClause) {

    public static Generics empty() {
        return new Generics(null, Punctuated.empty(), null, null);
    }

    public Generics withWhereClause(WhereClause whereClause) {
        return new Generics(lt, params, gt, whereClause);
    }
}
