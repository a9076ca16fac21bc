package com.rsparser.ast;

import com.rsparser.token.Span;

public record WhereClause(Span whereToken, Punctuated<WherePredicate> predicates) {
}
