package com.rsparser.ast;

import com.rsparser.token.TokenStream;

public record WherePredicate(TokenStream tokens) {
}
