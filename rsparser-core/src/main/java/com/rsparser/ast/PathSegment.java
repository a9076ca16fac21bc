package com.rsparser.ast;

import com.rsparser.token.Ident;

public record PathSegment(Ident ident, PathArguments arguments) {
}
