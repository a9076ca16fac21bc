package com.rsparser.ast;

import com.rsparser.token.Span;
import com.rsparser.token.TokenStream;

/**
 * A function body. Statements are kept as opaque tokens; inner attributes are lifted onto the
 * owning item.
 */
public record Block(Span brace, TokenStream stmts) {
}
