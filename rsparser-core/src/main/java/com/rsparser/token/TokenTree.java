package com.rsparser.token;

/**
 * A single token tree: an identifier, a punctuation character, a literal, or a delimited group.
 */
public sealed interface TokenTree permits Ident, Punct, Literal, Group {
    Span span();
}
