package com.rsparser.token;

/**
 * A delimited token stream. The span covers both delimiters.
 */
public record Group(Delimiter delimiter, TokenStream stream, Span span) implements TokenTree {

    @Override
    public String toString() {
        if (stream.isEmpty()) {
            return delimiter.open() + delimiter.close();
        }
        if (delimiter == Delimiter.NONE) {
            return stream.toString();
        }
        return delimiter.open() + " " + stream + " " + delimiter.close();
    }
}
