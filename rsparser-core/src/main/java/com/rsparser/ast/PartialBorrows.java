package com.rsparser.ast;

import com.rsparser.token.Span;

/**
 * {@code {mut a, b}}, in source order.
 */
public record PartialBorrows(Span brace, Punctuated<PartialBorrow> borrows) {
}
