package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

/**
 * One entry of a partial borrow receiver: {@code a} or {@code mut a}.
 */
public record PartialBorrow(Span mutability, Ident ident) {
}
