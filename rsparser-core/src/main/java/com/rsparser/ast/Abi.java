package com.rsparser.ast;

import com.rsparser.token.Literal;
import com.rsparser.token.Span;

/**
 * {@code extern} with an optional ABI string such as {@code "C"}.
 */
public record Abi(Span externToken, Literal name) {
}
