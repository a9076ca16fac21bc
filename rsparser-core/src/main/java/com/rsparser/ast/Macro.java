package com.rsparser.ast;

import com.rsparser.token.Delimiter;
import com.rsparser.token.Span;
import com.rsparser.token.TokenStream;

/**
 * A macro invocation {@code path!(...)}. The delimited tokens are not interpreted.
 */
public record Macro(Path path, Span bang, Delimiter delimiter, Span delimSpan, TokenStream tokens) {
}
