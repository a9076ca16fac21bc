package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

import java.util.List;

/**
 * A named or positional field. {@code ident} and {@code colon} are null for positional fields.
 */
public record Field(List<Attribute> attrs, Visibility vis, Ident ident, Span colon, Type ty) {
}
