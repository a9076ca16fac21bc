package com.rsparser;

import com.rsparser.token.Delimiter;
import com.rsparser.token.Group;
import com.rsparser.token.Ident;
import com.rsparser.token.Literal;
import com.rsparser.token.Punct;
import com.rsparser.token.Spacing;
import com.rsparser.token.Span;
import com.rsparser.token.TokenStream;
import com.rsparser.token.TokenTree;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Append-only token sink used by the {@link Printer}. A null span means the token was not
 * in the source and is written at {@link Span#CALL_SITE}.
 */
public final class TokenStreamBuilder {

    private final List<TokenTree> trees = new ArrayList<>();

    public TokenStreamBuilder ident(Ident ident) {
        trees.add(ident);
        return this;
    }

    public TokenStreamBuilder keyword(String keyword, Span span) {
        trees.add(new Ident(keyword, orCallSite(span)));
        return this;
    }

    /**
     * Writes {@code keyword} only if it was present, that is if {@code span} is not null.
     */
    public TokenStreamBuilder optionalKeyword(String keyword, Span span) {
        return span != null ? keyword(keyword, span) : this;
    }

    /**
     * Writes an operator one character at a time; all but the last character are joint.
     */
    public TokenStreamBuilder punct(String op, Span span) {
        Span at = orCallSite(span);
        for (int i = 0; i < op.length(); i++) {
            Spacing spacing = i < op.length() - 1 ? Spacing.JOINT : Spacing.ALONE;
            trees.add(new Punct(op.charAt(i), spacing, at));
        }
        return this;
    }

    public TokenStreamBuilder optionalPunct(String op, Span span) {
        return span != null ? punct(op, span) : this;
    }

    /**
     * A lifetime is an apostrophe joined to the identifier that follows it.
     */
    public TokenStreamBuilder lifetime(Span apostrophe, Ident ident) {
        trees.add(new Punct('\'', Spacing.JOINT, orCallSite(apostrophe)));
        trees.add(ident);
        return this;
    }

    public TokenStreamBuilder literal(Literal literal) {
        trees.add(literal);
        return this;
    }

    public TokenStreamBuilder append(TokenStream tokens) {
        trees.addAll(tokens.trees());
        return this;
    }

    public TokenStreamBuilder group(Delimiter delimiter, Span span, TokenStream contents) {
        trees.add(new Group(delimiter, contents, orCallSite(span)));
        return this;
    }

    /**
     * Writes a delimited group whose contents are produced by {@code body}. The group is
     * closed even if {@code body} exits early.
     */
    public TokenStreamBuilder surround(Delimiter delimiter, Span span, Consumer<TokenStreamBuilder> body) {
        TokenStreamBuilder inner = new TokenStreamBuilder();
        try {
            body.accept(inner);
        } finally {
            group(delimiter, span, inner.build());
        }
        return this;
    }

    public boolean isEmpty() {
        return trees.isEmpty();
    }

    public TokenStream build() {
        return new TokenStream(trees);
    }

    private static Span orCallSite(Span span) {
        return span != null ? span : Span.CALL_SITE;
    }
}
