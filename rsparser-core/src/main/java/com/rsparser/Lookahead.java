package com.rsparser;

import com.rsparser.token.Delimiter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Single-token lookahead that remembers every alternative it was asked about, so that a
 * failed decision reports all of them at once.
 */
public final class Lookahead {

    private final ParseBuffer buffer;
    private final Set<String> expected = new LinkedHashSet<>();

    Lookahead(ParseBuffer buffer) {
        this.buffer = buffer;
    }

    public boolean peekKeyword(String keyword) {
        return check("`" + keyword + "`", buffer.peekKeyword(keyword));
    }

    public boolean peekPunct(String op) {
        return check("`" + op + "`", buffer.peekPunct(op));
    }

    public boolean peekIdent() {
        return check("identifier", buffer.peekIdent());
    }

    public boolean peekLifetime() {
        return check("lifetime", buffer.peekLifetime());
    }

    public boolean peekGroup(Delimiter delimiter) {
        return check(delimiter.description(), buffer.peekGroup(delimiter));
    }

    public boolean peekStringLiteral() {
        return check("string literal", buffer.peekStringLiteral());
    }

    /**
     * Records {@code description} as an alternative and returns {@code matches}.
     */
    public boolean check(String description, boolean matches) {
        if (!matches) {
            expected.add(description);
        }
        return matches;
    }

    public ExpectedTokenException error() {
        return new ExpectedTokenException(new ArrayList<>(expected), buffer.span(), buffer.isEmpty());
    }
}
