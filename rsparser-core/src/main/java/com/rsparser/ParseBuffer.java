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

import java.util.List;
import java.util.Set;

/**
 * A cursor over one level of an immutable token list.
 *
 * <p>{@link #fork()} copies only the position, so speculation costs nothing until tokens are
 * re-scanned. A fork's progress becomes visible to its parent only through
 * {@link #advanceTo(ParseBuffer)}. Delimited groups are entered with {@link #nested(Group)},
 * which returns a separate buffer over the group's contents.</p>
 */
public final class ParseBuffer {

    static final Set<String> KEYWORDS = Set.of(
        "abstract", "as", "async", "await", "become", "box", "break", "const", "continue", "crate",
        "do", "dyn", "else", "enum", "extern", "false", "final", "fn", "for", "if", "impl", "in",
        "let", "loop", "macro", "match", "mod", "move", "mut", "override", "priv", "pub", "ref",
        "return", "Self", "self", "static", "struct", "super", "trait", "true", "try", "type",
        "typeof", "unsafe", "unsized", "use", "virtual", "where", "while", "yield");

    private final List<TokenTree> tokens;
    private final Span endSpan;
    private int current;

    public ParseBuffer(TokenStream stream) {
        this(stream.trees(), endOf(stream), 0);
    }

    private ParseBuffer(List<TokenTree> tokens, Span endSpan, int current) {
        this.tokens = tokens;
        this.endSpan = endSpan;
        this.current = current;
    }

    private static Span endOf(TokenStream stream) {
        if (stream.isEmpty()) return Span.CALL_SITE;
        Span last = stream.get(stream.size() - 1).span();
        return new Span(last.endLine(), last.endColumn(), last.endLine(), last.endColumn());
    }

    // ==================== Fork / commit ====================

    public ParseBuffer fork() {
        return new ParseBuffer(tokens, endSpan, current);
    }

    /**
     * Commits the progress of a fork of this buffer.
     */
    public void advanceTo(ParseBuffer fork) {
        if (fork.tokens != tokens) {
            throw new IllegalArgumentException("fork was not created from this buffer");
        }
        if (fork.current < current) {
            throw new IllegalArgumentException("fork is behind this buffer");
        }
        current = fork.current;
    }

    /**
     * Tokens consumed between {@code begin} (a fork taken earlier) and this buffer's position.
     */
    public TokenStream tokensSince(ParseBuffer begin) {
        if (begin.tokens != tokens) {
            throw new IllegalArgumentException("buffer was not created from this buffer");
        }
        return new TokenStream(tokens.subList(begin.current, current));
    }

    public ParseBuffer nested(Group group) {
        return new ParseBuffer(group.stream().trees(), group.span().close(), 0);
    }

    // ==================== Peeking ====================

    public boolean isEmpty() {
        return current >= tokens.size();
    }

    public TokenTree peekToken(int offset) {
        int index = current + offset;
        return index < tokens.size() ? tokens.get(index) : null;
    }

    /**
     * Span of the next token, or of the end of this group.
     */
    public Span span() {
        TokenTree next = peekToken(0);
        return next != null ? next.span() : endSpan;
    }

    public boolean peekKeyword(String keyword) {
        return peekKeyword(0, keyword);
    }

    public boolean peekKeyword(int offset, String keyword) {
        return peekToken(offset) instanceof Ident ident && ident.name().equals(keyword);
    }

    /**
     * True for an identifier that is not a keyword. {@code _} is not an identifier.
     */
    public boolean peekIdent() {
        return peekIdent(0);
    }

    public boolean peekIdent(int offset) {
        return peekToken(offset) instanceof Ident ident && isPlainIdent(ident.name());
    }

    static boolean isPlainIdent(String name) {
        return !name.equals("_") && !KEYWORDS.contains(name);
    }

    /**
     * True if the tokens at {@code offset} spell {@code op}. Single-character {@code :}, {@code .}
     * and {@code =} do not match when they are the first half of {@code ::}, {@code ..},
     * {@code ==} or {@code =>}.
     */
    public boolean peekPunct(int offset, String op) {
        int last = op.length() - 1;
        for (int i = 0; i <= last; i++) {
            if (!(peekToken(offset + i) instanceof Punct punct) || punct.ch() != op.charAt(i)) {
                return false;
            }
            if (i < last && punct.spacing() != Spacing.JOINT) {
                return false;
            }
        }
        if (op.length() == 1 && peekToken(offset) instanceof Punct first && first.spacing() == Spacing.JOINT
                && peekToken(offset + 1) instanceof Punct second) {
            return !joins(first.ch(), second.ch());
        }
        return true;
    }

    public boolean peekPunct(String op) {
        return peekPunct(0, op);
    }

    private static boolean joins(char first, char second) {
        return switch (first) {
            case ':' -> second == ':';
            case '.' -> second == '.';
            case '=' -> second == '=' || second == '>';
            default -> false;
        };
    }

    public boolean peekLifetime(int offset) {
        return peekToken(offset) instanceof Punct punct && punct.ch() == '\''
            && punct.spacing() == Spacing.JOINT
            && peekToken(offset + 1) instanceof Ident;
    }

    public boolean peekLifetime() {
        return peekLifetime(0);
    }

    public boolean peekGroup(Delimiter delimiter) {
        return peekGroup(0, delimiter);
    }

    public boolean peekGroup(int offset, Delimiter delimiter) {
        return peekToken(offset) instanceof Group group && group.delimiter() == delimiter;
    }

    public boolean peekStringLiteral() {
        return peekToken(0) instanceof Literal literal && literal.isString();
    }

    public Lookahead lookahead() {
        return new Lookahead(this);
    }

    // ==================== Consuming ====================

    public TokenTree next() {
        if (isEmpty()) {
            throw new ExpectedTokenException(List.of("token"), endSpan, true);
        }
        return tokens.get(current++);
    }

    public Span parseKeyword(String keyword) {
        if (!peekKeyword(keyword)) {
            throw expected("`" + keyword + "`");
        }
        return next().span();
    }

    /**
     * Consumes {@code keyword} if it is next, returning its span, or null.
     */
    public Span optionalKeyword(String keyword) {
        return peekKeyword(keyword) ? next().span() : null;
    }

    public Span parsePunct(String op) {
        if (!peekPunct(op)) {
            throw expected("`" + op + "`");
        }
        Span first = next().span();
        Span span = first;
        for (int i = 1; i < op.length(); i++) {
            span = first.join(next().span());
        }
        return span;
    }

    public Span optionalPunct(String op) {
        return peekPunct(op) ? parsePunct(op) : null;
    }

    public Ident parseIdent() {
        if (!peekIdent()) {
            throw expected("identifier");
        }
        return (Ident) next();
    }

    /**
     * Consumes an identifier or keyword.
     */
    public Ident parseAnyIdent() {
        if (!(peekToken(0) instanceof Ident)) {
            throw expected("identifier");
        }
        return (Ident) next();
    }

    public Group parseGroup(Delimiter delimiter) {
        if (!peekGroup(delimiter)) {
            throw expected(delimiter.description());
        }
        return (Group) next();
    }

    public Literal parseStringLiteral() {
        if (!peekStringLiteral()) {
            throw expected("string literal");
        }
        return (Literal) next();
    }

    /**
     * All remaining tokens of this level.
     */
    public TokenStream parseRest() {
        TokenStream rest = new TokenStream(tokens.subList(current, tokens.size()));
        current = tokens.size();
        return rest;
    }

    public void expectEnd() {
        if (!isEmpty()) {
            throw new ExpectedTokenException("unexpected token", span());
        }
    }

    // ==================== Errors ====================

    public ExpectedTokenException expected(String what) {
        return new ExpectedTokenException(List.of(what), span(), isEmpty());
    }
}
