package com.rsparser.token;

import com.rsparser.ParseException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Turns source text into a {@link TokenStream} of nested groups.
 *
 * <p>Comments are dropped, except doc comments, which become {@code #[doc = "..."]}
 * (or {@code #![doc = "..."]} for inner doc comments) attributes.</p>
 */
public class Lexer {

    private final String source;
    private int pos = 0;
    private int line = 1;
    private int lineStart = 0;

    public Lexer(String source) {
        this.source = source;
    }

    public static TokenStream tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    private static final class Frame {
        final Delimiter delimiter;
        final int line;
        final int column;
        final List<TokenTree> trees = new ArrayList<>();

        Frame(Delimiter delimiter, int line, int column) {
            this.delimiter = delimiter;
            this.line = line;
            this.column = column;
        }
    }

    public TokenStream tokenize() {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(Delimiter.NONE, 1, 0));

        while (true) {
            skipTrivia(stack.peek().trees);
            if (isAtEnd()) break;

            char c = peekChar(0);
            Delimiter open = Delimiter.forOpen(c);
            if (open != null) {
                stack.push(new Frame(open, line, column()));
                advanceChar();
                continue;
            }
            if (c == ')' || c == ']' || c == '}') {
                Frame frame = stack.pop();
                if (frame.delimiter == Delimiter.NONE || frame.delimiter.close().charAt(0) != c) {
                    throw error("unexpected closing delimiter `" + c + "`", 1);
                }
                advanceChar();
                Span span = new Span(frame.line, frame.column, line, column());
                stack.peek().trees.add(new Group(frame.delimiter, new TokenStream(frame.trees), span));
                continue;
            }

            List<TokenTree> out = stack.peek().trees;
            if (c == '\'') {
                lexQuote(out);
            } else if (c == '"') {
                out.add(lexString(pos));
            } else if (Character.isDigit(c)) {
                out.add(lexNumber());
            } else if (isIdentStart(c)) {
                lexIdentOrPrefixed(out);
            } else if (Punct.isPunctChar(c)) {
                out.add(lexPunct());
            } else {
                throw error("unexpected character `" + c + "`", 1);
            }
        }

        if (stack.size() > 1) {
            Frame unclosed = stack.peek();
            throw new ParseException(ParseException.LEX_ERROR, Span.of(unclosed.line, unclosed.column, 1),
                "unclosed delimiter `" + unclosed.delimiter.open() + "`");
        }
        return new TokenStream(stack.pop().trees);
    }

    // ==================== Trivia ====================

    private void skipTrivia(List<TokenTree> out) {
        while (!isAtEnd()) {
            char c = peekChar(0);
            if (Character.isWhitespace(c)) {
                advanceChar();
            } else if (c == '/' && peekChar(1) == '/') {
                lexLineComment(out);
            } else if (c == '/' && peekChar(1) == '*') {
                lexBlockComment(out);
            } else {
                return;
            }
        }
    }

    private void lexLineComment(List<TokenTree> out) {
        int startLine = line;
        int startColumn = column();
        int start = pos;
        while (!isAtEnd() && peekChar(0) != '\n') {
            advanceChar();
        }
        String text = source.substring(start, pos);
        Span span = new Span(startLine, startColumn, line, column());
        if (text.startsWith("///") && !text.startsWith("////")) {
            emitDoc(out, text.substring(3), false, span);
        } else if (text.startsWith("//!")) {
            emitDoc(out, text.substring(3), true, span);
        }
    }

    private void lexBlockComment(List<TokenTree> out) {
        int startLine = line;
        int startColumn = column();
        int start = pos;
        advanceChar();
        advanceChar();
        int depth = 1;
        while (depth > 0) {
            if (isAtEnd()) {
                throw new ParseException(ParseException.LEX_ERROR, Span.of(startLine, startColumn, 2),
                    "unterminated block comment");
            }
            if (peekChar(0) == '/' && peekChar(1) == '*') {
                advanceChar();
                advanceChar();
                depth++;
            } else if (peekChar(0) == '*' && peekChar(1) == '/') {
                advanceChar();
                advanceChar();
                depth--;
            } else {
                advanceChar();
            }
        }
        String text = source.substring(start, pos);
        Span span = new Span(startLine, startColumn, line, column());
        String body = text.substring(3, text.length() - 2);
        if (text.startsWith("/**") && !text.startsWith("/***") && !text.equals("/**/")) {
            emitDoc(out, body, false, span);
        } else if (text.startsWith("/*!")) {
            emitDoc(out, body, true, span);
        }
    }

    private static void emitDoc(List<TokenTree> out, String text, boolean inner, Span span) {
        if (inner) {
            out.add(new Punct('#', Spacing.JOINT, span));
            out.add(new Punct('!', Spacing.ALONE, span));
        } else {
            out.add(new Punct('#', Spacing.ALONE, span));
        }
        Literal value = Literal.string(text);
        TokenStream body = TokenStream.of(
            new Ident("doc", span),
            new Punct('=', Spacing.ALONE, span),
            new Literal(value.repr(), span));
        out.add(new Group(Delimiter.BRACKET, body, span));
    }

    // ==================== Tokens ====================

    private void lexIdentOrPrefixed(List<TokenTree> out) {
        char c = peekChar(0);
        char next = peekChar(1);
        if (c == 'r' && next == '#' && isIdentStart(peekChar(2))) {
            int startColumn = column();
            int start = pos;
            advanceChar();
            advanceChar();
            consumeIdentChars();
            out.add(new Ident(source.substring(start, pos), Span.of(line, startColumn, pos - start)));
            return;
        }
        if (c == 'r' && (next == '"' || (next == '#' && (peekChar(2) == '#' || peekChar(2) == '"')))) {
            out.add(lexRawString(pos, 1));
            return;
        }
        if (c == 'b' && next == '\'') {
            out.add(lexCharLiteral(pos, 1));
            return;
        }
        if (c == 'b' && next == '"') {
            out.add(lexString(pos));
            return;
        }
        if (c == 'b' && next == 'r' && (peekChar(2) == '"' || peekChar(2) == '#')) {
            out.add(lexRawString(pos, 2));
            return;
        }

        int startColumn = column();
        int start = pos;
        consumeIdentChars();
        out.add(new Ident(source.substring(start, pos), Span.of(line, startColumn, pos - start)));
    }

    private void lexQuote(List<TokenTree> out) {
        char next = peekChar(1);
        if (next != '\\' && isIdentStart(next) && peekChar(2) != '\'') {
            int startColumn = column();
            advanceChar();
            out.add(new Punct('\'', Spacing.JOINT, Span.of(line, startColumn, 1)));
            int start = pos;
            int identColumn = column();
            consumeIdentChars();
            out.add(new Ident(source.substring(start, pos), Span.of(line, identColumn, pos - start)));
            return;
        }
        out.add(lexCharLiteral(pos, 0));
    }

    private Literal lexCharLiteral(int start, int prefixLength) {
        int startLine = line;
        int startColumn = column();
        for (int i = 0; i <= prefixLength; i++) {
            advanceChar();
        }
        while (true) {
            if (isAtEnd() || peekChar(0) == '\n') {
                throw new ParseException(ParseException.LEX_ERROR, Span.of(startLine, startColumn, 1),
                    "unterminated character literal");
            }
            char c = peekChar(0);
            advanceChar();
            if (c == '\\') {
                advanceChar();
            } else if (c == '\'') {
                break;
            }
        }
        consumeIdentChars();
        return new Literal(source.substring(start, pos), new Span(startLine, startColumn, line, column()));
    }

    private Literal lexString(int start) {
        int startLine = line;
        int startColumn = column();
        if (peekChar(0) == 'b') {
            advanceChar();
        }
        advanceChar();
        while (true) {
            if (isAtEnd()) {
                throw new ParseException(ParseException.LEX_ERROR, Span.of(startLine, startColumn, 1),
                    "unterminated string literal");
            }
            char c = peekChar(0);
            advanceChar();
            if (c == '\\') {
                advanceChar();
            } else if (c == '"') {
                break;
            }
        }
        consumeIdentChars();
        return new Literal(source.substring(start, pos), new Span(startLine, startColumn, line, column()));
    }

    private Literal lexRawString(int start, int prefixLength) {
        int startLine = line;
        int startColumn = column();
        for (int i = 0; i < prefixLength; i++) {
            advanceChar();
        }
        int hashes = 0;
        while (peekChar(0) == '#') {
            advanceChar();
            hashes++;
        }
        if (peekChar(0) != '"') {
            throw error("expected `\"` in raw string literal", 1);
        }
        advanceChar();
        while (true) {
            if (isAtEnd()) {
                throw new ParseException(ParseException.LEX_ERROR, Span.of(startLine, startColumn, 1),
                    "unterminated raw string literal");
            }
            char c = peekChar(0);
            advanceChar();
            if (c == '"' && closesRawString(hashes)) {
                for (int i = 0; i < hashes; i++) {
                    advanceChar();
                }
                break;
            }
        }
        consumeIdentChars();
        return new Literal(source.substring(start, pos), new Span(startLine, startColumn, line, column()));
    }

    private boolean closesRawString(int hashes) {
        for (int i = 0; i < hashes; i++) {
            if (peekChar(i) != '#') return false;
        }
        return true;
    }

    private Literal lexNumber() {
        int startColumn = column();
        int start = pos;
        boolean radixPrefix = peekChar(0) == '0' && "xob".indexOf(peekChar(1)) >= 0;
        consumeNumberChars(radixPrefix);
        if (!radixPrefix && peekChar(0) == '.' && Character.isDigit(peekChar(1))) {
            advanceChar();
            consumeNumberChars(false);
        }
        return new Literal(source.substring(start, pos), Span.of(line, startColumn, pos - start));
    }

    private void consumeNumberChars(boolean radixPrefix) {
        while (!isAtEnd()) {
            char c = peekChar(0);
            if (Character.isLetterOrDigit(c) || c == '_') {
                advanceChar();
                boolean exponent = !radixPrefix && (c == 'e' || c == 'E');
                if (exponent && (peekChar(0) == '+' || peekChar(0) == '-') && Character.isDigit(peekChar(1))) {
                    advanceChar();
                }
            } else {
                return;
            }
        }
    }

    private Punct lexPunct() {
        char c = peekChar(0);
        int startColumn = column();
        advanceChar();
        char next = peekChar(0);
        boolean startsComment = next == '/' && (peekChar(1) == '/' || peekChar(1) == '*');
        Spacing spacing = Punct.isPunctChar(next) && !startsComment ? Spacing.JOINT : Spacing.ALONE;
        return new Punct(c, spacing, Span.of(line, startColumn, 1));
    }

    // ==================== Helpers ====================

    private static boolean isIdentStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private void consumeIdentChars() {
        while (!isAtEnd() && (Character.isLetterOrDigit(peekChar(0)) || peekChar(0) == '_')) {
            advanceChar();
        }
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private char peekChar(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private void advanceChar() {
        if (isAtEnd()) return;
        if (source.charAt(pos) == '\n') {
            line++;
            lineStart = pos + 1;
        }
        pos++;
    }

    private int column() {
        return pos - lineStart;
    }

    private ParseException error(String message, int length) {
        return new ParseException(ParseException.LEX_ERROR, Span.of(line, column(), length), message);
    }
}
