package com.rsparser;

import com.rsparser.token.Span;

import java.util.List;

/**
 * Thrown when the token at a decision point matches none of the alternatives that were tried.
 * Every alternative is listed, in the order it was tried.
 */
public class ExpectedTokenException extends ParseException {

    private final List<String> expected;

    public ExpectedTokenException(List<String> expected, Span span, boolean atEnd) {
        super(SYNTAX_ERROR, span, describe(expected, atEnd));
        this.expected = List.copyOf(expected);
    }

    public ExpectedTokenException(String message, Span span) {
        super(SYNTAX_ERROR, span, message);
        this.expected = List.of();
    }

    public List<String> getExpected() {
        return expected;
    }

    static String describe(List<String> expected, boolean atEnd) {
        String prefix = atEnd ? "unexpected end of input, " : "";
        return switch (expected.size()) {
            case 0 -> atEnd ? "unexpected end of input" : "unexpected token";
            case 1 -> prefix + "expected " + expected.get(0);
            case 2 -> prefix + "expected " + expected.get(0) + " or " + expected.get(1);
            default -> prefix + "expected one of: " + String.join(", ", expected);
        };
    }
}
