package com.rsparser.token;

/**
 * A single punctuation character. Multi-character operators are sequences of puncts where
 * every character but the last is {@link Spacing#JOINT}.
 */
public record Punct(char ch, Spacing spacing, Span span) implements TokenTree {

    public static final String CHARS = "~!@#$%^&*-=+|;:,./<>?'";

    public static boolean isPunctChar(char c) {
        return CHARS.indexOf(c) >= 0;
    }

    @Override
    public String toString() {
        return String.valueOf(ch);
    }
}
