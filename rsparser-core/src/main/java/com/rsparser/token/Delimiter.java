package com.rsparser.token;

public enum Delimiter {
    PARENTHESIS("(", ")", "parentheses"),
    BRACE("{", "}", "curly braces"),
    BRACKET("[", "]", "square brackets"),
    NONE("", "", "invisible group");

    private final String open;
    private final String close;
    private final String description;

    Delimiter(String open, String close, String description) {
        this.open = open;
        this.close = close;
        this.description = description;
    }

    public String open() {
        return open;
    }

    public String close() {
        return close;
    }

    public String description() {
        return description;
    }

    public static Delimiter forOpen(char c) {
        return switch (c) {
            case '(' -> PARENTHESIS;
            case '{' -> BRACE;
            case '[' -> BRACKET;
            default -> null;
        };
    }
}
