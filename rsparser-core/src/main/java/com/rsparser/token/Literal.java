package com.rsparser.token;

/**
 * A literal kept exactly as written, quotes, prefixes and suffixes included.
 */
public record Literal(String repr, Span span) implements TokenTree {

    public static Literal string(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return new Literal(sb.append('"').toString(), Span.CALL_SITE);
    }

    /**
     * Whether this is a string literal, cooked or raw, without a byte prefix.
     */
    public boolean isString() {
        return repr.startsWith("\"") || repr.startsWith("r\"") || repr.startsWith("r#");
    }

    @Override
    public String toString() {
        return repr;
    }
}
