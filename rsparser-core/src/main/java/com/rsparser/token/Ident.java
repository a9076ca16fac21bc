package com.rsparser.token;

/**
 * An identifier or keyword. Raw identifiers keep their {@code r#} prefix in {@code name}.
 */
public record Ident(String name, Span span) implements TokenTree {

    public static Ident of(String name) {
        return new Ident(name, Span.CALL_SITE);
    }

    public boolean isRaw() {
        return name.startsWith("r#");
    }

    /**
     * Name without the raw prefix.
     */
    public String unraw() {
        return isRaw() ? name.substring(2) : name;
    }

    @Override
    public String toString() {
        return name;
    }
}
