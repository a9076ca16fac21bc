package com.rsparser.token;

import java.util.List;

/**
 * An immutable sequence of token trees.
 */
public record TokenStream(List<TokenTree> trees) {

    public TokenStream {
        trees = List.copyOf(trees);
    }

    public static TokenStream empty() {
        return new TokenStream(List.of());
    }

    public static TokenStream of(TokenTree... trees) {
        return new TokenStream(List.of(trees));
    }

    public boolean isEmpty() {
        return trees.isEmpty();
    }

    public int size() {
        return trees.size();
    }

    public TokenTree get(int index) {
        return trees.get(index);
    }

    /**
     * Token equality ignoring spans and spacing, i.e. equality up to whitespace and comments.
     */
    public boolean sameTokens(TokenStream other) {
        if (other == null || trees.size() != other.trees.size()) return false;
        for (int i = 0; i < trees.size(); i++) {
            if (!sameToken(trees.get(i), other.trees.get(i))) return false;
        }
        return true;
    }

    private static boolean sameToken(TokenTree a, TokenTree b) {
        if (a instanceof Ident x && b instanceof Ident y) {
            return x.name().equals(y.name());
        }
        if (a instanceof Punct x && b instanceof Punct y) {
            return x.ch() == y.ch();
        }
        if (a instanceof Literal x && b instanceof Literal y) {
            return x.repr().equals(y.repr());
        }
        if (a instanceof Group x && b instanceof Group y) {
            return x.delimiter() == y.delimiter() && x.stream().sameTokens(y.stream());
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        TokenTree previous = null;
        for (TokenTree tree : trees) {
            boolean joined = previous instanceof Punct p && p.spacing() == Spacing.JOINT;
            if (previous != null && !joined) {
                sb.append(' ');
            }
            sb.append(tree);
            previous = tree;
        }
        return sb.toString();
    }
}
