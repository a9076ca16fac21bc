package com.rsparser.ast;

public enum AttrStyle {
    /** {@code #[...]} */
    OUTER,
    /** {@code #![...]} */
    INNER
}
