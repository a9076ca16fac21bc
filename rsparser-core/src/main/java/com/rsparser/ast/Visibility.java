package com.rsparser.ast;

import com.rsparser.token.Span;

public sealed interface Visibility permits
    Visibility.Inherited,
    Visibility.Public,
    Visibility.Crate,
    Visibility.Restricted {

    /** No visibility written. */
    record Inherited() implements Visibility {
    }

    /** {@code pub} */
    record Public(Span pub) implements Visibility {
    }

    /** {@code crate} */
    record Crate(Span crate) implements Visibility {
    }

    /**
     * {@code pub(crate)}, {@code pub(self)}, {@code pub(super)} or {@code pub(in some::path)}.
     *
     * @param in present only for the {@code in path} form
     */
    record Restricted(Span pub, Span paren, Span in, Path path) implements Visibility {
    }

    static Visibility inherited() {
        return new Inherited();
    }
}
