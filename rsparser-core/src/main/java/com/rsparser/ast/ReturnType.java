package com.rsparser.ast;

import com.rsparser.token.Span;

public sealed interface ReturnType permits ReturnType.Default, ReturnType.Arrow {

    /** No return type written. */
    record Default() implements ReturnType {
    }

    /** {@code -> Type} */
    record Arrow(Span arrow, Type ty) implements ReturnType {
    }
}
