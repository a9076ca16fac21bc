package com.rsparser.ast;

import com.rsparser.token.Span;

/**
 * How a {@link Receiver} accesses the instance. A receiver has exactly one of these.
 */
public sealed interface Reference permits Reference.None, Reference.Full, Reference.Partial {

    /** {@code self} or {@code mut self}. */
    record None(Span mutability) implements Reference {
    }

    /** {@code &self}, {@code &mut self}, {@code &'a self}, {@code &'a mut self}. */
    record Full(Span ampersand, Lifetime lifetime, Span mutability) implements Reference {
    }

    /** {@code self.{mut a, b}}: borrows of individual fields. */
    record Partial(Span dot, PartialBorrows borrows) implements Reference {
    }
}
