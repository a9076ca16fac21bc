package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

/**
 * A path such as {@code std::fmt::Debug} or {@code ::core::ops::Fn(u8) -> u8}.
 *
 * @param leadingColon the {@code ::} before the first segment, if written
 */
public record Path(Span leadingColon, Punctuated<PathSegment> segments) {

    public static Path of(String... names) {
        PathSegment[] segments = new PathSegment[names.length];
        for (int i = 0; i < names.length; i++) {
            segments[i] = new PathSegment(Ident.of(names[i]), new PathArguments.None());
        }
        return new Path(null, Punctuated.of(segments));
    }

    /**
     * The single identifier of a one-segment path without arguments, or null.
     */
    public Ident soleIdent() {
        if (leadingColon != null || segments.size() != 1) return null;
        PathSegment segment = segments.get(0);
        return segment.arguments() instanceof PathArguments.None ? segment.ident() : null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(leadingColon != null ? "::" : "");
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) sb.append("::");
            sb.append(segments.get(i).ident().name());
        }
        return sb.toString();
    }
}
