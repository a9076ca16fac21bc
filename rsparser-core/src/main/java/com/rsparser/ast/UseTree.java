package com.rsparser.ast;

import com.rsparser.token.Ident;
import com.rsparser.token.Span;

/**
 * The import tree after {@code use}. {@link UsePath} and {@link UseGroup} nest further trees;
 * the other variants are leaves.
 */
public sealed interface UseTree extends Node permits
    UseTree.UsePath,
    UseTree.UseName,
    UseTree.UseRename,
    UseTree.UseGlob,
    UseTree.UseGroup {

    <R> R accept(Visitor<R> visitor);

    /** {@code a::...} */
    record UsePath(Ident ident, Span colon2, UseTree tree) implements UseTree {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPath(this);
        }
    }

    /** {@code a} */
    record UseName(Ident ident) implements UseTree {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitName(this);
        }
    }

    /** {@code a as b} */
    record UseRename(Ident ident, Span asToken, Ident rename) implements UseTree {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRename(this);
        }
    }

    /** {@code *} */
    record UseGlob(Span star) implements UseTree {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGlob(this);
        }
    }

    /** {@code {a, b::c}} */
    record UseGroup(Span brace, Punctuated<UseTree> items) implements UseTree {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGroup(this);
        }
    }

    interface Visitor<R> {
        R visitPath(UsePath path);

        R visitName(UseName name);

        R visitRename(UseRename rename);

        R visitGlob(UseGlob glob);

        R visitGroup(UseGroup group);
    }
}
