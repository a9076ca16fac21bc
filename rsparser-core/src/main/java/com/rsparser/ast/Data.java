package com.rsparser.ast;

import com.rsparser.token.Span;

/**
 * The body of a {@link DeriveInput}.
 */
public sealed interface Data permits Data.DataStruct, Data.DataEnum, Data.DataUnion {

    <R> R accept(Visitor<R> visitor);

    record DataStruct(Span structToken, Fields fields, Span semi) implements Data {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStruct(this);
        }
    }

    record DataEnum(Span enumToken, Span brace, Punctuated<Variant> variants) implements Data {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEnum(this);
        }
    }

    record DataUnion(Span unionToken, FieldsNamed fields) implements Data {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnion(this);
        }
    }

    interface Visitor<R> {
        R visitStruct(DataStruct data);

        R visitEnum(DataEnum data);

        R visitUnion(DataUnion data);
    }
}
