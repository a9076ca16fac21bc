package com.rsparser.ast;

/**
 * The body of a struct or enum variant.
 */
public sealed interface Fields permits FieldsNamed, FieldsUnnamed, Fields.Unit {

    /** No body at all, as in {@code struct Marker;}. */
    record Unit() implements Fields {
    }
}
