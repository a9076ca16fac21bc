package com.rsparser.ast;

/**
 * Root of the syntax tree types that can be parsed, printed and serialized on their own.
 */
public sealed interface Node permits
    SourceFile,
    Item,
    ForeignItem,
    TraitItem,
    ImplItem,
    UseTree,
    FnArg,
    Signature,
    DeriveInput {
}
