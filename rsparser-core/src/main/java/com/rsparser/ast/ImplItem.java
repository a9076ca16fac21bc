package com.rsparser.ast;

import java.util.List;

/**
 * A member of an impl block. Every method has a body.
 */
public sealed interface ImplItem extends Node permits
    ImplItemConst,
    ImplItemMethod,
    ImplItemType,
    ImplItemMacro,
    ImplItemVerbatim {

    List<Attribute> attrs();

    ImplItem withAttrs(List<Attribute> attrs);

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitConst(ImplItemConst item);

        R visitMethod(ImplItemMethod item);

        R visitType(ImplItemType item);

        R visitMacro(ImplItemMacro item);

        R visitVerbatim(ImplItemVerbatim item);
    }
}
