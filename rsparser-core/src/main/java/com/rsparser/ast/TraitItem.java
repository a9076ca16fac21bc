package com.rsparser.ast;

import java.util.List;

/**
 * A member of a trait body. Methods and constants may have a default.
 */
public sealed interface TraitItem extends Node permits
    TraitItemConst,
    TraitItemMethod,
    TraitItemType,
    TraitItemMacro,
    TraitItemVerbatim {

    List<Attribute> attrs();

    TraitItem withAttrs(List<Attribute> attrs);

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitConst(TraitItemConst item);

        R visitMethod(TraitItemMethod item);

        R visitType(TraitItemType item);

        R visitMacro(TraitItemMacro item);

        R visitVerbatim(TraitItemVerbatim item);
    }
}
