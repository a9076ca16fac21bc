package com.rsparser.ast;

import java.util.List;

/**
 * A member of an {@code extern} block.
 */
public sealed interface ForeignItem extends Node permits
    ForeignItemFn,
    ForeignItemStatic,
    ForeignItemType,
    ForeignItemMacro,
    ForeignItemVerbatim {

    List<Attribute> attrs();

    ForeignItem withAttrs(List<Attribute> attrs);

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitFn(ForeignItemFn item);

        R visitStatic(ForeignItemStatic item);

        R visitType(ForeignItemType item);

        R visitMacro(ForeignItemMacro item);

        R visitVerbatim(ForeignItemVerbatim item);
    }
}
