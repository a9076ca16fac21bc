package com.rsparser.ast;

import java.util.List;

/**
 * A declaration at module level.
 *
 * <p>The set of variants is closed. {@link ItemVerbatim} holds tokens that are syntactically
 * bounded but not otherwise understood, and is the only place unknown syntax can go. Code that
 * must handle every variant goes through {@link Visitor}, so adding a variant is a compile error
 * wherever it is not yet handled.</p>
 */
public sealed interface Item extends Node permits
    ItemConst,
    ItemEnum,
    ItemExternCrate,
    ItemFn,
    ItemForeignMod,
    ItemImpl,
    ItemMacro,
    ItemMacro2,
    ItemMod,
    ItemStatic,
    ItemStruct,
    ItemTrait,
    ItemTraitAlias,
    ItemType,
    ItemUnion,
    ItemUse,
    ItemVerbatim {

    /**
     * Outer attributes followed by the inner attributes of the body, if it has any.
     */
    List<Attribute> attrs();

    /**
     * A copy of this item with {@code attrs} in place of its attributes.
     */
    Item withAttrs(List<Attribute> attrs);

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitConst(ItemConst item);

        R visitEnum(ItemEnum item);

        R visitExternCrate(ItemExternCrate item);

        R visitFn(ItemFn item);

        R visitForeignMod(ItemForeignMod item);

        R visitImpl(ItemImpl item);

        R visitMacro(ItemMacro item);

        R visitMacro2(ItemMacro2 item);

        R visitMod(ItemMod item);

        R visitStatic(ItemStatic item);

        R visitStruct(ItemStruct item);

        R visitTrait(ItemTrait item);

        R visitTraitAlias(ItemTraitAlias item);

        R visitType(ItemType item);

        R visitUnion(ItemUnion item);

        R visitUse(ItemUse item);

        R visitVerbatim(ItemVerbatim item);
    }
}
