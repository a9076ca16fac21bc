package com.rsparser.ast;

import com.rsparser.token.Ident;

import java.util.List;

/**
 * The shape shared by structs, enums and unions, as consumed by derive-style processors.
 * Conversion to and from the corresponding {@link Item} variants is lossless.
 */
public record DeriveInput(
    List<Attribute> attrs,
    Visibility vis,
    Ident ident,
    Generics generics,
    Data data
) implements Node {

    public static DeriveInput from(ItemStruct item) {
        return new DeriveInput(item.attrs(), item.vis(), item.ident(), item.generics(),
            new Data.DataStruct(item.structToken(), item.fields(), item.semi()));
    }

    public static DeriveInput from(ItemEnum item) {
        return new DeriveInput(item.attrs(), item.vis(), item.ident(), item.generics(),
            new Data.DataEnum(item.enumToken(), item.brace(), item.variants()));
    }

    public static DeriveInput from(ItemUnion item) {
        return new DeriveInput(item.attrs(), item.vis(), item.ident(), item.generics(),
            new Data.DataUnion(item.unionToken(), item.fields()));
    }

    /**
     * Projects a struct, enum or union.
     *
     * @throws IllegalArgumentException for every other kind of item
     */
    public static DeriveInput fromItem(Item item) {
        return item.accept(new FromItem());
    }

    public Item toItem() {
        return data.accept(new Data.Visitor<Item>() {
            @Override
            public Item visitStruct(Data.DataStruct data) {
                return new ItemStruct(attrs, vis, data.structToken(), ident, generics, data.fields(), data.semi());
            }

            @Override
            public Item visitEnum(Data.DataEnum data) {
                return new ItemEnum(attrs, vis, data.enumToken(), ident, generics, data.brace(), data.variants());
            }

            @Override
            public Item visitUnion(Data.DataUnion data) {
                return new ItemUnion(attrs, vis, data.unionToken(), ident, generics, data.fields());
            }
        });
    }

    private static final class FromItem implements Item.Visitor<DeriveInput> {

        private static DeriveInput reject(String kind) {
            throw new IllegalArgumentException("expected struct, enum or union, found " + kind);
        }

        @Override
        public DeriveInput visitStruct(ItemStruct item) {
            return from(item);
        }

        @Override
        public DeriveInput visitEnum(ItemEnum item) {
            return from(item);
        }

        @Override
        public DeriveInput visitUnion(ItemUnion item) {
            return from(item);
        }

        @Override
        public DeriveInput visitConst(ItemConst item) {
            return reject("constant");
        }

        @Override
        public DeriveInput visitExternCrate(ItemExternCrate item) {
            return reject("extern crate");
        }

        @Override
        public DeriveInput visitFn(ItemFn item) {
            return reject("function");
        }

        @Override
        public DeriveInput visitForeignMod(ItemForeignMod item) {
            return reject("extern block");
        }

        @Override
        public DeriveInput visitImpl(ItemImpl item) {
            return reject("impl block");
        }

        @Override
        public DeriveInput visitMacro(ItemMacro item) {
            return reject("macro invocation");
        }

        @Override
        public DeriveInput visitMacro2(ItemMacro2 item) {
            return reject("macro definition");
        }

        @Override
        public DeriveInput visitMod(ItemMod item) {
            return reject("module");
        }

        @Override
        public DeriveInput visitStatic(ItemStatic item) {
            return reject("static");
        }

        @Override
        public DeriveInput visitTrait(ItemTrait item) {
            return reject("trait");
        }

        @Override
        public DeriveInput visitTraitAlias(ItemTraitAlias item) {
            return reject("trait alias");
        }

        @Override
        public DeriveInput visitType(ItemType item) {
            return reject("type alias");
        }

        @Override
        public DeriveInput visitUse(ItemUse item) {
            return reject("use declaration");
        }

        @Override
        public DeriveInput visitVerbatim(ItemVerbatim item) {
            return reject("unparsed tokens");
        }
    }
}
