package com.rsparser.jackson;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.rsparser.ast.*;
import com.rsparser.token.Group;
import com.rsparser.token.Ident;
import com.rsparser.token.Literal;
import com.rsparser.token.Punct;
import com.rsparser.token.Span;
import com.rsparser.token.TokenTree;

/**
 * Jackson module for the syntax tree and token classes.
 *
 * <p>Every sealed interface gets a mixin naming its records, so a value held as {@code Item}
 * or {@code TokenTree} is written with a {@code "type"} property and read back as the same
 * record. Spans are written as four-number arrays.</p>
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.rsparser", "rsparser-jackson"));
        addSerializer(Span.class, new SpanSerializer());
        addDeserializer(Span.class, new SpanDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Item.class, ItemMixin.class);
        context.setMixInAnnotations(ForeignItem.class, ForeignItemMixin.class);
        context.setMixInAnnotations(TraitItem.class, TraitItemMixin.class);
        context.setMixInAnnotations(ImplItem.class, ImplItemMixin.class);
        context.setMixInAnnotations(UseTree.class, UseTreeMixin.class);
        context.setMixInAnnotations(FnArg.class, FnArgMixin.class);

        context.setMixInAnnotations(Visibility.class, VisibilityMixin.class);
        context.setMixInAnnotations(Reference.class, ReferenceMixin.class);
        context.setMixInAnnotations(GenericParam.class, GenericParamMixin.class);
        context.setMixInAnnotations(PathArguments.class, PathArgumentsMixin.class);
        context.setMixInAnnotations(ReturnType.class, ReturnTypeMixin.class);
        context.setMixInAnnotations(Fields.class, FieldsMixin.class);
        context.setMixInAnnotations(Data.class, DataMixin.class);

        context.setMixInAnnotations(TokenTree.class, TokenTreeMixin.class);
    }

    // ==================== Items ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = ItemConst.class, name = "Const"),
        @JsonSubTypes.Type(value = ItemEnum.class, name = "Enum"),
        @JsonSubTypes.Type(value = ItemExternCrate.class, name = "ExternCrate"),
        @JsonSubTypes.Type(value = ItemFn.class, name = "Fn"),
        @JsonSubTypes.Type(value = ItemForeignMod.class, name = "ForeignMod"),
        @JsonSubTypes.Type(value = ItemImpl.class, name = "Impl"),
        @JsonSubTypes.Type(value = ItemMacro.class, name = "Macro"),
        @JsonSubTypes.Type(value = ItemMacro2.class, name = "Macro2"),
        @JsonSubTypes.Type(value = ItemMod.class, name = "Mod"),
        @JsonSubTypes.Type(value = ItemStatic.class, name = "Static"),
        @JsonSubTypes.Type(value = ItemStruct.class, name = "Struct"),
        @JsonSubTypes.Type(value = ItemTrait.class, name = "Trait"),
        @JsonSubTypes.Type(value = ItemTraitAlias.class, name = "TraitAlias"),
        @JsonSubTypes.Type(value = ItemType.class, name = "Type"),
        @JsonSubTypes.Type(value = ItemUnion.class, name = "Union"),
        @JsonSubTypes.Type(value = ItemUse.class, name = "Use"),
        @JsonSubTypes.Type(value = ItemVerbatim.class, name = "Verbatim")
    })
    private interface ItemMixin {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = ForeignItemFn.class, name = "Fn"),
        @JsonSubTypes.Type(value = ForeignItemStatic.class, name = "Static"),
        @JsonSubTypes.Type(value = ForeignItemType.class, name = "Type"),
        @JsonSubTypes.Type(value = ForeignItemMacro.class, name = "Macro"),
        @JsonSubTypes.Type(value = ForeignItemVerbatim.class, name = "Verbatim")
    })
    private interface ForeignItemMixin {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = TraitItemConst.class, name = "Const"),
        @JsonSubTypes.Type(value = TraitItemMethod.class, name = "Method"),
        @JsonSubTypes.Type(value = TraitItemType.class, name = "Type"),
        @JsonSubTypes.Type(value = TraitItemMacro.class, name = "Macro"),
        @JsonSubTypes.Type(value = TraitItemVerbatim.class, name = "Verbatim")
    })
    private interface TraitItemMixin {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = ImplItemConst.class, name = "Const"),
        @JsonSubTypes.Type(value = ImplItemMethod.class, name = "Method"),
        @JsonSubTypes.Type(value = ImplItemType.class, name = "Type"),
        @JsonSubTypes.Type(value = ImplItemMacro.class, name = "Macro"),
        @JsonSubTypes.Type(value = ImplItemVerbatim.class, name = "Verbatim")
    })
    private interface ImplItemMixin {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = UseTree.UsePath.class, name = "Path"),
        @JsonSubTypes.Type(value = UseTree.UseName.class, name = "Name"),
        @JsonSubTypes.Type(value = UseTree.UseRename.class, name = "Rename"),
        @JsonSubTypes.Type(value = UseTree.UseGlob.class, name = "Glob"),
        @JsonSubTypes.Type(value = UseTree.UseGroup.class, name = "Group")
    })
    private interface UseTreeMixin {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = Receiver.class, name = "Receiver"),
        @JsonSubTypes.Type(value = PatType.class, name = "Typed")
    })
    private interface FnArgMixin {
    }

    // ==================== Item parts ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = Visibility.Inherited.class, name = "Inherited"),
        @JsonSubTypes.Type(value = Visibility.Public.class, name = "Public"),
        @JsonSubTypes.Type(value = Visibility.Crate.class, name = "Crate"),
        @JsonSubTypes.Type(value = Visibility.Restricted.class, name = "Restricted")
    })
    private interface VisibilityMixin {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = Reference.None.class, name = "Value"),
        @JsonSubTypes.Type(value = Reference.Full.class, name = "Full"),
        @JsonSubTypes.Type(value = Reference.Partial.class, name = "Partial")
    })
    private interface ReferenceMixin {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = GenericParam.TypeParam.class, name = "Type"),
        @JsonSubTypes.Type(value = GenericParam.LifetimeParam.class, name = "Lifetime"),
        @JsonSubTypes.Type(value = GenericParam.ConstParam.class, name = "Const")
    })
    private interface GenericParamMixin {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = PathArguments.None.class, name = "None"),
        @JsonSubTypes.Type(value = PathArguments.AngleBracketed.class, name = "AngleBracketed"),
        @JsonSubTypes.Type(value = PathArguments.Parenthesized.class, name = "Parenthesized")
    })
    private interface PathArgumentsMixin {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = ReturnType.Default.class, name = "Default"),
        @JsonSubTypes.Type(value = ReturnType.Arrow.class, name = "Arrow")
    })
    private interface ReturnTypeMixin {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = FieldsNamed.class, name = "Named"),
        @JsonSubTypes.Type(value = FieldsUnnamed.class, name = "Unnamed"),
        @JsonSubTypes.Type(value = Fields.Unit.class, name = "Unit")
    })
    private interface FieldsMixin {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = Data.DataStruct.class, name = "Struct"),
        @JsonSubTypes.Type(value = Data.DataEnum.class, name = "Enum"),
        @JsonSubTypes.Type(value = Data.DataUnion.class, name = "Union")
    })
    private interface DataMixin {
    }

    // ==================== Tokens ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = Ident.class, name = "Ident"),
        @JsonSubTypes.Type(value = Punct.class, name = "Punct"),
        @JsonSubTypes.Type(value = Literal.class, name = "Literal"),
        @JsonSubTypes.Type(value = Group.class, name = "Group")
    })
    private interface TokenTreeMixin {
    }
}
