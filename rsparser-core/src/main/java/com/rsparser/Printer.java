package com.rsparser;

import com.rsparser.ast.*;
import com.rsparser.token.Delimiter;
import com.rsparser.token.Span;
import com.rsparser.token.TokenStream;

import java.util.List;
import java.util.function.Consumer;

/**
 * Writes syntax trees back to tokens.
 *
 * <p>Output re-parses to an equal tree. Tokens a tree does not record (a trailing {@code ;}
 * of a tuple struct, the {@code :} before supertraits, the comma before {@code ...}) are
 * synthesized at {@link Span#CALL_SITE}, so hand-built trees print as valid source.
 * Attributes are split by style: outer ones before the item, inner ones at the top of its
 * body.</p>
 */
public class Printer implements Item.Visitor<Void>, ForeignItem.Visitor<Void>,
        TraitItem.Visitor<Void>, ImplItem.Visitor<Void>, UseTree.Visitor<Void> {

    private TokenStreamBuilder out = new TokenStreamBuilder();

    private Printer() {
    }

    public static TokenStream print(Node node) {
        Printer printer = new Printer();
        printer.node(node);
        return printer.out.build();
    }

    public static String toSource(Node node) {
        return print(node).toString();
    }

    private void node(Node node) {
        if (node instanceof SourceFile file) {
            innerAttrs(file.attrs());
            file.items().forEach(this::item);
        } else if (node instanceof Item item) {
            item(item);
        } else if (node instanceof ForeignItem item) {
            item.accept(this);
        } else if (node instanceof TraitItem item) {
            item.accept(this);
        } else if (node instanceof ImplItem item) {
            item.accept(this);
        } else if (node instanceof UseTree tree) {
            tree.accept(this);
        } else if (node instanceof FnArg arg) {
            fnArg(arg);
        } else if (node instanceof Signature sig) {
            signature(sig);
        } else if (node instanceof DeriveInput input) {
            item(input.toItem());
        } else {
            throw new AssertionError("unknown node " + node);
        }
    }

    private void item(Item item) {
        item.accept(this);
    }

    /**
     * Runs {@code body} with output redirected into a delimited group.
     */
    private void surround(Delimiter delimiter, Span span, Runnable body) {
        TokenStreamBuilder enclosing = out;
        enclosing.surround(delimiter, span, inner -> {
            out = inner;
            try {
                body.run();
            } finally {
                out = enclosing;
            }
        });
    }

    // ========================================================================
    // Items
    // ========================================================================

    @Override
    public Void visitConst(ItemConst item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        out.keyword("const", item.constToken());
        out.ident(item.ident());
        out.punct(":", item.colon());
        out.append(item.ty().tokens());
        out.punct("=", item.eq());
        out.append(item.expr().tokens());
        out.punct(";", item.semi());
        return null;
    }

    @Override
    public Void visitEnum(ItemEnum item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        out.keyword("enum", item.enumToken());
        out.ident(item.ident());
        genericParams(item.generics());
        whereClause(item.generics().whereClause());
        surround(Delimiter.BRACE, item.brace(), () -> punctuated(item.variants(), ",", this::variant));
        return null;
    }

    private void variant(Variant variant) {
        outerAttrs(variant.attrs());
        out.ident(variant.ident());
        fields(variant.fields());
        if (variant.discriminant() != null) {
            out.punct("=", variant.eq());
            out.append(variant.discriminant().tokens());
        }
    }

    @Override
    public Void visitExternCrate(ItemExternCrate item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        out.keyword("extern", item.externToken());
        out.keyword("crate", item.crateToken());
        out.ident(item.ident());
        if (item.rename() != null) {
            out.keyword("as", item.asToken());
            out.ident(item.rename());
        }
        out.punct(";", item.semi());
        return null;
    }

    @Override
    public Void visitFn(ItemFn item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        signature(item.sig());
        block(item.attrs(), item.block());
        return null;
    }

    @Override
    public Void visitForeignMod(ItemForeignMod item) {
        outerAttrs(item.attrs());
        abi(item.abi());
        surround(Delimiter.BRACE, item.brace(), () -> {
            innerAttrs(item.attrs());
            item.items().forEach(member -> member.accept(this));
        });
        return null;
    }

    @Override
    public Void visitImpl(ItemImpl item) {
        outerAttrs(item.attrs());
        out.optionalKeyword("default", item.defaultness());
        out.optionalKeyword("unsafe", item.unsafety());
        out.keyword("impl", item.implToken());
        genericParams(item.generics());
        if (item.trait() != null) {
            out.optionalPunct("!", item.bang());
            path(item.trait());
            out.keyword("for", item.forToken());
        }
        out.append(item.selfTy().tokens());
        whereClause(item.generics().whereClause());
        surround(Delimiter.BRACE, item.brace(), () -> {
            innerAttrs(item.attrs());
            item.items().forEach(member -> member.accept(this));
        });
        return null;
    }

    @Override
    public Void visitMacro(ItemMacro item) {
        outerAttrs(item.attrs());
        path(item.mac().path());
        out.punct("!", item.mac().bang());
        if (item.ident() != null) {
            out.ident(item.ident());
        }
        macroBody(item.mac());
        macroSemi(item.mac(), item.semi());
        return null;
    }

    @Override
    public Void visitMacro2(ItemMacro2 item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        out.keyword("macro", item.macroToken());
        out.ident(item.ident());
        out.append(item.rules());
        return null;
    }

    @Override
    public Void visitMod(ItemMod item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        out.keyword("mod", item.modToken());
        out.ident(item.ident());
        if (item.content() != null) {
            surround(Delimiter.BRACE, item.brace(), () -> {
                innerAttrs(item.attrs());
                item.content().forEach(this::item);
            });
        } else {
            out.punct(";", item.semi());
        }
        return null;
    }

    @Override
    public Void visitStatic(ItemStatic item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        out.keyword("static", item.staticToken());
        out.optionalKeyword("mut", item.mutability());
        out.ident(item.ident());
        out.punct(":", item.colon());
        out.append(item.ty().tokens());
        out.punct("=", item.eq());
        out.append(item.expr().tokens());
        out.punct(";", item.semi());
        return null;
    }

    @Override
    public Void visitStruct(ItemStruct item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        out.keyword("struct", item.structToken());
        out.ident(item.ident());
        genericParams(item.generics());
        WhereClause where = item.generics().whereClause();
        Fields fields = item.fields();
        if (fields instanceof FieldsNamed) {
            whereClause(where);
            fields(fields);
        } else if (fields instanceof FieldsUnnamed) {
            fields(fields);
            whereClause(where);
            out.punct(";", item.semi());
        } else {
            whereClause(where);
            out.punct(";", item.semi());
        }
        return null;
    }

    @Override
    public Void visitTrait(ItemTrait item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        out.optionalKeyword("unsafe", item.unsafety());
        out.optionalKeyword("auto", item.autoToken());
        out.keyword("trait", item.traitToken());
        out.ident(item.ident());
        genericParams(item.generics());
        if (item.colon() != null || !item.supertraits().isEmpty()) {
            out.punct(":", item.colon());
            bounds(item.supertraits());
        }
        whereClause(item.generics().whereClause());
        surround(Delimiter.BRACE, item.brace(), () -> {
            innerAttrs(item.attrs());
            item.items().forEach(member -> member.accept(this));
        });
        return null;
    }

    @Override
    public Void visitTraitAlias(ItemTraitAlias item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        out.keyword("trait", item.traitToken());
        out.ident(item.ident());
        genericParams(item.generics());
        out.punct("=", item.eq());
        bounds(item.bounds());
        whereClause(item.generics().whereClause());
        out.punct(";", item.semi());
        return null;
    }

    @Override
    public Void visitType(ItemType item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        out.keyword("type", item.typeToken());
        out.ident(item.ident());
        genericParams(item.generics());
        whereClause(item.generics().whereClause());
        out.punct("=", item.eq());
        out.append(item.ty().tokens());
        out.punct(";", item.semi());
        return null;
    }

    @Override
    public Void visitUnion(ItemUnion item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        out.keyword("union", item.unionToken());
        out.ident(item.ident());
        genericParams(item.generics());
        whereClause(item.generics().whereClause());
        fields(item.fields());
        return null;
    }

    @Override
    public Void visitUse(ItemUse item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        out.keyword("use", item.useToken());
        out.optionalPunct("::", item.leadingColon());
        item.tree().accept(this);
        out.punct(";", item.semi());
        return null;
    }

    @Override
    public Void visitVerbatim(ItemVerbatim item) {
        out.append(item.tokens());
        return null;
    }

    // ========================================================================
    // Foreign items
    // ========================================================================

    @Override
    public Void visitFn(ForeignItemFn item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        signature(item.sig());
        out.punct(";", item.semi());
        return null;
    }

    @Override
    public Void visitStatic(ForeignItemStatic item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        out.keyword("static", item.staticToken());
        out.optionalKeyword("mut", item.mutability());
        out.ident(item.ident());
        out.punct(":", item.colon());
        out.append(item.ty().tokens());
        out.punct(";", item.semi());
        return null;
    }

    @Override
    public Void visitType(ForeignItemType item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        out.keyword("type", item.typeToken());
        out.ident(item.ident());
        out.punct(";", item.semi());
        return null;
    }

    @Override
    public Void visitMacro(ForeignItemMacro item) {
        outerAttrs(item.attrs());
        macro(item.mac());
        macroSemi(item.mac(), item.semi());
        return null;
    }

    @Override
    public Void visitVerbatim(ForeignItemVerbatim item) {
        out.append(item.tokens());
        return null;
    }

    // ========================================================================
    // Trait items
    // ========================================================================

    @Override
    public Void visitConst(TraitItemConst item) {
        outerAttrs(item.attrs());
        out.keyword("const", item.constToken());
        out.ident(item.ident());
        out.punct(":", item.colon());
        out.append(item.ty().tokens());
        if (item.defaultValue() != null) {
            out.punct("=", item.eq());
            out.append(item.defaultValue().tokens());
        }
        out.punct(";", item.semi());
        return null;
    }

    @Override
    public Void visitMethod(TraitItemMethod item) {
        outerAttrs(item.attrs());
        signature(item.sig());
        if (item.defaultBody() != null) {
            block(item.attrs(), item.defaultBody());
        } else {
            out.punct(";", item.semi());
        }
        return null;
    }

    @Override
    public Void visitType(TraitItemType item) {
        outerAttrs(item.attrs());
        out.keyword("type", item.typeToken());
        out.ident(item.ident());
        genericParams(item.generics());
        if (item.colon() != null || !item.bounds().isEmpty()) {
            out.punct(":", item.colon());
            bounds(item.bounds());
        }
        whereClause(item.generics().whereClause());
        if (item.defaultType() != null) {
            out.punct("=", item.eq());
            out.append(item.defaultType().tokens());
        }
        out.punct(";", item.semi());
        return null;
    }

    @Override
    public Void visitMacro(TraitItemMacro item) {
        outerAttrs(item.attrs());
        macro(item.mac());
        macroSemi(item.mac(), item.semi());
        return null;
    }

    @Override
    public Void visitVerbatim(TraitItemVerbatim item) {
        out.append(item.tokens());
        return null;
    }

    // ========================================================================
    // Impl items
    // ========================================================================

    @Override
    public Void visitConst(ImplItemConst item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        out.optionalKeyword("default", item.defaultness());
        out.keyword("const", item.constToken());
        out.ident(item.ident());
        out.punct(":", item.colon());
        out.append(item.ty().tokens());
        out.punct("=", item.eq());
        out.append(item.expr().tokens());
        out.punct(";", item.semi());
        return null;
    }

    @Override
    public Void visitMethod(ImplItemMethod item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        out.optionalKeyword("default", item.defaultness());
        signature(item.sig());
        block(item.attrs(), item.block());
        return null;
    }

    @Override
    public Void visitType(ImplItemType item) {
        outerAttrs(item.attrs());
        visibility(item.vis());
        out.optionalKeyword("default", item.defaultness());
        out.keyword("type", item.typeToken());
        out.ident(item.ident());
        genericParams(item.generics());
        whereClause(item.generics().whereClause());
        out.punct("=", item.eq());
        out.append(item.ty().tokens());
        out.punct(";", item.semi());
        return null;
    }

    @Override
    public Void visitMacro(ImplItemMacro item) {
        outerAttrs(item.attrs());
        macro(item.mac());
        macroSemi(item.mac(), item.semi());
        return null;
    }

    @Override
    public Void visitVerbatim(ImplItemVerbatim item) {
        out.append(item.tokens());
        return null;
    }

    // ========================================================================
    // Use trees
    // ========================================================================

    @Override
    public Void visitPath(UseTree.UsePath tree) {
        out.ident(tree.ident());
        out.punct("::", tree.colon2());
        tree.tree().accept(this);
        return null;
    }

    @Override
    public Void visitName(UseTree.UseName tree) {
        out.ident(tree.ident());
        return null;
    }

    @Override
    public Void visitRename(UseTree.UseRename tree) {
        out.ident(tree.ident());
        out.keyword("as", tree.asToken());
        out.ident(tree.rename());
        return null;
    }

    @Override
    public Void visitGlob(UseTree.UseGlob tree) {
        out.punct("*", tree.star());
        return null;
    }

    @Override
    public Void visitGroup(UseTree.UseGroup tree) {
        surround(Delimiter.BRACE, tree.brace(), () -> punctuated(tree.items(), ",", item -> item.accept(this)));
        return null;
    }

    // ========================================================================
    // Signatures
    // ========================================================================

    private void signature(Signature sig) {
        out.optionalKeyword("const", sig.constness());
        out.optionalKeyword("async", sig.asyncness());
        out.optionalKeyword("unsafe", sig.unsafety());
        if (sig.abi() != null) {
            abi(sig.abi());
        }
        out.keyword("fn", sig.fnToken());
        out.ident(sig.ident());
        genericParams(sig.generics());
        surround(Delimiter.PARENTHESIS, sig.paren(), () -> {
            punctuated(sig.inputs(), ",", this::fnArg);
            Variadic variadic = sig.variadic();
            if (variadic != null) {
                if (!sig.inputs().emptyOrTrailing()) {
                    out.punct(",", null);
                }
                outerAttrs(variadic.attrs());
                if (variadic.pat() != null) {
                    out.append(variadic.pat().tokens());
                    out.punct(":", variadic.colon());
                }
                out.punct("...", variadic.dots());
                out.optionalPunct(",", variadic.comma());
            }
        });
        returnType(sig.output());
        whereClause(sig.generics().whereClause());
    }

    private void fnArg(FnArg arg) {
        outerAttrs(arg.attrs());
        if (arg instanceof PatType typed) {
            out.append(typed.pat().tokens());
            out.punct(":", typed.colon());
            out.append(typed.ty().tokens());
            return;
        }
        Receiver receiver = (Receiver) arg;
        Reference reference = receiver.reference();
        if (reference instanceof Reference.None none) {
            out.optionalKeyword("mut", none.mutability());
            out.keyword("self", receiver.selfToken());
        } else if (reference instanceof Reference.Full full) {
            out.punct("&", full.ampersand());
            if (full.lifetime() != null) {
                lifetime(full.lifetime());
            }
            out.optionalKeyword("mut", full.mutability());
            out.keyword("self", receiver.selfToken());
        } else if (reference instanceof Reference.Partial partial) {
            out.keyword("self", receiver.selfToken());
            out.punct(".", partial.dot());
            PartialBorrows borrows = partial.borrows();
            surround(Delimiter.BRACE, borrows.brace(), () -> punctuated(borrows.borrows(), ",", borrow -> {
                out.optionalKeyword("mut", borrow.mutability());
                out.ident(borrow.ident());
            }));
        }
    }

    private void returnType(ReturnType output) {
        if (output instanceof ReturnType.Arrow arrow) {
            out.punct("->", arrow.arrow());
            out.append(arrow.ty().tokens());
        }
    }

    private void abi(Abi abi) {
        out.keyword("extern", abi.externToken());
        if (abi.name() != null) {
            out.literal(abi.name());
        }
    }

    private void block(List<Attribute> attrs, Block block) {
        surround(Delimiter.BRACE, block.brace(), () -> {
            innerAttrs(attrs);
            out.append(block.stmts());
        });
    }

    // ========================================================================
    // Shared pieces
    // ========================================================================

    private void outerAttrs(List<Attribute> attrs) {
        for (Attribute attr : attrs) {
            if (attr.style() == AttrStyle.OUTER) {
                out.punct("#", attr.pound());
                out.group(Delimiter.BRACKET, attr.bracket(), attr.tokens());
            }
        }
    }

    private void innerAttrs(List<Attribute> attrs) {
        for (Attribute attr : attrs) {
            if (attr.style() == AttrStyle.INNER) {
                out.punct("#", attr.pound());
                out.punct("!", attr.bang());
                out.group(Delimiter.BRACKET, attr.bracket(), attr.tokens());
            }
        }
    }

    private void visibility(Visibility vis) {
        if (vis instanceof Visibility.Public pub) {
            out.keyword("pub", pub.pub());
        } else if (vis instanceof Visibility.Crate crate) {
            out.keyword("crate", crate.crate());
        } else if (vis instanceof Visibility.Restricted restricted) {
            out.keyword("pub", restricted.pub());
            surround(Delimiter.PARENTHESIS, restricted.paren(), () -> {
                out.optionalKeyword("in", restricted.in());
                path(restricted.path());
            });
        }
    }

    private void path(Path path) {
        out.optionalPunct("::", path.leadingColon());
        punctuated(path.segments(), "::", segment -> {
            out.ident(segment.ident());
            PathArguments arguments = segment.arguments();
            if (arguments instanceof PathArguments.AngleBracketed angle) {
                out.optionalPunct("::", angle.colon2());
                out.punct("<", angle.lt());
                out.append(angle.args());
                out.punct(">", angle.gt());
            } else if (arguments instanceof PathArguments.Parenthesized paren) {
                out.group(Delimiter.PARENTHESIS, paren.paren(), paren.inputs());
                returnType(paren.output());
            }
        });
    }

    private void macro(Macro mac) {
        path(mac.path());
        out.punct("!", mac.bang());
        macroBody(mac);
    }

    private void macroBody(Macro mac) {
        out.group(mac.delimiter(), mac.delimSpan(), mac.tokens());
    }

    private void macroSemi(Macro mac, Span semi) {
        if (mac.delimiter() == Delimiter.BRACE) {
            out.optionalPunct(";", semi);
        } else {
            out.punct(";", semi);
        }
    }

    private void lifetime(Lifetime lifetime) {
        out.lifetime(lifetime.apostrophe(), lifetime.ident());
    }

    private void fields(Fields fields) {
        if (fields instanceof FieldsNamed named) {
            surround(Delimiter.BRACE, named.brace(), () -> punctuated(named.named(), ",", this::field));
        } else if (fields instanceof FieldsUnnamed unnamed) {
            surround(Delimiter.PARENTHESIS, unnamed.paren(), () -> punctuated(unnamed.unnamed(), ",", this::field));
        }
    }

    private void field(Field field) {
        outerAttrs(field.attrs());
        visibility(field.vis());
        if (field.ident() != null) {
            out.ident(field.ident());
            out.punct(":", field.colon());
        }
        out.append(field.ty().tokens());
    }

    /**
     * {@code <...>}, written whenever the source had brackets or there are parameters.
     */
    private void genericParams(Generics generics) {
        if (generics.lt() == null && generics.params().isEmpty()) {
            return;
        }
        out.punct("<", generics.lt());
        punctuated(generics.params(), ",", this::genericParam);
        out.punct(">", generics.gt());
    }

    private void genericParam(GenericParam param) {
        outerAttrs(param.attrs());
        if (param instanceof GenericParam.LifetimeParam lifetimeParam) {
            lifetime(lifetimeParam.lifetime());
            if (lifetimeParam.colon() != null || !lifetimeParam.bounds().isEmpty()) {
                out.punct(":", lifetimeParam.colon());
                punctuated(lifetimeParam.bounds(), "+", this::lifetime);
            }
        } else if (param instanceof GenericParam.TypeParam typeParam) {
            out.ident(typeParam.ident());
            if (typeParam.colon() != null || !typeParam.bounds().isEmpty()) {
                out.punct(":", typeParam.colon());
                bounds(typeParam.bounds());
            }
            if (typeParam.defaultType() != null) {
                out.punct("=", typeParam.eq());
                out.append(typeParam.defaultType().tokens());
            }
        } else if (param instanceof GenericParam.ConstParam constParam) {
            out.keyword("const", constParam.constToken());
            out.ident(constParam.ident());
            out.punct(":", constParam.colon());
            out.append(constParam.ty().tokens());
            if (constParam.defaultValue() != null) {
                out.punct("=", constParam.eq());
                out.append(constParam.defaultValue().tokens());
            }
        }
    }

    private void bounds(Punctuated<TypeParamBound> bounds) {
        punctuated(bounds, "+", bound -> out.append(bound.tokens()));
    }

    private void whereClause(WhereClause where) {
        if (where == null) {
            return;
        }
        out.keyword("where", where.whereToken());
        punctuated(where.predicates(), ",", predicate -> out.append(predicate.tokens()));
    }

    private <T> void punctuated(Punctuated<T> values, String separator, Consumer<T> element) {
        List<Span> separators = values.separators();
        for (int i = 0; i < values.size(); i++) {
            element.accept(values.get(i));
            if (i < separators.size()) {
                out.punct(separator, separators.get(i));
            }
        }
    }
}
