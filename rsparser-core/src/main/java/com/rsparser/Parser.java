package com.rsparser;

import com.rsparser.ast.*;
import com.rsparser.token.Delimiter;
import com.rsparser.token.Group;
import com.rsparser.token.Ident;
import com.rsparser.token.Lexer;
import com.rsparser.token.Literal;
import com.rsparser.token.Span;
import com.rsparser.token.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Recursive-descent parser for items and their members.
 *
 * <p>Every decision between grammar branches is made on a {@link ParseBuffer#fork() fork}
 * of the cursor: the fork reads attributes, visibility and as many keywords as the decision
 * needs, and the chosen branch then parses from the original cursor. Types, expressions,
 * patterns and statements are not parsed; they are kept as the token spans that bound them.</p>
 *
 * <p>A parser instance is single-use. The static entry points create one per call.</p>
 */
public class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    // ========================================================================
    // Terminators for opaque token spans
    // ========================================================================
    // Each stop is checked only at angle-bracket depth 0; groups are always atomic.

    private static final Predicate<ParseBuffer> BRACE = in -> in.peekGroup(Delimiter.BRACE);
    private static final Predicate<ParseBuffer> WHERE = keyword("where");

    private static final Predicate<ParseBuffer> COMMA = puncts(",");
    private static final Predicate<ParseBuffer> PATTERN = puncts(":", ",");
    private static final Predicate<ParseBuffer> EQ_OR_SEMI = puncts("=", ";");
    private static final Predicate<ParseBuffer> SEMI = puncts(";");
    private static final Predicate<ParseBuffer> RETURN_TYPE = WHERE.or(BRACE).or(SEMI);
    private static final Predicate<ParseBuffer> TRAIT_PATH_OUTPUT = keyword("for").or(WHERE).or(BRACE);
    private static final Predicate<ParseBuffer> SELF_TYPE = WHERE.or(BRACE);
    private static final Predicate<ParseBuffer> WHERE_PREDICATE = puncts(",", ";", "=").or(BRACE);
    private static final Predicate<ParseBuffer> PARAM_BOUND = puncts(",", ">", "=");
    private static final Predicate<ParseBuffer> PARAM_DEFAULT = puncts(",", ">");
    private static final Predicate<ParseBuffer> CONST_PARAM_TYPE = puncts(",", ">", "=");
    private static final Predicate<ParseBuffer> SUPERTRAIT = WHERE.or(BRACE);
    private static final Predicate<ParseBuffer> ALIAS_BOUND = SEMI.or(WHERE);
    private static final Predicate<ParseBuffer> ASSOC_BOUND = EQ_OR_SEMI.or(WHERE);
    private static final Predicate<ParseBuffer> CLOSING_ANGLE = puncts(">");

    private static Predicate<ParseBuffer> puncts(String... ops) {
        return in -> {
            for (String op : ops) {
                if (in.peekPunct(op)) return true;
            }
            return false;
        };
    }

    private static Predicate<ParseBuffer> keyword(String keyword) {
        return in -> in.peekKeyword(keyword);
    }

    private final ParseBuffer input;
    private final boolean captureExperimental;

    public Parser(TokenStream tokens) {
        this(tokens, true);
    }

    /**
     * @param captureExperimental keep experimental item forms ({@code existential type}) as
     *                            verbatim tokens; when false they are a parse error
     */
    public Parser(TokenStream tokens, boolean captureExperimental) {
        this.input = new ParseBuffer(tokens);
        this.captureExperimental = captureExperimental;
    }

    // ========================================================================
    // Entry points
    // ========================================================================

    public SourceFile parseFile() {
        List<Attribute> attrs = parseInnerAttrs(input);
        List<Item> items = parseItems(input);
        return new SourceFile(attrs, items);
    }

    public Item parseItem() {
        return complete(parseItem(input));
    }

    public ForeignItem parseForeignItem() {
        return complete(parseForeignItem(input));
    }

    public TraitItem parseTraitItem() {
        return complete(parseTraitItem(input));
    }

    public ImplItem parseImplItem() {
        return complete(parseImplItem(input));
    }

    public UseTree parseUseTree() {
        return complete(parseUseTree(input));
    }

    public FnArg parseFnArg() {
        List<Attribute> attrs = parseOuterAttrs(input);
        return complete(parseFnArg(input, attrs));
    }

    public Signature parseSignature() {
        return complete(parseSignature(input));
    }

    public DeriveInput parseDeriveInput() {
        return complete(parseDeriveInput(input));
    }

    private <T> T complete(T result) {
        input.expectEnd();
        return result;
    }

    public static SourceFile parseFile(String source) {
        return new Parser(Lexer.tokenize(source)).parseFile();
    }

    public static Item parseItem(String source) {
        return new Parser(Lexer.tokenize(source)).parseItem();
    }

    public static ForeignItem parseForeignItem(String source) {
        return new Parser(Lexer.tokenize(source)).parseForeignItem();
    }

    public static TraitItem parseTraitItem(String source) {
        return new Parser(Lexer.tokenize(source)).parseTraitItem();
    }

    public static ImplItem parseImplItem(String source) {
        return new Parser(Lexer.tokenize(source)).parseImplItem();
    }

    public static UseTree parseUseTree(String source) {
        return new Parser(Lexer.tokenize(source)).parseUseTree();
    }

    public static FnArg parseFnArg(String source) {
        return new Parser(Lexer.tokenize(source)).parseFnArg();
    }

    public static Signature parseSignature(String source) {
        return new Parser(Lexer.tokenize(source)).parseSignature();
    }

    public static DeriveInput parseDeriveInput(String source) {
        return new Parser(Lexer.tokenize(source)).parseDeriveInput();
    }

    // ========================================================================
    // Items
    // ========================================================================

    private List<Item> parseItems(ParseBuffer in) {
        List<Item> items = new ArrayList<>();
        while (!in.isEmpty()) {
            items.add(parseItem(in));
        }
        return items;
    }

    private Item parseItem(ParseBuffer in) {
        ParseBuffer begin = in.fork();
        List<Attribute> attrs = parseOuterAttrs(in);
        ParseBuffer ahead = in.fork();
        Visibility vis = parseVisibility(ahead);
        boolean inherited = vis instanceof Visibility.Inherited;
        Lookahead lookahead = ahead.lookahead();
        if (inherited) {
            lookahead.peekKeyword("pub");
        }

        Item item;
        if (lookahead.peekKeyword("extern")) {
            ahead.parseKeyword("extern");
            Lookahead afterExtern = ahead.lookahead();
            if (afterExtern.peekKeyword("crate")) {
                item = parseExternCrate(in);
            } else if (afterExtern.peekKeyword("fn")) {
                item = parseItemFn(in);
            } else if (afterExtern.peekGroup(Delimiter.BRACE)) {
                item = parseForeignMod(in);
            } else if (afterExtern.peekStringLiteral()) {
                ahead.next();
                Lookahead afterAbi = ahead.lookahead();
                if (afterAbi.peekGroup(Delimiter.BRACE)) {
                    item = parseForeignMod(in);
                } else if (afterAbi.peekKeyword("fn")) {
                    item = parseItemFn(in);
                } else {
                    throw afterAbi.error();
                }
            } else {
                throw afterExtern.error();
            }
        } else if (lookahead.peekKeyword("use")) {
            item = parseUse(in);
        } else if (lookahead.peekKeyword("static")) {
            item = parseStatic(in);
        } else if (lookahead.peekKeyword("const")) {
            ahead.parseKeyword("const");
            Lookahead afterConst = ahead.lookahead();
            if (afterConst.peekIdent() || afterConst.peekKeyword("_")) {
                item = parseConst(in);
            } else if (peekFnQualifier(afterConst)) {
                item = parseItemFn(in);
            } else {
                throw afterConst.error();
            }
        } else if (lookahead.peekKeyword("unsafe")) {
            ahead.parseKeyword("unsafe");
            Lookahead afterUnsafe = ahead.lookahead();
            if (afterUnsafe.peekKeyword("trait")
                    || (afterUnsafe.peekKeyword("auto") && ahead.peekKeyword(1, "trait"))) {
                item = parseTrait(in);
            } else if (afterUnsafe.peekKeyword("impl")) {
                item = parseImpl(in);
            } else if (afterUnsafe.peekKeyword("async") || afterUnsafe.peekKeyword("extern")
                    || afterUnsafe.peekKeyword("fn")) {
                item = parseItemFn(in);
            } else {
                throw afterUnsafe.error();
            }
        } else if (lookahead.peekKeyword("async") || lookahead.peekKeyword("fn")) {
            item = parseItemFn(in);
        } else if (lookahead.peekKeyword("mod")) {
            item = parseMod(in);
        } else if (lookahead.peekKeyword("type")) {
            item = parseItemType(in);
        } else if (lookahead.peekKeyword("existential") && ahead.peekKeyword(1, "type")) {
            return parseExistential(in, begin);
        } else if (lookahead.peekKeyword("struct")) {
            item = parseStruct(in);
        } else if (lookahead.peekKeyword("enum")) {
            item = parseEnum(in);
        } else if (lookahead.peekKeyword("union") && ahead.peekIdent(1)) {
            item = parseUnion(in);
        } else if (lookahead.peekKeyword("trait")) {
            item = parseTraitOrAlias(in);
        } else if (lookahead.peekKeyword("auto") && ahead.peekKeyword(1, "trait")) {
            item = parseTrait(in);
        } else if (lookahead.peekKeyword("impl")
                || (lookahead.peekKeyword("default") && !ahead.peekPunct(1, "!"))) {
            item = parseImpl(in);
        } else if (lookahead.peekKeyword("macro")) {
            item = parseMacro2(in);
        } else if (inherited && lookahead.check("macro invocation", peekMacroInvocation(ahead))) {
            item = parseItemMacro(in);
        } else {
            throw lookahead.error();
        }

        return reattach(attrs, item);
    }

    /**
     * Puts attributes read before dispatch in front of the item's own attributes.
     */
    private static Item reattach(List<Attribute> attrs, Item item) {
        if (item instanceof ItemVerbatim || attrs.isEmpty()) {
            return item;
        }
        return item.withAttrs(prepend(attrs, item.attrs()));
    }

    private static List<Attribute> prepend(List<Attribute> first, List<Attribute> rest) {
        List<Attribute> merged = new ArrayList<>(first);
        merged.addAll(rest);
        return merged;
    }

    private static boolean peekFnQualifier(Lookahead lookahead) {
        return lookahead.peekKeyword("unsafe") || lookahead.peekKeyword("async")
            || lookahead.peekKeyword("extern") || lookahead.peekKeyword("fn");
    }

    /**
     * {@code path!} at the cursor, without consuming anything.
     */
    private static boolean peekMacroInvocation(ParseBuffer in) {
        int offset = in.peekPunct("::") ? 2 : 0;
        if (!(in.peekToken(offset) instanceof Ident)) {
            return false;
        }
        offset++;
        while (in.peekPunct(offset, "::") && in.peekToken(offset + 2) instanceof Ident) {
            offset += 3;
        }
        return in.peekPunct(offset, "!");
    }

    private Item parseExistential(ParseBuffer in, ParseBuffer begin) {
        if (!captureExperimental) {
            throw new ParseException(ParseException.UNSUPPORTED, in.span(),
                "`existential type` is not supported");
        }
        parseVisibility(in);
        in.parseKeyword("existential");
        in.parseKeyword("type");
        in.parseIdent();
        parseGenerics(in);
        parseWhereClause(in);
        in.parsePunct(":");
        parseBounds(in, ALIAS_BOUND);
        in.parsePunct(";");
        TokenStream tokens = in.tokensSince(begin);
        log.debug("captured existential type as verbatim tokens: {}", tokens);
        return new ItemVerbatim(tokens);
    }

    private ItemConst parseConst(ParseBuffer in) {
        List<Attribute> attrs = parseOuterAttrs(in);
        Visibility vis = parseVisibility(in);
        Span constToken = in.parseKeyword("const");
        Ident ident = parseIdentOrUnderscore(in);
        Span colon = in.parsePunct(":");
        Type ty = parseType(in, EQ_OR_SEMI);
        Span eq = in.parsePunct("=");
        Expr expr = parseExpr(in, SEMI);
        Span semi = in.parsePunct(";");
        return new ItemConst(attrs, vis, constToken, ident, colon, ty, eq, expr, semi);
    }

    private ItemStatic parseStatic(ParseBuffer in) {
        List<Attribute> attrs = parseOuterAttrs(in);
        Visibility vis = parseVisibility(in);
        Span staticToken = in.parseKeyword("static");
        Span mutability = in.optionalKeyword("mut");
        Ident ident = in.parseIdent();
        Span colon = in.parsePunct(":");
        Type ty = parseType(in, EQ_OR_SEMI);
        Span eq = in.parsePunct("=");
        Expr expr = parseExpr(in, SEMI);
        Span semi = in.parsePunct(";");
        return new ItemStatic(attrs, vis, staticToken, mutability, ident, colon, ty, eq, expr, semi);
    }

    private ItemExternCrate parseExternCrate(ParseBuffer in) {
        List<Attribute> attrs = parseOuterAttrs(in);
        Visibility vis = parseVisibility(in);
        Span externToken = in.parseKeyword("extern");
        Span crateToken = in.parseKeyword("crate");
        Ident ident = in.peekKeyword("self") ? (Ident) in.next() : in.parseIdent();
        Span asToken = in.optionalKeyword("as");
        Ident rename = asToken != null ? parseIdentOrUnderscore(in) : null;
        Span semi = in.parsePunct(";");
        return new ItemExternCrate(attrs, vis, externToken, crateToken, ident, asToken, rename, semi);
    }

    private ItemUse parseUse(ParseBuffer in) {
        List<Attribute> attrs = parseOuterAttrs(in);
        Visibility vis = parseVisibility(in);
        Span useToken = in.parseKeyword("use");
        Span leadingColon = in.optionalPunct("::");
        UseTree tree = parseUseTree(in);
        Span semi = in.parsePunct(";");
        return new ItemUse(attrs, vis, useToken, leadingColon, tree, semi);
    }

    private ItemFn parseItemFn(ParseBuffer in) {
        List<Attribute> outer = parseOuterAttrs(in);
        Visibility vis = parseVisibility(in);
        Signature sig = parseSignature(in);
        Group body = in.parseGroup(Delimiter.BRACE);
        ParseBuffer content = in.nested(body);
        List<Attribute> inner = parseInnerAttrs(content);
        Block block = new Block(body.span(), content.parseRest());
        return new ItemFn(Attribute.concat(outer, inner), vis, sig, block);
    }

    private ItemForeignMod parseForeignMod(ParseBuffer in) {
        List<Attribute> outer = parseOuterAttrs(in);
        Abi abi = parseAbi(in);
        Group body = in.parseGroup(Delimiter.BRACE);
        ParseBuffer content = in.nested(body);
        List<Attribute> inner = parseInnerAttrs(content);
        List<ForeignItem> items = new ArrayList<>();
        while (!content.isEmpty()) {
            items.add(parseForeignItem(content));
        }
        return new ItemForeignMod(Attribute.concat(outer, inner), abi, body.span(), items);
    }

    private ItemMod parseMod(ParseBuffer in) {
        List<Attribute> outer = parseOuterAttrs(in);
        Visibility vis = parseVisibility(in);
        Span modToken = in.parseKeyword("mod");
        Ident ident = in.parseIdent();
        Lookahead lookahead = in.lookahead();
        if (lookahead.peekPunct(";")) {
            Span semi = in.parsePunct(";");
            return new ItemMod(outer, vis, modToken, ident, null, null, semi);
        }
        if (!lookahead.peekGroup(Delimiter.BRACE)) {
            throw lookahead.error();
        }
        Group body = in.parseGroup(Delimiter.BRACE);
        ParseBuffer content = in.nested(body);
        List<Attribute> inner = parseInnerAttrs(content);
        List<Item> items = parseItems(content);
        return new ItemMod(Attribute.concat(outer, inner), vis, modToken, ident, body.span(), items, null);
    }

    private ItemType parseItemType(ParseBuffer in) {
        List<Attribute> attrs = parseOuterAttrs(in);
        Visibility vis = parseVisibility(in);
        Span typeToken = in.parseKeyword("type");
        Ident ident = in.parseIdent();
        Generics generics = parseGenerics(in);
        generics = generics.withWhereClause(parseWhereClause(in));
        Span eq = in.parsePunct("=");
        Type ty = parseType(in, SEMI);
        Span semi = in.parsePunct(";");
        return new ItemType(attrs, vis, typeToken, ident, generics, eq, ty, semi);
    }

    private ItemStruct parseStruct(ParseBuffer in) {
        List<Attribute> attrs = parseOuterAttrs(in);
        Visibility vis = parseVisibility(in);
        Span structToken = in.parseKeyword("struct");
        Ident ident = in.parseIdent();
        Generics generics = parseGenerics(in);

        WhereClause whereClause = parseWhereClause(in);
        Fields fields;
        Span semi = null;
        Lookahead lookahead = in.lookahead();
        if (whereClause == null && lookahead.peekGroup(Delimiter.PARENTHESIS)) {
            fields = parseFieldsUnnamed(in);
            whereClause = parseWhereClause(in);
            semi = in.parsePunct(";");
        } else if (lookahead.peekGroup(Delimiter.BRACE)) {
            fields = parseFieldsNamed(in);
        } else if (lookahead.peekPunct(";")) {
            fields = new Fields.Unit();
            semi = in.parsePunct(";");
        } else {
            throw lookahead.error();
        }
        return new ItemStruct(attrs, vis, structToken, ident, generics.withWhereClause(whereClause), fields, semi);
    }

    private ItemEnum parseEnum(ParseBuffer in) {
        List<Attribute> attrs = parseOuterAttrs(in);
        Visibility vis = parseVisibility(in);
        Span enumToken = in.parseKeyword("enum");
        Ident ident = in.parseIdent();
        Generics generics = parseGenerics(in);
        generics = generics.withWhereClause(parseWhereClause(in));
        Group body = in.parseGroup(Delimiter.BRACE);
        Punctuated<Variant> variants = parseTerminated(in.nested(body), this::parseVariant);
        return new ItemEnum(attrs, vis, enumToken, ident, generics, body.span(), variants);
    }

    private Variant parseVariant(ParseBuffer in) {
        List<Attribute> attrs = parseOuterAttrs(in);
        Ident ident = in.parseIdent();
        Fields fields;
        if (in.peekGroup(Delimiter.BRACE)) {
            fields = parseFieldsNamed(in);
        } else if (in.peekGroup(Delimiter.PARENTHESIS)) {
            fields = parseFieldsUnnamed(in);
        } else {
            fields = new Fields.Unit();
        }
        Span eq = in.optionalPunct("=");
        Expr discriminant = eq != null ? parseExpr(in, COMMA) : null;
        return new Variant(attrs, ident, fields, eq, discriminant);
    }

    private ItemUnion parseUnion(ParseBuffer in) {
        List<Attribute> attrs = parseOuterAttrs(in);
        Visibility vis = parseVisibility(in);
        Span unionToken = in.parseKeyword("union");
        Ident ident = in.parseIdent();
        Generics generics = parseGenerics(in);
        generics = generics.withWhereClause(parseWhereClause(in));
        FieldsNamed fields = parseFieldsNamed(in);
        return new ItemUnion(attrs, vis, unionToken, ident, generics, fields);
    }

    private FieldsNamed parseFieldsNamed(ParseBuffer in) {
        Group body = in.parseGroup(Delimiter.BRACE);
        Punctuated<Field> named = parseTerminated(in.nested(body), content -> {
            List<Attribute> attrs = parseOuterAttrs(content);
            Visibility vis = parseVisibility(content);
            Ident ident = content.parseIdent();
            Span colon = content.parsePunct(":");
            Type ty = parseType(content, COMMA);
            return new Field(attrs, vis, ident, colon, ty);
        });
        return new FieldsNamed(body.span(), named);
    }

    private FieldsUnnamed parseFieldsUnnamed(ParseBuffer in) {
        Group body = in.parseGroup(Delimiter.PARENTHESIS);
        Punctuated<Field> unnamed = parseTerminated(in.nested(body), content -> {
            List<Attribute> attrs = parseOuterAttrs(content);
            Visibility vis = parseVisibility(content);
            Type ty = parseType(content, COMMA);
            return new Field(attrs, vis, null, null, ty);
        });
        return new FieldsUnnamed(body.span(), unnamed);
    }

    /**
     * {@code trait Name<T> ...}: a trait when followed by a body, supertraits or a where clause;
     * a trait alias when followed by {@code =}.
     */
    private Item parseTraitOrAlias(ParseBuffer in) {
        ParseBuffer ahead = in.fork();
        parseOuterAttrs(ahead);
        parseVisibility(ahead);
        ahead.parseKeyword("trait");
        ahead.parseIdent();
        parseGenerics(ahead);
        Lookahead lookahead = ahead.lookahead();
        if (lookahead.peekGroup(Delimiter.BRACE) || lookahead.peekPunct(":") || lookahead.peekKeyword("where")) {
            return parseTrait(in);
        } else if (lookahead.peekPunct("=")) {
            return parseTraitAlias(in);
        }
        throw lookahead.error();
    }

    private ItemTrait parseTrait(ParseBuffer in) {
        List<Attribute> outer = parseOuterAttrs(in);
        Visibility vis = parseVisibility(in);
        Span unsafety = in.optionalKeyword("unsafe");
        Span autoToken = in.optionalKeyword("auto");
        Span traitToken = in.parseKeyword("trait");
        Ident ident = in.parseIdent();
        Generics generics = parseGenerics(in);

        Span colon = in.optionalPunct(":");
        Punctuated<TypeParamBound> supertraits = colon != null ? parseBounds(in, SUPERTRAIT) : Punctuated.empty();
        generics = generics.withWhereClause(parseWhereClause(in));

        Group body = in.parseGroup(Delimiter.BRACE);
        ParseBuffer content = in.nested(body);
        List<Attribute> inner = parseInnerAttrs(content);
        List<TraitItem> items = new ArrayList<>();
        while (!content.isEmpty()) {
            items.add(parseTraitItem(content));
        }
        return new ItemTrait(Attribute.concat(outer, inner), vis, unsafety, autoToken, traitToken, ident,
            generics, colon, supertraits, body.span(), items);
    }

    private ItemTraitAlias parseTraitAlias(ParseBuffer in) {
        List<Attribute> attrs = parseOuterAttrs(in);
        Visibility vis = parseVisibility(in);
        Span traitToken = in.parseKeyword("trait");
        Ident ident = in.parseIdent();
        Generics generics = parseGenerics(in);
        Span eq = in.parsePunct("=");
        Punctuated<TypeParamBound> bounds = parseBounds(in, ALIAS_BOUND);
        generics = generics.withWhereClause(parseWhereClause(in));
        Span semi = in.parsePunct(";");
        return new ItemTraitAlias(attrs, vis, traitToken, ident, generics, eq, bounds, semi);
    }

    private ItemImpl parseImpl(ParseBuffer in) {
        List<Attribute> outer = parseOuterAttrs(in);
        Span defaultness = in.optionalKeyword("default");
        Span unsafety = in.optionalKeyword("unsafe");
        Span implToken = in.parseKeyword("impl");

        Generics generics = implHasGenerics(in) ? parseGenerics(in) : Generics.empty();

        Span bang = null;
        Path trait = null;
        Span forToken = null;
        ParseBuffer ahead = in.fork();
        Span aheadBang = ahead.optionalPunct("!");
        if (ahead.peekPunct("::") || ahead.peekToken(0) instanceof Ident) {
            try {
                Path path = parseTypePath(ahead, TRAIT_PATH_OUTPUT);
                if (ahead.peekKeyword("for")) {
                    in.advanceTo(ahead);
                    bang = aheadBang;
                    trait = path;
                    forToken = in.parseKeyword("for");
                }
            } catch (ParseException e) {
                log.trace("impl at {} has no trait path: {}", ahead.span(), e.getRawMessage());
            }
        }
        Type selfTy = parseType(in, SELF_TYPE);
        generics = generics.withWhereClause(parseWhereClause(in));

        Group body = in.parseGroup(Delimiter.BRACE);
        ParseBuffer content = in.nested(body);
        List<Attribute> inner = parseInnerAttrs(content);
        List<ImplItem> items = new ArrayList<>();
        while (!content.isEmpty()) {
            items.add(parseImplItem(content));
        }
        return new ItemImpl(Attribute.concat(outer, inner), defaultness, unsafety, implToken, generics,
            bang, trait, forToken, selfTy, body.span(), items);
    }

    /**
     * After {@code impl}, a {@code <} opens generic parameters only if what follows reads as a
     * parameter; otherwise it starts a qualified self type such as {@code <T as Trait>::Output}.
     */
    private static boolean implHasGenerics(ParseBuffer in) {
        if (!in.peekPunct("<")) {
            return false;
        }
        if (in.peekPunct(1, ">") || in.peekPunct(1, "#") || in.peekKeyword(1, "const")) {
            return true;
        }
        int afterParam;
        if (in.peekLifetime(1)) {
            afterParam = 3;
        } else if (in.peekIdent(1)) {
            afterParam = 2;
        } else {
            return false;
        }
        return in.peekPunct(afterParam, ":") || in.peekPunct(afterParam, ",")
            || in.peekPunct(afterParam, ">") || in.peekPunct(afterParam, "=");
    }

    private ItemMacro parseItemMacro(ParseBuffer in) {
        List<Attribute> attrs = parseOuterAttrs(in);
        Path path = parseModPath(in);
        Span bang = in.parsePunct("!");
        Ident ident = in.peekIdent() ? in.parseIdent() : null;
        Macro mac = parseMacroBody(in, path, bang);
        Span semi = mac.delimiter() == Delimiter.BRACE ? null : in.parsePunct(";");
        return new ItemMacro(attrs, ident, mac, semi);
    }

    private ItemMacro2 parseMacro2(ParseBuffer in) {
        List<Attribute> attrs = parseOuterAttrs(in);
        Visibility vis = parseVisibility(in);
        Span macroToken = in.parseKeyword("macro");
        Ident ident = in.parseIdent();
        ParseBuffer rulesStart = in.fork();
        Lookahead lookahead = in.lookahead();
        if (lookahead.peekGroup(Delimiter.PARENTHESIS)) {
            in.next();
            in.parseGroup(Delimiter.BRACE);
        } else if (lookahead.peekGroup(Delimiter.BRACE)) {
            in.next();
        } else {
            throw lookahead.error();
        }
        return new ItemMacro2(attrs, vis, macroToken, ident, in.tokensSince(rulesStart));
    }

    // ========================================================================
    // Members of extern blocks, traits and impls
    // ========================================================================

    private ForeignItem parseForeignItem(ParseBuffer in) {
        List<Attribute> attrs = parseOuterAttrs(in);
        ParseBuffer ahead = in.fork();
        Visibility vis = parseVisibility(ahead);
        Lookahead lookahead = ahead.lookahead();

        if (lookahead.peekKeyword("fn")) {
            parseVisibility(in);
            Signature sig = parseSignature(in);
            Span semi = in.parsePunct(";");
            return new ForeignItemFn(attrs, vis, sig, semi);
        } else if (lookahead.peekKeyword("static")) {
            parseVisibility(in);
            Span staticToken = in.parseKeyword("static");
            Span mutability = in.optionalKeyword("mut");
            Ident ident = in.parseIdent();
            Span colon = in.parsePunct(":");
            Type ty = parseType(in, SEMI);
            Span semi = in.parsePunct(";");
            return new ForeignItemStatic(attrs, vis, staticToken, mutability, ident, colon, ty, semi);
        } else if (lookahead.peekKeyword("type")) {
            parseVisibility(in);
            Span typeToken = in.parseKeyword("type");
            Ident ident = in.parseIdent();
            Span semi = in.parsePunct(";");
            return new ForeignItemType(attrs, vis, typeToken, ident, semi);
        } else if (vis instanceof Visibility.Inherited
                && lookahead.check("macro invocation", peekMacroInvocation(ahead))) {
            Macro mac = parseMacro(in);
            Span semi = mac.delimiter() == Delimiter.BRACE ? in.optionalPunct(";") : in.parsePunct(";");
            return new ForeignItemMacro(attrs, mac, semi);
        }
        throw lookahead.error();
    }

    private TraitItem parseTraitItem(ParseBuffer in) {
        List<Attribute> attrs = parseOuterAttrs(in);
        ParseBuffer ahead = in.fork();
        Lookahead lookahead = ahead.lookahead();

        TraitItem item;
        if (lookahead.peekKeyword("const")) {
            ahead.parseKeyword("const");
            Lookahead afterConst = ahead.lookahead();
            if (afterConst.peekIdent() || afterConst.peekKeyword("_")) {
                item = parseTraitItemConst(in);
            } else if (peekFnQualifier(afterConst)) {
                item = parseTraitItemMethod(in);
            } else {
                throw afterConst.error();
            }
        } else if (peekFnQualifier(lookahead)) {
            item = parseTraitItemMethod(in);
        } else if (lookahead.peekKeyword("type")) {
            item = parseTraitItemType(in);
        } else if (lookahead.check("macro invocation", peekMacroInvocation(in))) {
            Macro mac = parseMacro(in);
            Span semi = mac.delimiter() == Delimiter.BRACE ? in.optionalPunct(";") : in.parsePunct(";");
            item = new TraitItemMacro(List.of(), mac, semi);
        } else {
            throw lookahead.error();
        }

        return attrs.isEmpty() ? item : item.withAttrs(prepend(attrs, item.attrs()));
    }

    private TraitItemConst parseTraitItemConst(ParseBuffer in) {
        List<Attribute> attrs = parseOuterAttrs(in);
        Span constToken = in.parseKeyword("const");
        Ident ident = parseIdentOrUnderscore(in);
        Span colon = in.parsePunct(":");
        Type ty = parseType(in, EQ_OR_SEMI);
        Span eq = in.optionalPunct("=");
        Expr defaultValue = eq != null ? parseExpr(in, SEMI) : null;
        Span semi = in.parsePunct(";");
        return new TraitItemConst(attrs, constToken, ident, colon, ty, eq, defaultValue, semi);
    }

    private TraitItemMethod parseTraitItemMethod(ParseBuffer in) {
        List<Attribute> outer = parseOuterAttrs(in);
        Signature sig = parseSignature(in);
        Lookahead lookahead = in.lookahead();
        if (lookahead.peekGroup(Delimiter.BRACE)) {
            Group body = in.parseGroup(Delimiter.BRACE);
            ParseBuffer content = in.nested(body);
            List<Attribute> inner = parseInnerAttrs(content);
            Block block = new Block(body.span(), content.parseRest());
            return new TraitItemMethod(Attribute.concat(outer, inner), sig, block, null);
        } else if (lookahead.peekPunct(";")) {
            return new TraitItemMethod(outer, sig, null, in.parsePunct(";"));
        }
        throw lookahead.error();
    }

    private TraitItemType parseTraitItemType(ParseBuffer in) {
        List<Attribute> attrs = parseOuterAttrs(in);
        Span typeToken = in.parseKeyword("type");
        Ident ident = in.parseIdent();
        Generics generics = parseGenerics(in);
        Span colon = in.optionalPunct(":");
        Punctuated<TypeParamBound> bounds = colon != null ? parseBounds(in, ASSOC_BOUND) : Punctuated.empty();
        generics = generics.withWhereClause(parseWhereClause(in));
        Span eq = in.optionalPunct("=");
        Type defaultType = eq != null ? parseType(in, SEMI) : null;
        Span semi = in.parsePunct(";");
        return new TraitItemType(attrs, typeToken, ident, generics, colon, bounds, eq, defaultType, semi);
    }

    private ImplItem parseImplItem(ParseBuffer in) {
        ParseBuffer begin = in.fork();
        List<Attribute> attrs = parseOuterAttrs(in);
        ParseBuffer ahead = in.fork();
        Visibility vis = parseVisibility(ahead);
        Lookahead lookahead = ahead.lookahead();
        if (lookahead.peekKeyword("default") && !ahead.peekPunct(1, "!")) {
            ahead.parseKeyword("default");
            lookahead = ahead.lookahead();
        }

        ImplItem item;
        if (lookahead.peekKeyword("const")) {
            ahead.parseKeyword("const");
            Lookahead afterConst = ahead.lookahead();
            if (afterConst.peekIdent() || afterConst.peekKeyword("_")) {
                item = parseImplItemConst(in);
            } else if (peekFnQualifier(afterConst)) {
                item = parseImplItemMethod(in);
            } else {
                throw afterConst.error();
            }
        } else if (peekFnQualifier(lookahead)) {
            item = parseImplItemMethod(in);
        } else if (lookahead.peekKeyword("type")) {
            item = parseImplItemType(in);
        } else if (lookahead.peekKeyword("existential") && ahead.peekKeyword(1, "type")) {
            return new ImplItemVerbatim(((ItemVerbatim) parseExistential(in, begin)).tokens());
        } else if (vis instanceof Visibility.Inherited
                && lookahead.check("macro invocation", peekMacroInvocation(ahead))) {
            Macro mac = parseMacro(in);
            Span semi = mac.delimiter() == Delimiter.BRACE ? in.optionalPunct(";") : in.parsePunct(";");
            item = new ImplItemMacro(List.of(), mac, semi);
        } else {
            throw lookahead.error();
        }

        return attrs.isEmpty() ? item : item.withAttrs(prepend(attrs, item.attrs()));
    }

    private ImplItemConst parseImplItemConst(ParseBuffer in) {
        List<Attribute> attrs = parseOuterAttrs(in);
        Visibility vis = parseVisibility(in);
        Span defaultness = in.optionalKeyword("default");
        Span constToken = in.parseKeyword("const");
        Ident ident = parseIdentOrUnderscore(in);
        Span colon = in.parsePunct(":");
        Type ty = parseType(in, EQ_OR_SEMI);
        Span eq = in.parsePunct("=");
        Expr expr = parseExpr(in, SEMI);
        Span semi = in.parsePunct(";");
        return new ImplItemConst(attrs, vis, defaultness, constToken, ident, colon, ty, eq, expr, semi);
    }

    private ImplItemMethod parseImplItemMethod(ParseBuffer in) {
        List<Attribute> outer = parseOuterAttrs(in);
        Visibility vis = parseVisibility(in);
        Span defaultness = in.optionalKeyword("default");
        Signature sig = parseSignature(in);
        Group body = in.parseGroup(Delimiter.BRACE);
        ParseBuffer content = in.nested(body);
        List<Attribute> inner = parseInnerAttrs(content);
        Block block = new Block(body.span(), content.parseRest());
        return new ImplItemMethod(Attribute.concat(outer, inner), vis, defaultness, sig, block);
    }

    private ImplItemType parseImplItemType(ParseBuffer in) {
        List<Attribute> attrs = parseOuterAttrs(in);
        Visibility vis = parseVisibility(in);
        Span defaultness = in.optionalKeyword("default");
        Span typeToken = in.parseKeyword("type");
        Ident ident = in.parseIdent();
        Generics generics = parseGenerics(in);
        generics = generics.withWhereClause(parseWhereClause(in));
        Span eq = in.parsePunct("=");
        Type ty = parseType(in, SEMI);
        Span semi = in.parsePunct(";");
        return new ImplItemType(attrs, vis, defaultness, typeToken, ident, generics, eq, ty, semi);
    }

    // ========================================================================
    // Signatures and parameters
    // ========================================================================

    private Signature parseSignature(ParseBuffer in) {
        Span constness = in.optionalKeyword("const");
        Span asyncness = in.optionalKeyword("async");
        Span unsafety = in.optionalKeyword("unsafe");
        Abi abi = in.peekKeyword("extern") ? parseAbi(in) : null;
        Span fnToken = in.parseKeyword("fn");
        Ident ident = in.parseIdent();
        Generics generics = parseGenerics(in);

        Group paren = in.parseGroup(Delimiter.PARENTHESIS);
        ParseBuffer content = in.nested(paren);
        Punctuated.Builder<FnArg> inputs = new Punctuated.Builder<>();
        Variadic variadic = null;
        while (!content.isEmpty()) {
            List<Attribute> attrs = parseOuterAttrs(content);
            if (content.peekPunct("...")) {
                Span dots = content.parsePunct("...");
                Span comma = content.optionalPunct(",");
                content.expectEnd();
                variadic = new Variadic(attrs, null, null, dots, comma);
                break;
            }

            FnArg arg = parseFnArg(content, attrs);
            if (arg instanceof PatType typed && typed.ty().variadicDots()) {
                ParseBuffer ahead = content.fork();
                Span comma = ahead.optionalPunct(",");
                if (ahead.isEmpty()) {
                    content.advanceTo(ahead);
                    Span dots = typed.ty().tokens().get(0).span().join(typed.ty().tokens().get(2).span());
                    variadic = new Variadic(typed.attrs(), typed.pat(), typed.colon(), dots, comma);
                    break;
                }
            }

            inputs.value(arg);
            if (content.isEmpty()) break;
            inputs.separator(content.parsePunct(","));
        }

        ReturnType output = parseReturnType(in, RETURN_TYPE);
        WhereClause whereClause = parseWhereClause(in);
        return new Signature(constness, asyncness, unsafety, abi, fnToken, ident,
            generics.withWhereClause(whereClause), paren.span(), inputs.build(), variadic, output);
    }

    /**
     * A receiver if one parses and is not followed by {@code :}; otherwise {@code pattern: Type}.
     */
    private FnArg parseFnArg(ParseBuffer in, List<Attribute> attrs) {
        ParseBuffer ahead = in.fork();
        try {
            Receiver receiver = parseReceiver(ahead, attrs);
            if (!ahead.peekPunct(":")) {
                in.advanceTo(ahead);
                return receiver;
            }
        } catch (ParseException e) {
            log.trace("parameter at {} is not a receiver: {}", in.span(), e.getRawMessage());
        }

        Pat pat = new Pat(requireTokens(in, scan(in, PATTERN, false), "pattern"));
        Span colon = in.parsePunct(":");
        Type ty = parseType(in, COMMA);
        return new PatType(attrs, pat, colon, ty);
    }

    private Receiver parseReceiver(ParseBuffer in, List<Attribute> attrs) {
        Lookahead lookahead = in.lookahead();
        if (lookahead.peekKeyword("mut")) {
            Span mutability = in.parseKeyword("mut");
            Span selfToken = in.parseKeyword("self");
            return new Receiver(attrs, new Reference.None(mutability), selfToken);
        } else if (lookahead.peekPunct("&")) {
            Span ampersand = in.parsePunct("&");
            Lifetime lifetime = in.peekLifetime() ? parseLifetime(in) : null;
            Span mutability = in.optionalKeyword("mut");
            Span selfToken = in.parseKeyword("self");
            return new Receiver(attrs, new Reference.Full(ampersand, lifetime, mutability), selfToken);
        } else if (lookahead.peekKeyword("self")) {
            Span selfToken = in.parseKeyword("self");
            if (in.peekPunct(".")) {
                Span dot = in.parsePunct(".");
                return new Receiver(attrs, new Reference.Partial(dot, parsePartialBorrows(in)), selfToken);
            }
            return new Receiver(attrs, new Reference.None(null), selfToken);
        }
        throw lookahead.error();
    }

    private PartialBorrows parsePartialBorrows(ParseBuffer in) {
        Group body = in.parseGroup(Delimiter.BRACE);
        Punctuated<PartialBorrow> borrows = parseTerminated(in.nested(body), content -> {
            Span mutability = content.optionalKeyword("mut");
            return new PartialBorrow(mutability, content.parseIdent());
        });
        return new PartialBorrows(body.span(), borrows);
    }

    private ReturnType parseReturnType(ParseBuffer in, Predicate<ParseBuffer> stop) {
        if (!in.peekPunct("->")) {
            return new ReturnType.Default();
        }
        Span arrow = in.parsePunct("->");
        return new ReturnType.Arrow(arrow, parseType(in, stop));
    }

    private Abi parseAbi(ParseBuffer in) {
        Span externToken = in.parseKeyword("extern");
        Literal name = in.peekStringLiteral() ? in.parseStringLiteral() : null;
        return new Abi(externToken, name);
    }

    // ========================================================================
    // Use trees
    // ========================================================================

    private UseTree parseUseTree(ParseBuffer in) {
        Lookahead lookahead = in.lookahead();
        if (lookahead.peekIdent() || lookahead.peekKeyword("self") || lookahead.peekKeyword("super")
                || lookahead.peekKeyword("crate") || lookahead.peekKeyword("Self")) {
            Ident ident = in.parseAnyIdent();
            if (in.peekPunct("::")) {
                Span colon2 = in.parsePunct("::");
                return new UseTree.UsePath(ident, colon2, parseUseTree(in));
            }
            if (in.peekKeyword("as")) {
                Span asToken = in.parseKeyword("as");
                return new UseTree.UseRename(ident, asToken, parseIdentOrUnderscore(in));
            }
            return new UseTree.UseName(ident);
        } else if (lookahead.peekPunct("*")) {
            return new UseTree.UseGlob(in.parsePunct("*"));
        } else if (lookahead.peekGroup(Delimiter.BRACE)) {
            Group body = in.parseGroup(Delimiter.BRACE);
            return new UseTree.UseGroup(body.span(), parseTerminated(in.nested(body), this::parseUseTree));
        }
        throw lookahead.error();
    }

    // ========================================================================
    // Derive input
    // ========================================================================

    private DeriveInput parseDeriveInput(ParseBuffer in) {
        ParseBuffer ahead = in.fork();
        parseOuterAttrs(ahead);
        parseVisibility(ahead);
        Lookahead lookahead = ahead.lookahead();
        if (lookahead.peekKeyword("struct")) {
            return DeriveInput.from(parseStruct(in));
        } else if (lookahead.peekKeyword("enum")) {
            return DeriveInput.from(parseEnum(in));
        } else if (lookahead.peekKeyword("union")) {
            return DeriveInput.from(parseUnion(in));
        }
        throw lookahead.error();
    }

    // ========================================================================
    // Attributes, visibility, paths
    // ========================================================================

    private static List<Attribute> parseOuterAttrs(ParseBuffer in) {
        List<Attribute> attrs = new ArrayList<>();
        while (in.peekPunct("#") && in.peekGroup(1, Delimiter.BRACKET)) {
            Span pound = in.parsePunct("#");
            Group body = in.parseGroup(Delimiter.BRACKET);
            attrs.add(new Attribute(AttrStyle.OUTER, pound, null, body.span(), body.stream()));
        }
        return attrs;
    }

    private static List<Attribute> parseInnerAttrs(ParseBuffer in) {
        List<Attribute> attrs = new ArrayList<>();
        while (in.peekPunct("#") && in.peekPunct(1, "!") && in.peekGroup(2, Delimiter.BRACKET)) {
            Span pound = in.parsePunct("#");
            Span bang = in.parsePunct("!");
            Group body = in.parseGroup(Delimiter.BRACKET);
            attrs.add(new Attribute(AttrStyle.INNER, pound, bang, body.span(), body.stream()));
        }
        return attrs;
    }

    private Visibility parseVisibility(ParseBuffer in) {
        if (in.peekKeyword("pub")) {
            Span pub = in.parseKeyword("pub");
            if (in.peekGroup(Delimiter.PARENTHESIS)) {
                Group group = (Group) in.peekToken(0);
                ParseBuffer content = in.nested(group);
                boolean simple = (content.peekKeyword("crate") || content.peekKeyword("self")
                    || content.peekKeyword("super")) && content.peekToken(1) == null;
                if (simple) {
                    in.next();
                    Ident ident = content.parseAnyIdent();
                    Path path = new Path(null, Punctuated.of(new PathSegment(ident, new PathArguments.None())));
                    return new Visibility.Restricted(pub, group.span(), null, path);
                }
                if (content.peekKeyword("in")) {
                    in.next();
                    Span inToken = content.parseKeyword("in");
                    Path path = parseModPath(content);
                    content.expectEnd();
                    return new Visibility.Restricted(pub, group.span(), inToken, path);
                }
            }
            return new Visibility.Public(pub);
        }
        if (in.peekKeyword("crate") && !in.peekPunct(1, "::")) {
            return new Visibility.Crate(in.parseKeyword("crate"));
        }
        return Visibility.inherited();
    }

    /**
     * A path without generic arguments, as used by macros and visibility.
     */
    private static Path parseModPath(ParseBuffer in) {
        Span leadingColon = in.optionalPunct("::");
        Punctuated.Builder<PathSegment> segments = new Punctuated.Builder<>();
        segments.value(new PathSegment(in.parseAnyIdent(), new PathArguments.None()));
        while (in.peekPunct("::") && in.peekToken(2) instanceof Ident) {
            segments.separator(in.parsePunct("::"));
            segments.value(new PathSegment(in.parseAnyIdent(), new PathArguments.None()));
        }
        return new Path(leadingColon, segments.build());
    }

    /**
     * A path in type position, whose segments may carry {@code <...>} or {@code (...) -> T}.
     */
    private Path parseTypePath(ParseBuffer in, Predicate<ParseBuffer> outputStop) {
        Span leadingColon = in.optionalPunct("::");
        Punctuated.Builder<PathSegment> segments = new Punctuated.Builder<>();
        while (true) {
            Ident ident = in.parseAnyIdent();
            PathArguments arguments = new PathArguments.None();
            if (in.peekPunct("<") || (in.peekPunct("::") && in.peekPunct(2, "<"))) {
                Span colon2 = in.optionalPunct("::");
                Span lt = in.parsePunct("<");
                TokenStream args = scan(in, CLOSING_ANGLE, true);
                Span gt = in.parsePunct(">");
                arguments = new PathArguments.AngleBracketed(colon2, lt, args, gt);
            } else if (in.peekGroup(Delimiter.PARENTHESIS)) {
                Group inputs = in.parseGroup(Delimiter.PARENTHESIS);
                arguments = new PathArguments.Parenthesized(inputs.span(), inputs.stream(),
                    parseReturnType(in, outputStop));
            }
            segments.value(new PathSegment(ident, arguments));
            if (!(in.peekPunct("::") && in.peekToken(2) instanceof Ident)) {
                break;
            }
            segments.separator(in.parsePunct("::"));
        }
        return new Path(leadingColon, segments.build());
    }

    private static Lifetime parseLifetime(ParseBuffer in) {
        if (!in.peekLifetime()) {
            throw in.expected("lifetime");
        }
        Span apostrophe = in.next().span();
        return new Lifetime(apostrophe, (Ident) in.next());
    }

    private static Ident parseIdentOrUnderscore(ParseBuffer in) {
        return in.peekKeyword("_") ? (Ident) in.next() : in.parseIdent();
    }

    // ========================================================================
    // Generics and bounds
    // ========================================================================

    private Generics parseGenerics(ParseBuffer in) {
        if (!in.peekPunct("<")) {
            return Generics.empty();
        }
        Span lt = in.parsePunct("<");
        Punctuated.Builder<GenericParam> params = new Punctuated.Builder<>();
        while (!in.peekPunct(">")) {
            List<Attribute> attrs = parseOuterAttrs(in);
            Lookahead lookahead = in.lookahead();
            if (lookahead.peekLifetime()) {
                Lifetime lifetime = parseLifetime(in);
                Span colon = in.optionalPunct(":");
                Punctuated.Builder<Lifetime> bounds = new Punctuated.Builder<>();
                while (colon != null && in.peekLifetime()) {
                    bounds.value(parseLifetime(in));
                    if (!in.peekPunct("+")) break;
                    bounds.separator(in.parsePunct("+"));
                }
                params.value(new GenericParam.LifetimeParam(attrs, lifetime, colon, bounds.build()));
            } else if (lookahead.peekKeyword("const")) {
                Span constToken = in.parseKeyword("const");
                Ident ident = in.parseIdent();
                Span colon = in.parsePunct(":");
                Type ty = parseType(in, CONST_PARAM_TYPE);
                Span eq = in.optionalPunct("=");
                Expr defaultValue = eq != null ? parseExpr(in, PARAM_DEFAULT) : null;
                params.value(new GenericParam.ConstParam(attrs, constToken, ident, colon, ty, eq, defaultValue));
            } else if (lookahead.peekIdent()) {
                Ident ident = in.parseIdent();
                Span colon = in.optionalPunct(":");
                Punctuated<TypeParamBound> bounds = colon != null ? parseBounds(in, PARAM_BOUND) : Punctuated.empty();
                Span eq = in.optionalPunct("=");
                Type defaultType = eq != null ? parseType(in, PARAM_DEFAULT) : null;
                params.value(new GenericParam.TypeParam(attrs, ident, colon, bounds, eq, defaultType));
            } else {
                lookahead.peekPunct(">");
                throw lookahead.error();
            }
            if (in.peekPunct(">")) break;
            params.separator(in.parsePunct(","));
        }
        Span gt = in.parsePunct(">");
        return new Generics(lt, params.build(), gt, null);
    }

    /**
     * {@code A + B<C> + 'a}, possibly empty, ending before {@code stop}.
     */
    private static Punctuated<TypeParamBound> parseBounds(ParseBuffer in, Predicate<ParseBuffer> stop) {
        Predicate<ParseBuffer> boundStop = stop.or(puncts("+"));
        Punctuated.Builder<TypeParamBound> bounds = new Punctuated.Builder<>();
        while (!in.isEmpty() && !stop.test(in)) {
            TokenStream tokens = requireTokens(in, scan(in, boundStop, true), "bound");
            bounds.value(new TypeParamBound(tokens));
            if (!in.peekPunct("+")) break;
            bounds.separator(in.parsePunct("+"));
        }
        return bounds.build();
    }

    private static WhereClause parseWhereClause(ParseBuffer in) {
        if (!in.peekKeyword("where")) {
            return null;
        }
        Span whereToken = in.parseKeyword("where");
        Punctuated.Builder<WherePredicate> predicates = new Punctuated.Builder<>();
        while (!in.isEmpty() && !WHERE_PREDICATE.test(in)) {
            predicates.value(new WherePredicate(scan(in, WHERE_PREDICATE, true)));
            if (!in.peekPunct(",")) break;
            predicates.separator(in.parsePunct(","));
        }
        return new WhereClause(whereToken, predicates.build());
    }

    // ========================================================================
    // Opaque spans
    // ========================================================================

    private static Type parseType(ParseBuffer in, Predicate<ParseBuffer> stop) {
        return new Type(requireTokens(in, scan(in, stop, true), "type"));
    }

    private static Expr parseExpr(ParseBuffer in, Predicate<ParseBuffer> stop) {
        return new Expr(requireTokens(in, scan(in, stop, false), "expression"));
    }

    /**
     * Consumes tokens up to the first position where {@code stop} holds outside angle
     * brackets. With {@code angles}, {@code <} and {@code >} nest and {@code ->} is skipped
     * whole. Without it, angle brackets nest only inside a turbofish {@code ::<...>}.
     */
    private static TokenStream scan(ParseBuffer in, Predicate<ParseBuffer> stop, boolean angles) {
        ParseBuffer start = in.fork();
        int depth = 0;
        while (!in.isEmpty()) {
            if (depth == 0 && stop.test(in)) {
                break;
            }
            if (!angles && depth == 0 && in.peekPunct("::") && in.peekPunct(2, "<")) {
                in.next();
                in.next();
                in.next();
                depth++;
                continue;
            }
            if (angles || depth > 0) {
                if (in.peekPunct("->")) {
                    in.next();
                    in.next();
                    continue;
                }
                if (in.peekPunct("<")) {
                    depth++;
                } else if (in.peekPunct(">") && depth > 0) {
                    depth--;
                }
            }
            in.next();
        }
        return in.tokensSince(start);
    }

    private static TokenStream requireTokens(ParseBuffer in, TokenStream tokens, String what) {
        if (tokens.isEmpty()) {
            throw in.expected(what);
        }
        return tokens;
    }

    /**
     * Comma-separated values filling all of {@code content}, trailing comma allowed.
     */
    private static <T> Punctuated<T> parseTerminated(ParseBuffer content, Function<ParseBuffer, T> element) {
        Punctuated.Builder<T> values = new Punctuated.Builder<>();
        while (!content.isEmpty()) {
            values.value(element.apply(content));
            if (content.isEmpty()) break;
            values.separator(content.parsePunct(","));
        }
        return values.build();
    }

    private Macro parseMacro(ParseBuffer in) {
        Path path = parseModPath(in);
        Span bang = in.parsePunct("!");
        return parseMacroBody(in, path, bang);
    }

    private static Macro parseMacroBody(ParseBuffer in, Path path, Span bang) {
        Lookahead lookahead = in.lookahead();
        if (lookahead.peekGroup(Delimiter.PARENTHESIS) || lookahead.peekGroup(Delimiter.BRACKET)
                || lookahead.peekGroup(Delimiter.BRACE)) {
            Group group = (Group) in.next();
            return new Macro(path, bang, group.delimiter(), group.span(), group.stream());
        }
        throw lookahead.error();
    }
}
