package com.rsparser;

import com.rsparser.ast.*;
import com.rsparser.token.Delimiter;
import com.rsparser.token.Ident;
import com.rsparser.token.Lexer;
import com.rsparser.token.Span;
import com.rsparser.token.TokenStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Trees built by hand leave optional tokens null; the printer fills in what the grammar needs.
 */
public class PrinterTest {

    private static void assertPrints(String expected, Node node) {
        TokenStream printed = Printer.print(node);
        System.out.println("Printed: " + Printer.toSource(node));
        assertTrue(printed.sameTokens(Lexer.tokenize(expected)), () -> "printed " + printed + ", expected " + expected);
    }

    private static Type type(String source) {
        return new Type(Lexer.tokenize(source));
    }

    private static Signature signature(String name, Punctuated<FnArg> inputs) {
        return new Signature(null, null, null, null, null, Ident.of(name), Generics.empty(),
            null, inputs, null, new ReturnType.Default());
    }

    @Test
    @DisplayName("tuple and unit structs get their semicolon")
    void testStructSemicolon() {
        Field field = new Field(List.of(), Visibility.inherited(), null, null, type("u8"));
        ItemStruct tuple = new ItemStruct(List.of(), new Visibility.Public(null), null, Ident.of("Id"),
            Generics.empty(), new FieldsUnnamed(null, Punctuated.of(field)), null);
        assertPrints("pub struct Id(u8);", tuple);

        ItemStruct unit = new ItemStruct(List.of(), Visibility.inherited(), null, Ident.of("Marker"),
            Generics.empty(), new Fields.Unit(), null);
        assertPrints("struct Marker;", unit);
    }

    @Test
    @DisplayName("an out-of-line module gets its semicolon")
    void testModSemicolon() {
        ItemMod mod = new ItemMod(List.of(), Visibility.inherited(), null, Ident.of("util"), null, null, null);
        assertPrints("mod util;", mod);

        ItemMod inline = new ItemMod(List.of(), Visibility.inherited(), null, Ident.of("util"), null, List.of(mod), null);
        assertPrints("mod util { mod util; }", inline);
    }

    @Test
    @DisplayName("supertraits get their colon and a bodiless method its semicolon")
    void testTraitDefaults() {
        TraitItemMethod method = new TraitItemMethod(List.of(),
            signature("len", Punctuated.of(new Receiver(List.of(), new Reference.Full(null, null, null), null))),
            null, null);
        ItemTrait trait = new ItemTrait(List.of(), Visibility.inherited(), null, null, null, Ident.of("Len"),
            Generics.empty(), null,
            Punctuated.of(new TypeParamBound(Lexer.tokenize("Sized")), new TypeParamBound(Lexer.tokenize("'static"))),
            null, List.of(method));
        assertPrints("trait Len: Sized + 'static { fn len(&self); }", trait);
    }

    @Test
    @DisplayName("macro invocations get a semicolon unless braced")
    void testMacroSemicolon() {
        Macro paren = new Macro(Path.of("log", "info"), null, Delimiter.PARENTHESIS, null, Lexer.tokenize("\"x\""));
        assertPrints("log::info!(\"x\");", new ItemMacro(List.of(), null, paren, null));

        Macro brace = new Macro(Path.of("items"), null, Delimiter.BRACE, null, TokenStream.empty());
        assertPrints("items! {}", new TraitItemMacro(List.of(), brace, null));

        Macro rules = new Macro(Path.of("macro_rules"), null, Delimiter.BRACE, null, Lexer.tokenize("() => {}"));
        assertPrints("macro_rules! noop { () => {} }", new ItemMacro(List.of(), Ident.of("noop"), rules, null));
    }

    @Test
    @DisplayName("a variadic after non-trailing inputs gets a comma")
    void testVariadicComma() {
        FnArg fmt = new PatType(List.of(), new Pat(Lexer.tokenize("fmt")), null, type("*const u8"));
        Signature sig = new Signature(null, null, null, null, null, Ident.of("printf"), Generics.empty(),
            null, Punctuated.of(fmt), new Variadic(List.of(), null, null, null, null), new ReturnType.Default());
        assertPrints("fn printf(fmt: *const u8, ...)", sig);
    }

    @Test
    @DisplayName("partial borrows print inside braces after self")
    void testPartialBorrows() {
        PartialBorrows borrows = new PartialBorrows(null, Punctuated.of(
            new PartialBorrow(Span.CALL_SITE, Ident.of("a")),
            new PartialBorrow(null, Ident.of("b"))));
        Receiver receiver = new Receiver(List.of(), new Reference.Partial(null, borrows), null);
        assertPrints("self.{mut a, b}", receiver);
    }
}
