package com.rsparser;

import com.rsparser.ast.*;
import com.rsparser.token.Ident;
import com.rsparser.token.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Attributes read before an item's kind is known must end up in front of the attributes the
 * item's own parser reads, inner attributes last.
 */
public class AttributeOrderTest {

    private static List<String> names(List<Attribute> attrs) {
        return attrs.stream().map(attr -> ((Ident) attr.tokens().get(0)).name()).toList();
    }

    @Test
    @DisplayName("function: outer attributes, then inner attributes of the body")
    void testFunction() {
        Item item = Parser.parseItem("#[a] #[b] pub fn f() { #![c] #![d] let x = 1; }");
        assertEquals(List.of("a", "b", "c", "d"), names(item.attrs()));
        assertEquals(AttrStyle.OUTER, item.attrs().get(1).style());
        assertEquals(AttrStyle.INNER, item.attrs().get(2).style());

        ItemFn fn = (ItemFn) item;
        assertTrue(fn.block().stmts().sameTokens(Lexer.tokenize("let x = 1;")));
    }

    @Test
    @DisplayName("module, trait, impl and extern block bodies")
    void testBodies() {
        assertEquals(List.of("outer", "inner"),
            names(Parser.parseItem("#[outer] mod m { #![inner] }").attrs()));
        assertEquals(List.of("outer", "inner"),
            names(Parser.parseItem("#[outer] trait T { #![inner] }").attrs()));
        assertEquals(List.of("outer", "inner"),
            names(Parser.parseItem("#[outer] impl T for U { #![inner] }").attrs()));
        assertEquals(List.of("outer", "inner"),
            names(Parser.parseItem("#[outer] extern \"C\" { #![inner] }").attrs()));
    }

    @Test
    @DisplayName("members of traits and impls keep the same order")
    void testMembers() {
        TraitItem method = Parser.parseTraitItem("#[a] fn f() { #![b] }");
        assertEquals(List.of("a", "b"), names(method.attrs()));

        ImplItem implMethod = Parser.parseImplItem("#[a] #[b] pub fn f() { #![c] }");
        assertEquals(List.of("a", "b", "c"), names(implMethod.attrs()));

        ForeignItem foreign = Parser.parseForeignItem("#[link_name = \"x\"] pub fn f();");
        assertEquals(List.of("link_name"), names(foreign.attrs()));
    }

    @Test
    @DisplayName("doc comments are attributes in source order")
    void testDocComments() {
        Item item = Parser.parseItem("/// First\n#[derive(Debug)]\n/// Second\nstruct S;");
        assertEquals(List.of("doc", "derive", "doc"), names(item.attrs()));
    }

    @Test
    @DisplayName("printing puts inner attributes back inside the body")
    void testPrint() {
        String source = "#[a] #[b] pub fn f() { #![c] #![d] let x = 1; }";
        assertTrue(Printer.print(Parser.parseItem(source)).sameTokens(Lexer.tokenize(source)));

        String module = "#[outer] mod m { #![inner] fn g() {} }";
        assertTrue(Printer.print(Parser.parseItem(module)).sameTokens(Lexer.tokenize(module)));
    }
}
