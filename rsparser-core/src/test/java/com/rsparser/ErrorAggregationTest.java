package com.rsparser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ErrorAggregationTest {

    @Test
    @DisplayName("an unknown item keyword lists every item form that was tried")
    void testUnknownItem() {
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class,
            () -> Parser.parseItem("impure fn f() {}"));
        System.out.println("Error: " + e.getMessage());

        assertTrue(e.getRawMessage().startsWith("expected one of: "));
        for (String alternative : new String[] {
            "`pub`", "`extern`", "`use`", "`static`", "`const`", "`unsafe`", "`async`", "`fn`", "`mod`",
            "`type`", "`struct`", "`enum`", "`union`", "`trait`", "`impl`", "`macro`", "macro invocation"}) {
            assertTrue(e.getExpected().contains(alternative), alternative);
        }
        assertEquals(1, e.getSpan().line());
        assertEquals(0, e.getSpan().column());
    }

    @Test
    @DisplayName("pub is not offered once a visibility has been read")
    void testVisibilityAlreadyRead() {
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class,
            () -> Parser.parseItem("pub impure fn f() {}"));
        assertFalse(e.getExpected().contains("`pub`"));
        assertFalse(e.getExpected().contains("macro invocation"));
        assertEquals(4, e.getSpan().column());
    }

    @Test
    @DisplayName("after extern, the alternatives are crate, fn, a block or an ABI string")
    void testAfterExtern() {
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class,
            () -> Parser.parseItem("extern 5"));
        assertEquals(4, e.getExpected().size());
        assertTrue(e.getExpected().contains("`crate`"));
        assertTrue(e.getExpected().contains("`fn`"));
        assertTrue(e.getExpected().contains("curly braces"));
        assertTrue(e.getExpected().contains("string literal"));
    }

    @Test
    @DisplayName("running out of input is reported as such")
    void testEndOfInput() {
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class, () -> Parser.parseItem("struct"));
        assertEquals("unexpected end of input, expected identifier", e.getRawMessage());

        ExpectedTokenException body = assertThrows(ExpectedTokenException.class, () -> Parser.parseItem("struct S"));
        assertTrue(body.getRawMessage().startsWith("unexpected end of input, expected one of: "));
    }

    @Test
    @DisplayName("entry points reject trailing tokens")
    void testTrailingTokens() {
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class,
            () -> Parser.parseItem("fn f() {} fn g() {}"));
        assertEquals("unexpected token", e.getRawMessage());
        assertEquals(10, e.getSpan().column());
    }

    @Test
    @DisplayName("errors inside a group point into the group")
    void testErrorInsideGroup() {
        ParseException e = assertThrows(ParseException.class,
            () -> Parser.parseItem("struct S {\n    x u8,\n}"));
        assertEquals(ParseException.SYNTAX_ERROR, e.getErrorType());
        assertEquals(2, e.getSpan().line());
        assertTrue(e.getMessage().startsWith("SyntaxError at line 2, column 6:"), e.getMessage());
    }

    @Test
    @DisplayName("impl members require a body")
    void testImplMethodWithoutBody() {
        assertThrows(ParseException.class, () -> Parser.parseImplItem("fn f();"));
    }

    @Test
    @DisplayName("lex errors surface through the parser entry points")
    void testLexError() {
        ParseException e = assertThrows(ParseException.class, () -> Parser.parseFile("fn f() {"));
        assertEquals(ParseException.LEX_ERROR, e.getErrorType());
    }
}
