package com.rsparser;

import com.rsparser.ast.*;
import com.rsparser.token.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DeriveInputTest {

    @Test
    @DisplayName("struct input keeps attributes, visibility and generics")
    void testStruct() {
        String source = "#[derive(Debug)] pub struct Point<T> where T: Copy { x: T, y: T }";
        DeriveInput input = Parser.parseDeriveInput(source);
        assertEquals("Point", input.ident().name());
        assertEquals(1, input.attrs().size());
        assertInstanceOf(Visibility.Public.class, input.vis());
        assertNotNull(input.generics().whereClause());

        Data.DataStruct data = assertInstanceOf(Data.DataStruct.class, input.data());
        assertInstanceOf(FieldsNamed.class, data.fields());
        assertNull(data.semi());
    }

    @Test
    @DisplayName("enum and union inputs")
    void testEnumAndUnion() {
        Data.DataEnum data = assertInstanceOf(Data.DataEnum.class,
            Parser.parseDeriveInput("enum Op { Add, Sub(i32) }").data());
        assertEquals(2, data.variants().size());

        Data.DataUnion union = assertInstanceOf(Data.DataUnion.class,
            Parser.parseDeriveInput("#[repr(C)] union Bits { f: f32, u: u32 }").data());
        assertEquals(2, union.fields().named().size());
    }

    @Test
    @DisplayName("conversion to and from items is lossless")
    void testItemConversion() {
        String[] sources = {
            "#[derive(Clone)] pub(crate) struct Unit;",
            "struct Tuple<'a>(&'a str, u8) where u8: Copy;",
            "enum E<T> { A(T), B { x: u8 } = 2, }",
            "union U { a: u8 }",
        };
        for (String source : sources) {
            Item item = Parser.parseItem(source);
            DeriveInput input = DeriveInput.fromItem(item);
            assertEquals(item, input.toItem(), source);
            assertEquals(input, Parser.parseDeriveInput(source), source);
            assertTrue(Printer.print(input).sameTokens(Lexer.tokenize(source)), source);
        }
    }

    @Test
    @DisplayName("other items are not derive inputs")
    void testRejectsOtherItems() {
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class,
            () -> Parser.parseDeriveInput("fn f() {}"));
        assertEquals("expected one of: `struct`, `enum`, `union`", e.getRawMessage());

        IllegalArgumentException projection = assertThrows(IllegalArgumentException.class,
            () -> DeriveInput.fromItem(Parser.parseItem("trait T {}")));
        assertEquals("expected struct, enum or union, found trait", projection.getMessage());
    }
}
