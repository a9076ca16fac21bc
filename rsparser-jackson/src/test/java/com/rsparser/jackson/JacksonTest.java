package com.rsparser.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rsparser.Parser;
import com.rsparser.Printer;
import com.rsparser.ast.*;
import com.rsparser.token.Lexer;
import com.rsparser.token.Span;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonTest {

    private static final String SOURCE = String.join("\n",
        "#![no_std]",
        "use core::{fmt, ops::Add as Plus};",
        "/// A counter",
        "#[derive(Debug)]",
        "pub struct Counter<'a, T: Copy = u8> where T: 'a { frame: &'a T, step: T }",
        "pub(crate) enum Mode { Fast, Slow(u8), Off = 3 }",
        "impl<'a, T: Copy> Counter<'a, T> {",
        "    pub fn tick(self.{mut frame, step}) -> T where T: Plus { *frame }",
        "    fn peek(&'a self) {}",
        "}",
        "extern \"C\" { fn printf(fmt: *const u8, ...) -> i32; }",
        "trait Tick: Sized { type Out; fn tick(&mut self) -> Self::Out; }",
        "macro_rules! tick { () => {} }",
        "");

    private final ObjectMapper mapper = RsParserJackson.createObjectMapper();

    @Test
    @DisplayName("a parsed file survives a trip through JSON")
    void testFileRoundTrip() throws Exception {
        SourceFile file = Parser.parseFile(SOURCE);
        String json = mapper.writeValueAsString(file);
        SourceFile read = mapper.readValue(json, SourceFile.class);

        assertEquals(file, read);
        assertTrue(Printer.print(read).sameTokens(Lexer.tokenize(SOURCE)));
    }

    @Test
    @DisplayName("sealed types are tagged with a type property")
    void testTypeTags() throws Exception {
        JsonNode tree = mapper.readTree(mapper.writeValueAsString(Parser.parseFile(SOURCE)));
        JsonNode items = tree.get("items");
        assertEquals("Use", items.get(0).get("type").asText());
        assertEquals("Struct", items.get(1).get("type").asText());
        assertEquals("Public", items.get(1).get("vis").get("type").asText());
        assertEquals("Named", items.get(1).get("fields").get("type").asText());
        assertEquals("Restricted", items.get(2).get("vis").get("type").asText());
        assertEquals("Impl", items.get(3).get("type").asText());

        JsonNode noStd = tree.get("attrs").get(0).get("tokens").get("trees").get(0);
        assertEquals("Ident", noStd.get("type").asText());
        assertEquals("no_std", noStd.get("name").asText());
    }

    @Test
    @DisplayName("helper accessors are not written as properties")
    void testNoHelperProperties() throws Exception {
        JsonNode item = mapper.readTree(mapper.writeValueAsString(Parser.parseItem("fn f(&self) {}")));
        JsonNode sig = item.get("sig");
        assertFalse(sig.has("receiver"));
        assertFalse(sig.get("inputs").has("empty"));
        assertFalse(sig.get("generics").get("params").has("empty"));
        assertEquals("Receiver", sig.get("inputs").get("values").get(0).get("type").asText());
        assertEquals("Full", sig.get("inputs").get("values").get(0).get("reference").get("type").asText());
    }

    @Test
    @DisplayName("spans are written as four numbers and absent tokens are left out")
    void testSpans() throws Exception {
        JsonNode item = mapper.readTree(mapper.writeValueAsString(Parser.parseItem("\nfn  main() {}")));
        JsonNode fnToken = item.get("sig").get("fnToken");
        assertTrue(fnToken.isArray());
        assertEquals(2, fnToken.get(0).asInt());
        assertEquals(0, fnToken.get(1).asInt());
        assertEquals(2, fnToken.get(3).asInt());
        assertFalse(item.get("sig").has("asyncness"));

        Span callSite = mapper.readValue("[0,0,0,0]", Span.class);
        assertSame(Span.CALL_SITE, callSite);
        Span read = mapper.readValue("[3,4,3,9]", Span.class);
        assertEquals(9, read.endColumn());
    }

    @Test
    @DisplayName("individual items and members can be read by their sealed type")
    void testPolymorphicRead() throws Exception {
        Item item = Parser.parseItem("pub fn f<T>(x: T, ...) {}");
        Item read = mapper.readValue(mapper.writeValueAsString(item), Item.class);
        assertInstanceOf(ItemFn.class, read);
        assertEquals(item, read);

        ImplItem member = Parser.parseImplItem("fn tick(self.{mut a}) {}");
        ImplItem readMember = mapper.readValue(mapper.writeValueAsString(member), ImplItem.class);
        Receiver receiver = (Receiver) ((ImplItemMethod) readMember).sig().receiver();
        Reference.Partial partial = assertInstanceOf(Reference.Partial.class, receiver.reference());
        assertNotNull(partial.borrows().borrows().get(0).mutability());

        DeriveInput input = Parser.parseDeriveInput("union U { a: u8 }");
        assertEquals(input, mapper.readValue(mapper.writeValueAsString(input), DeriveInput.class));
    }

    @Test
    @DisplayName("unknown properties are ignored")
    void testUnknownProperties() throws Exception {
        String json = "{\"type\":\"Name\",\"ident\":{\"type\":\"Ident\",\"name\":\"io\",\"span\":[1,4,1,6]},\"extra\":true}";
        UseTree tree = mapper.readValue(json, UseTree.class);
        UseTree.UseName name = assertInstanceOf(UseTree.UseName.class, tree);
        assertEquals("io", name.ident().name());
    }
}
