package com.rsparser.jackson;

import com.rsparser.ParseException;
import com.rsparser.Parser;
import com.rsparser.ast.Item;
import com.rsparser.ast.SourceFile;
import com.rsparser.ast.TraitItem;
import com.rsparser.ast.TraitItemMethod;
import com.rsparser.json.AstJsonException;
import com.rsparser.json.AstJsonProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AstJsonProviderTest {

    @Test
    @DisplayName("the Jackson provider is found on the classpath")
    void testDiscovery() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider());
        assertEquals("Jackson", AstJsonProvider.getProvider("jackson").getName());

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("Gson"));
        assertTrue(e.getMessage().contains("'Gson'"));
    }

    @Test
    @DisplayName("serialize and deserialize through the provider interfaces")
    void testRoundTrip() {
        AstJsonProvider provider = AstJsonProvider.getProvider();
        SourceFile file = Parser.parseFile("mod a { pub const X: u8 = 1; }\nstruct S(u8);");

        String json = provider.getSerializer().serialize(file);
        assertEquals(file, provider.getDeserializer().deserializeFile(json));

        String pretty = provider.getSerializer().serializePretty(file);
        assertTrue(pretty.contains("\n"));
        assertEquals(file, provider.getDeserializer().deserializeFile(pretty));
        System.out.println(pretty);

        TraitItem member = Parser.parseTraitItem("fn len(&self) -> usize;");
        String memberJson = provider.getSerializer().serialize(member);
        assertInstanceOf(TraitItemMethod.class, provider.getDeserializer().deserialize(memberJson, TraitItem.class));
    }

    @Test
    @DisplayName("source text is parsed before it is serialized")
    void testSerializeSource() {
        AstJsonProvider provider = AstJsonProvider.getProvider();
        String source = "impl Counter { fn bump(self.{mut count}) {} }";

        String json = provider.getSerializer().serializeSource(source);
        assertEquals(Parser.parseFile(source), provider.getDeserializer().deserializeFile(json));

        assertThrows(ParseException.class, () -> provider.getSerializer().serializeSource("struct {"));
    }

    @Test
    @DisplayName("malformed JSON is reported as AstJsonException")
    void testMalformed() {
        AstJsonProvider provider = AstJsonProvider.getProvider();
        AstJsonException e = assertThrows(AstJsonException.class,
            () -> provider.getDeserializer().deserialize("{\"type\":\"Closure\"}", Item.class));
        assertEquals("Failed to deserialize Item", e.getMessage());
        assertNotNull(e.getCause());

        assertThrows(AstJsonException.class, () -> provider.getDeserializer().deserializeFile("{\"items\": 5"));
    }
}
