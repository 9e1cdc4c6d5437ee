package com.tsparser.jackson;

import com.tsparser.Parser;
import com.tsparser.json.AstJsonProvider;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    @Test
    void testProviderDiscovered() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        AstJsonProvider provider = AstJsonProvider.getProvider();
        assertInstanceOf(JacksonAstJsonProvider.class, provider);
        assertEquals("Jackson", provider.getName());
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider("jackson"));
    }

    @Test
    void testUnknownProviderName() {
        assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("gson"));
    }

    @Test
    void testSerialize() {
        String json = AstJsonProvider.getProvider().getSerializer().serialize(Parser.parse("let a = 1"));
        assertTrue(json.contains("\"type\":\"Program\""));
        assertFalse(json.contains("\n"));
    }

    @Test
    void testSerializePretty() {
        String json = AstJsonProvider.getProvider().getSerializer()
            .serializePretty(Parser.parseVariableStatement("const a = 1"));
        assertTrue(json.contains("\"type\" : \"VariableStatement\""));
        assertTrue(json.contains("\n"));
    }
}
