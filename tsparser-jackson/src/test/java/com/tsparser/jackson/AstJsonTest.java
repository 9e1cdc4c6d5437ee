package com.tsparser.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsparser.Parser;
import com.tsparser.ast.AstNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AstJsonTest {

    private static final ObjectMapper mapper = TsParserJackson.createObjectMapper();

    private static JsonNode toTree(AstNode node) throws Exception {
        String json = mapper.writeValueAsString(node);
        System.out.println(json);
        return mapper.readTree(json);
    }

    @Test
    void testVariableStatementJson() throws Exception {
        JsonNode statement = toTree(Parser.parseVariableStatement("let x: number = 1, y"));

        assertEquals("VariableStatement", statement.get("type").asText());
        assertEquals(0, statement.get("start").asInt());
        assertEquals(20, statement.get("end").asInt());

        JsonNode keyword = statement.get("keyword");
        assertEquals("VariableKeyword", keyword.get("type").asText());
        assertEquals("LET", keyword.get("kind").asText());
        assertEquals(3, keyword.get("end").asInt());

        JsonNode declarations = statement.get("declarations");
        assertEquals(2, declarations.size());

        JsonNode first = declarations.get(0);
        assertEquals("VariableDeclaration", first.get("type").asText());
        assertEquals("x", first.get("name").get("item").get("name").asText());
        assertEquals("NamedType", first.get("typeReference").get("type").asText());
        assertEquals("number", first.get("typeReference").get("name").asText());
        assertEquals("NumberLiteral", first.get("expression").get("type").asText());
        assertEquals(16, first.get("expression").get("start").asInt());
    }

    @Test
    void testAbsentInitializerAndTypeWrittenAsNull() throws Exception {
        JsonNode declaration = toTree(Parser.parseVariableStatement("let y")).get("declarations").get(0);
        assertTrue(declaration.has("expression"));
        assertTrue(declaration.get("expression").isNull());
        assertTrue(declaration.has("typeReference"));
        assertTrue(declaration.get("typeReference").isNull());
    }

    @Test
    void testDerivedAccessorsHidden() throws Exception {
        JsonNode statement = toTree(Parser.parseVariableStatement("const a = 1"));
        assertFalse(statement.has("span"));
        assertFalse(statement.has("position"));
        assertFalse(statement.has("constant"));
        assertFalse(statement.get("keyword").has("span"));
    }

    @Test
    void testNumberValues() throws Exception {
        JsonNode integral = toTree(Parser.parseVariableStatement("let n = 42"))
            .get("declarations").get(0).get("expression");
        assertTrue(integral.get("value").isIntegralNumber());
        assertEquals(42, integral.get("value").asLong());
        assertEquals("42", integral.get("raw").asText());

        JsonNode fraction = toTree(Parser.parseVariableStatement("let f = 1.5"))
            .get("declarations").get(0).get("expression");
        assertEquals(1.5, fraction.get("value").asDouble());
    }

    @Test
    void testCommentAndPatternJson() throws Exception {
        JsonNode name = toTree(Parser.parseVariableStatement("let /* pair */ [a, b = 2] = xs"))
            .get("declarations").get(0).get("name");
        assertEquals("WithComment", name.get("type").asText());
        assertEquals(" pair ", name.get("comment").asText());
        JsonNode pattern = name.get("item");
        assertEquals("ArrayDestructuring", pattern.get("type").asText());
        JsonNode second = pattern.get("members").get(1);
        assertEquals("ArrayDestructuringElement", second.get("type").asText());
        assertEquals("NumberLiteral", second.get("defaultValue").get("type").asText());
        assertFalse(pattern.get("members").get(0).has("defaultValue"));
    }

    @Test
    void testProgramJson() throws Exception {
        JsonNode program = toTree(Parser.parse("var a = 1;\nf(a);"));
        assertEquals("Program", program.get("type").asText());
        assertEquals(16, program.get("end").asInt());
        assertEquals(2, program.get("body").size());
        JsonNode call = program.get("body").get(1).get("expression");
        assertEquals("CallExpression", call.get("type").asText());
        assertEquals("a", call.get("arguments").get(0).get("name").asText());
    }
}
