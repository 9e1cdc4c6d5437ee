package com.tsparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for ObjectMappers configured to write syntax trees.
 *
 * <pre>
 * ObjectMapper mapper = TsParserJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(Parser.parse("let x: number = 1"));
 * </pre>
 */
public final class TsParserJackson {

    private TsParserJackson() {
    }

    /**
     * A new mapper that writes every node with {@code type}, {@code start} and {@code end},
     * leaves out absent optional fields except initializers and type annotations, and writes
     * numeric literal values the way JavaScript prints them.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // Absent fields are omitted unless a mixin in AstModule says otherwise
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.registerModule(new AstModule());
        return mapper;
    }
}
