package com.cellparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Creates {@link ObjectMapper}s configured for cell ASTs.
 *
 * <pre>
 * ObjectMapper mapper = CellJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(CellParsing.parseCell("x = 1"));
 * </pre>
 */
public final class CellJackson {

    private CellJackson() {
    }

    /**
     * Returns a new mapper that writes nodes as ESTree JSON: a {@code type}
     * and a {@code loc} on every node, null members left out except where
     * ESTree always writes them, and numbers formatted the JavaScript way.
     * Value records such as {@code Span} can be read back with it.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.registerModule(new AstModule());
        return mapper;
    }
}
