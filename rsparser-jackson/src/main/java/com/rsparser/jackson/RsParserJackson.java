package com.rsparser.jackson;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMappers that read and write syntax trees.
 *
 * <pre>
 * ObjectMapper mapper = RsParserJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(Parser.parseFile(source));
 * SourceFile file = mapper.readValue(json, SourceFile.class);
 * </pre>
 */
public final class RsParserJackson {

    private RsParserJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper for the syntax tree.
     *
     * The returned mapper:
     * - Writes records by their components only, so helpers such as isEmpty() are not properties
     * - Tags values of sealed types with a "type" property
     * - Leaves out absent (null) tokens
     * - Writes spans as [line, column, endLine, endColumn]
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Absent optional tokens are null; leave them out
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE);

        // Unit records such as Visibility.Inherited have no properties besides their type
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
