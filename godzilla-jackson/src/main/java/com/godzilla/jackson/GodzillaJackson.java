package com.godzilla.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for AST serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = GodzillaJackson.createObjectMapper();
 * File file = mapper.readValue(json, File.class);
 * String json = mapper.writeValueAsString(file);
 * </pre>
 */
public final class GodzillaJackson {

    private GodzillaJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for AST serialization/deserialization.
     *
     * The returned mapper:
     * - Handles polymorphic Node types via the "type" property
     * - Ignores properties the AST does not model (comments, directives, errors, ...)
     * - Rejects trailing content after the document
     * - Rejects scalars of the wrong JSON type (no "10" for an int, 5 for a string, 1.7 for an int)
     * - Serializes null values only for fields that can be null in the AST
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Exclude null values by default; VariableDeclarator.init is kept via AstModule
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

        // Strict scalars: ints and booleans only from JSON numbers and booleans
        mapper.configure(MapperFeature.ALLOW_COERCION_OF_SCALARS, false);
        mapper.configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);
        mapper.coercionConfigFor(LogicalType.Textual)
            .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
            .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
            .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
