package com.godzilla.json;

import com.godzilla.ast.File;
import com.godzilla.ast.Node;

import java.io.InputStream;

/**
 * Interface for deserializing AST nodes from JSON.
 *
 * <p>Decoding is all or nothing: any unknown node type, missing {@code type}
 * property, malformed structure or missing mandatory child fails the whole
 * document with an {@link AstJsonException}. A partial tree is never returned.</p>
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a JSON string to a File (root AST node).
     *
     * @param json the JSON string to deserialize
     * @return the deserialized File
     * @throws AstJsonException if deserialization fails
     */
    File deserializeFile(String json) throws AstJsonException;

    /**
     * Deserializes a File from a UTF-8 JSON stream. The stream is not closed.
     *
     * @param json the stream to read
     * @return the deserialized File
     * @throws AstJsonException if reading or deserialization fails
     */
    File deserializeFile(InputStream json) throws AstJsonException;

    /**
     * Deserializes a JSON string to a specific AST node type.
     *
     * @param json the JSON string to deserialize
     * @param type the expected node type
     * @param <T> the node type
     * @return the deserialized node
     * @throws AstJsonException if deserialization fails
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
