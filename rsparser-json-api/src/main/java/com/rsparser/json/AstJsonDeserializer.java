package com.rsparser.json;

import com.rsparser.ast.Node;
import com.rsparser.ast.SourceFile;

/**
 * Reads syntax tree nodes back from JSON written by an {@link AstJsonSerializer}.
 */
public interface AstJsonDeserializer {

    /**
     * Reads a whole source file.
     *
     * @throws AstJsonException if the JSON does not describe a source file
     */
    SourceFile deserializeFile(String json) throws AstJsonException;

    /**
     * Reads a node of the given type, for example an {@code Item} or a {@code Signature}.
     * Sealed node interfaces are resolved through the {@code type} property.
     *
     * @throws AstJsonException if the JSON does not describe a {@code type}
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
