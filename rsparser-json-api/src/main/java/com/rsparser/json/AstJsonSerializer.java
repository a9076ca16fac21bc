package com.rsparser.json;

import com.rsparser.Parser;
import com.rsparser.ast.Node;

/**
 * Writes syntax tree nodes as JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a node, including every token span it holds.
     *
     * @throws AstJsonException if the node cannot be written
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Like {@link #serialize(Node)}, indented for reading.
     */
    String serializePretty(Node node) throws AstJsonException;

    /**
     * Parses {@code source} as a file and serializes the resulting tree.
     *
     * @throws com.rsparser.ParseException if the source does not parse
     */
    default String serializeSource(String source) throws AstJsonException {
        return serialize(Parser.parseFile(source));
    }
}
