package com.tsparser.json;

import com.tsparser.ast.AstNode;

/**
 * Writes a syntax tree as JSON. Every node object carries {@code type},
 * {@code start} and {@code end} ahead of its own fields.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if the tree cannot be written
     */
    String serialize(AstNode node) throws AstJsonException;

    /** Same as {@link #serialize(AstNode)} with indentation. */
    String serializePretty(AstNode node) throws AstJsonException;
}
