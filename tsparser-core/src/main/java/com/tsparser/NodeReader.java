package com.tsparser;

/**
 * A parse function of the shape every {@code fromReader} method shares.
 */
@FunctionalInterface
public interface NodeReader<T> {
    T read(TokenReader reader, ParsingState state, ParseOptions options);
}
