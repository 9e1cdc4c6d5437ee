package com.tsparser;

/**
 * Append-only sink for serialized source text.
 */
public interface SourceWriter {

    void push(char c);

    void pushString(String s);
}
