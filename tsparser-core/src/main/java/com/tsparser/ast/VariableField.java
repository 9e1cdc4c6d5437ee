package com.tsparser.ast;

import com.tsparser.ParseOptions;
import com.tsparser.ParsingState;
import com.tsparser.PatternParser;
import com.tsparser.TokenReader;

/**
 * The binding target of a declaration: a plain name or a destructuring pattern.
 */
public sealed interface VariableField extends AstNode permits Identifier, ArrayDestructuring, ObjectDestructuring {

    static VariableField fromReader(TokenReader reader, ParsingState state, ParseOptions options) {
        return PatternParser.parseField(reader, state, options);
    }
}
