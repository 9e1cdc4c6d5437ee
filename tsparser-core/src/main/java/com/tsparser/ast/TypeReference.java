package com.tsparser.ast;

import com.tsparser.ParseOptions;
import com.tsparser.ParsingState;
import com.tsparser.TokenReader;
import com.tsparser.TypeReferenceParser;

/**
 * A type annotation.
 */
public sealed interface TypeReference extends AstNode permits
    NamedType,
    ArrayType,
    UnionType,
    IntersectionType,
    LiteralType,
    TupleType,
    ParenthesizedType {

    static TypeReference fromReader(TokenReader reader, ParsingState state, ParseOptions options) {
        return new TypeReferenceParser(reader).parse();
    }
}
