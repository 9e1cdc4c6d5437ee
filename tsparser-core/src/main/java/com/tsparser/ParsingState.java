package com.tsparser;

import com.tsparser.ast.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable context owned by a single parse.
 */
public final class ParsingState {

    public record KeywordPosition(TokenType keyword, Span span) {}

    private final int sourceLength;
    private final List<KeywordPosition> keywordPositions = new ArrayList<>();

    public ParsingState(int sourceLength) {
        this.sourceLength = sourceLength;
    }

    public int getSourceLength() {
        return sourceLength;
    }

    public void recordKeyword(TokenType keyword, Span span) {
        keywordPositions.add(new KeywordPosition(keyword, span));
    }

    /** Keywords recorded so far, in source order. */
    public List<KeywordPosition> getKeywordPositions() {
        return Collections.unmodifiableList(keywordPositions);
    }
}
