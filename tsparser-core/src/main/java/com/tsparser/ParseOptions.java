package com.tsparser;

/**
 * Immutable settings for lexing and parsing.
 *
 * @param comments               keep block comments as tokens so they can be attached to
 *                               binding names; when false they are dropped by the lexer
 * @param recordKeywordPositions record the span of each declaration keyword in {@link ParsingState}
 */
public record ParseOptions(boolean comments, boolean recordKeywordPositions) {

    public static final ParseOptions DEFAULT = new ParseOptions(true, false);

    public ParseOptions withComments(boolean comments) {
        return new ParseOptions(comments, recordKeywordPositions);
    }

    public ParseOptions withRecordKeywordPositions(boolean recordKeywordPositions) {
        return new ParseOptions(comments, recordKeywordPositions);
    }
}
