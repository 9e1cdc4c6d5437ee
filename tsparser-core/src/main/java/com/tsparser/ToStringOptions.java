package com.tsparser;

/**
 * Immutable settings for turning AST nodes back into source text.
 *
 * @param pretty                 insert spaces around operators and after commas
 * @param includeTypeAnnotations emit {@code : Type} annotations
 * @param includeComments        emit comments attached to binding names
 */
public record ToStringOptions(boolean pretty, boolean includeTypeAnnotations, boolean includeComments) {

    public static final ToStringOptions PRETTY = new ToStringOptions(true, true, true);
    public static final ToStringOptions COMPACT = new ToStringOptions(false, true, true);

    public ToStringOptions withPretty(boolean pretty) {
        return new ToStringOptions(pretty, includeTypeAnnotations, includeComments);
    }

    public ToStringOptions withTypeAnnotations(boolean includeTypeAnnotations) {
        return new ToStringOptions(pretty, includeTypeAnnotations, includeComments);
    }

    public ToStringOptions withComments(boolean includeComments) {
        return new ToStringOptions(pretty, includeTypeAnnotations, includeComments);
    }

    /** Writes the space that separates list items in pretty mode. */
    public void addGap(SourceWriter buf) {
        if (pretty) {
            buf.push(' ');
        }
    }

    /** An operator surrounded by spaces in pretty mode, bare otherwise. */
    public String spaced(String operator) {
        return pretty ? " " + operator + " " : operator;
    }
}
