package com.tsparser;

public final class StringSourceWriter implements SourceWriter {

    private final StringBuilder buffer = new StringBuilder();

    @Override
    public void push(char c) {
        buffer.append(c);
    }

    @Override
    public void pushString(String s) {
        buffer.append(s);
    }

    public int length() {
        return buffer.length();
    }

    @Override
    public String toString() {
        return buffer.toString();
    }
}
