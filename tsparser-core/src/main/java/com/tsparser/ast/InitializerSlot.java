package com.tsparser.ast;

/**
 * Read/write access to a declaration's initializer, for passes that rewrite it in place.
 */
public interface InitializerSlot {

    Expression get();

    void set(Expression expression);
}
