package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

import java.util.Optional;

/**
 * The initializer part of a declaration. {@link RequiredInitializer} is used by
 * {@code const}, {@link OptionalInitializer} by {@code let} and {@code var}; each
 * provides a static {@code fromReader} that parses the {@code = expression} tail.
 */
public sealed interface DeclarationExpression permits RequiredInitializer, OptionalInitializer {

    /** Writes {@code " = expr"} (or {@code "=expr"} in compact mode), or nothing when absent. */
    void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth);

    Optional<Span> declPosition();

    Optional<InitializerSlot> asMutableExpression();

    Optional<Expression> initializer();
}
