package com.tsparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.tsparser.ast.DeclarationExpression;
import com.tsparser.ast.Expression;

import java.io.IOException;
import java.util.Optional;

/**
 * Writes an initializer strategy as the expression it holds, or null when absent.
 */
public class DeclarationExpressionSerializer extends StdSerializer<DeclarationExpression> {

    public DeclarationExpressionSerializer() {
        super(DeclarationExpression.class);
    }

    @Override
    public void serialize(DeclarationExpression value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
        Optional<Expression> initializer = value.initializer();
        if (initializer.isPresent()) {
            provider.defaultSerializeValue(initializer.get(), gen);
        } else {
            gen.writeNull();
        }
    }
}
