package com.tsparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.math.BigInteger;

/**
 * Writes a numeric literal value the way JavaScript prints it: integral values
 * without a decimal point, NaN and infinities as null.
 */
public class NumberValueSerializer extends JsonSerializer<Double> {

    // 2^53; beyond it a double no longer holds every integer
    private static final double MAX_SAFE_INTEGER = 9007199254740992.0;

    @Override
    public void serialize(Double value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null || value.isNaN() || value.isInfinite()) {
            gen.writeNull();
        } else if (value == Math.floor(value) && Math.abs(value) <= MAX_SAFE_INTEGER) {
            gen.writeNumber(value.longValue());
        } else if (value == Math.floor(value) && Math.abs(value) < 1e21) {
            gen.writeNumber(new BigInteger(String.format("%.0f", value)));
        } else {
            gen.writeNumber(value);
        }
    }
}
