package com.cellparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Writes literal values the way JavaScript prints them: integral numbers
 * without a fraction, non-finite numbers as null. Strings, booleans and the
 * empty regex value pass through unchanged.
 */
public class JavaScriptNumberSerializer extends JsonSerializer<Object> {

    // 2^53
    private static final double MAX_SAFE = 9007199254740992.0;

    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value instanceof Double d) {
            writeDouble(d, gen);
        } else if (value instanceof Float f) {
            writeDouble(f.doubleValue(), gen);
        } else if (value instanceof Integer || value instanceof Long) {
            gen.writeNumber(((Number) value).longValue());
        } else if (value instanceof BigInteger bi) {
            gen.writeNumber(bi);
        } else {
            serializers.defaultSerializeValue(value, gen);
        }
    }

    private static void writeDouble(double d, JsonGenerator gen) throws IOException {
        if (Double.isInfinite(d) || Double.isNaN(d)) {
            gen.writeNull();
        } else if (d == Math.rint(d) && Math.abs(d) <= MAX_SAFE) {
            gen.writeNumber((long) d);
        } else if (d == Math.rint(d) && Math.abs(d) < 1e21) {
            // Past 2^53 JavaScript still prints every integral digit
            gen.writeNumber(new BigDecimal(d).toBigInteger());
        } else {
            gen.writeNumber(d);
        }
    }
}
