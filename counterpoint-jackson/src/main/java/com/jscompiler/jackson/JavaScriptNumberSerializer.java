package com.jscompiler.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Writes literal values the way JavaScript prints numbers: integral doubles without a
 * decimal point, and non-finite values as null.
 */
public class JavaScriptNumberSerializer extends JsonSerializer<Object> {

    private static final double MAX_SAFE_INTEGER = 9007199254740992.0;

    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Double d) {
            if (d.isInfinite() || d.isNaN()) {
                gen.writeNull();
            } else if (d == Math.floor(d) && Math.abs(d) <= MAX_SAFE_INTEGER) {
                gen.writeNumber(d.longValue());
            } else {
                gen.writeNumber(d);
            }
        } else if (value instanceof Integer i) {
            gen.writeNumber(i);
        } else if (value instanceof Long l) {
            gen.writeNumber(l);
        } else if (value instanceof Number n) {
            gen.writeNumber(n.doubleValue());
        } else if (value instanceof Boolean b) {
            gen.writeBoolean(b);
        } else if (value instanceof String s) {
            gen.writeString(s);
        } else {
            gen.writeObject(value);
        }
    }
}
