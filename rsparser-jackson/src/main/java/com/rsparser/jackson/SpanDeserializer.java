package com.rsparser.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.rsparser.token.Span;

import java.io.IOException;

/**
 * Reads the array form written by {@link SpanSerializer}. An all-zero span is
 * {@link Span#CALL_SITE} itself, since span joining checks for it by identity.
 */
public class SpanDeserializer extends JsonDeserializer<Span> {
    @Override
    public Span deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() != JsonToken.START_ARRAY) {
            return (Span) ctxt.handleUnexpectedToken(Span.class, p);
        }
        int[] values = new int[4];
        for (int i = 0; i < values.length; i++) {
            if (p.nextToken() != JsonToken.VALUE_NUMBER_INT) {
                return (Span) ctxt.handleUnexpectedToken(Span.class, p);
            }
            values[i] = p.getIntValue();
        }
        if (p.nextToken() != JsonToken.END_ARRAY) {
            ctxt.reportInputMismatch(Span.class, "span must have exactly 4 numbers");
        }
        if (values[0] == 0 && values[1] == 0 && values[2] == 0 && values[3] == 0) {
            return Span.CALL_SITE;
        }
        return new Span(values[0], values[1], values[2], values[3]);
    }
}
