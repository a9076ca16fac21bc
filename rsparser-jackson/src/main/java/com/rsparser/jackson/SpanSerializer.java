package com.rsparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.rsparser.token.Span;

import java.io.IOException;

/**
 * Writes a span as the array {@code [line, column, endLine, endColumn]}. Spans appear on
 * nearly every token, so the object form would dominate the output.
 */
public class SpanSerializer extends JsonSerializer<Span> {
    @Override
    public void serialize(Span span, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeStartArray();
        gen.writeNumber(span.line());
        gen.writeNumber(span.column());
        gen.writeNumber(span.endLine());
        gen.writeNumber(span.endColumn());
        gen.writeEndArray();
    }
}
