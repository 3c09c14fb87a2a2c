package com.spendings.backend.mappers;

import java.io.IOException;
import java.time.Instant;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;

/**
 * Request timestamps: same ISO-8601 forms accepted when reading stored text, so a value without an
 * offset is UTC and a bare date is UTC midnight.
 */
public class TimestampDeserializer extends StdScalarDeserializer<Instant> {

    public TimestampDeserializer() {
        super(Instant.class);
    }

    @Override
    public Instant deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        String text = parser.getValueAsString();
        if (text == null) {
            return (Instant) ctxt.handleUnexpectedToken(Instant.class, parser);
        }
        return DocumentValues.parseTimestamp(text)
                .orElseThrow(() -> ctxt.weirdStringException(text, Instant.class, "expected an ISO-8601 date or date-time"));
    }
}
