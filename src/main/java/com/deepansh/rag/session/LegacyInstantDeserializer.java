package com.deepansh.rag.session;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Instant;

/**
 * Reads session timestamps written either as ISO-8601 strings or as legacy
 * epoch-second numbers. Delegates the conversion to {@link SessionTimestamps}.
 */
public class LegacyInstantDeserializer extends JsonDeserializer<Instant> {

    @Override
    public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        try {
            if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
                return SessionTimestamps.toInstant(p.getDecimalValue(), null);
            }
            if (token == JsonToken.VALUE_STRING) {
                return SessionTimestamps.toInstant(p.getText(), null);
            }
        } catch (IllegalArgumentException e) {
            return (Instant) ctxt.handleWeirdStringValue(Instant.class, p.getText(), e.getMessage());
        }
        return (Instant) ctxt.handleUnexpectedToken(Instant.class, p);
    }
}
