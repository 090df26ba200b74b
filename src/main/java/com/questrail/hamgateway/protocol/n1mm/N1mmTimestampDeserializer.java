package com.questrail.hamgateway.protocol.n1mm;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/**
 * Reads an N1MM {@code <timestamp>} element; see {@link N1mmTimestamps}.
 */
public final class N1mmTimestampDeserializer extends StdScalarDeserializer<LocalDateTime>
{
    public N1mmTimestampDeserializer()
    {
        super(LocalDateTime.class);
    }

    @Override
    public LocalDateTime deserialize(JsonParser p, DeserializationContext ctxt) throws IOException
    {
        String text = p.getValueAsString();
        if (text == null || text.isBlank()) {
            return (LocalDateTime) ctxt.handleWeirdStringValue(LocalDateTime.class, String.valueOf(text),
                "empty N1MM timestamp");
        }
        try {
            return N1mmTimestamps.parse(text);
        } catch (DateTimeParseException e) {
            return (LocalDateTime) ctxt.handleWeirdStringValue(LocalDateTime.class, text,
                "expected 'yyyy-MM-dd HH:mm:ss' or 'yyyy-MM-ddTHH:mm:ss'");
        }
    }
}
