package com.questrail.hamgateway.protocol.n1mm;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;

import java.io.IOException;

/**
 * Reads a decimal element that localized N1MM installations may write with a
 * comma separator ({@code 14,0}) instead of a dot.
 */
public final class N1mmDecimalDeserializer extends StdScalarDeserializer<Double>
{
    public N1mmDecimalDeserializer()
    {
        super(Double.class);
    }

    @Override
    public Double deserialize(JsonParser p, DeserializationContext ctxt) throws IOException
    {
        String text = p.getValueAsString();
        if (text == null || text.isBlank()) {
            return 0.0d;
        }
        try {
            return Double.parseDouble(text.trim().replace(',', '.'));
        } catch (NumberFormatException e) {
            return (Double) ctxt.handleWeirdStringValue(Double.class, text, "not a decimal number");
        }
    }

    @Override
    public Double getNullValue(DeserializationContext ctxt)
    {
        return 0.0d;
    }
}
